package io.github.isoflow.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.List;
import org.immutables.value.Value;

/**
 * A dataset as stored in the dataset table.
 */
@Value.Immutable
public interface Dataset {

  /**
   * External id, never changes once assigned.
   *
   * @return the id
   */
  String id();

  /**
   * Name.
   *
   * @return the name
   */
  String name();

  /**
   * Location of the raw input data.
   *
   * @return the input path
   */
  String inputPath();

  /**
   * Upload date.
   *
   * @return the upload date
   */
  Instant uploadDate();

  /**
   * Free form metadata document.
   *
   * @return the metadata
   */
  ObjectNode metadata();

  /**
   * Processing configuration: isotope generation parameters plus the ordered
   * {@code databases} selection.
   *
   * @return the config
   */
  ObjectNode config();

  /**
   * Status.
   *
   * @return the status
   */
  @Value.Default
  default DatasetStatus status() {
    return DatasetStatus.NEW;
  }

  /**
   * Visibility flag.
   *
   * @return true if public
   */
  @Value.Default
  default boolean isPublic() {
    return true;
  }

  /**
   * Names of the molecular databases bound to the dataset.
   *
   * @return the mol dbs
   */
  List<String> molDbs();

  @Value.Check
  default void check() {
    if (id().isBlank()) {
      throw new IllegalStateException("Dataset id must not be blank");
    }
  }

}
