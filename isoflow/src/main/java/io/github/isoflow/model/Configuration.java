package io.github.isoflow.model;

import io.github.isoflow.dbu.model.Database;
import java.util.List;
import org.immutables.value.Value;

/**
 * Runtime configuration, passed explicitly into the component.
 */
@Value.Immutable
public interface Configuration {

  /**
   * Database the core stores datasets, jobs and derived images in.
   *
   * @return the database
   */
  Database database();

  /**
   * Execution mode of the deployment.
   *
   * @return the execution mode
   */
  @Value.Default
  default ExecutionMode executionMode() {
    return ExecutionMode.LOCAL;
  }

  /**
   * Zoom levels generated when none are requested.
   *
   * @return the zoom levels
   */
  @Value.Default
  default List<Integer> opticalZoomLevels() {
    return List.of(1, 2, 4, 8);
  }

  /**
   * Size of the pool resampling optical images.
   *
   * @return the thread count
   */
  @Value.Default
  default int opticalImageThreads() {
    return 2;
  }

  /**
   * When true, removing a molecular database from a dataset config with nothing else
   * changed triggers a reindex, which drops the results of the removed database.
   * Off by default: such a change is otherwise ignored.
   *
   * @return true to reindex
   */
  @Value.Default
  default boolean reindexOnRemovedMolDb() {
    return false;
  }

  @Value.Check
  default void check() {
    if (opticalImageThreads() < 1) {
      throw new IllegalStateException("opticalImageThreads must be positive");
    }
  }

}
