package io.github.isoflow.model;

import org.immutables.value.Value;

/**
 * A classified request to run an action for a dataset.
 */
@Value.Immutable
public interface ActionIntent {

  Dataset dataset();

  DatasetAction action();

  @Value.Default
  default ActionPriority priority() {
    return ActionPriority.DEFAULT;
  }

  /**
   * Delete existing results before adding.
   *
   * @return true to delete first
   */
  @Value.Default
  default boolean delFirst() {
    return false;
  }

  /**
   * Also delete the raw input data on delete.
   *
   * @return true to delete raw data
   */
  @Value.Default
  default boolean delRawData() {
    return false;
  }

}
