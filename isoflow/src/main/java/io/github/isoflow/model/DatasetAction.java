package io.github.isoflow.model;

/**
 * Actions that can be dispatched for a dataset.
 */
public enum DatasetAction {
  ADD,
  UPDATE,
  DELETE
}
