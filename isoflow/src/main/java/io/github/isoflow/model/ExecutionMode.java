package io.github.isoflow.model;

/**
 * How the surrounding deployment runs actions.
 */
public enum ExecutionMode {

  /**
   * Everything runs in one process, status notifications are not published.
   */
  LOCAL,

  /**
   * Actions travel through the priority queue and status changes are published.
   */
  QUEUE
}
