package io.github.isoflow.model;

/**
 * Selects the action dispatcher implementation.
 */
public enum DispatchMode {

  /**
   * Execute actions in process. Used by workers.
   */
  DIRECT,

  /**
   * Publish actions to the priority queue. Used by the front facing API.
   */
  QUEUED
}
