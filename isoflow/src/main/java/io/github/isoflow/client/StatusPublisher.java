package io.github.isoflow.client;

import io.github.isoflow.model.StatusMessage;

/**
 * Fire and forget channel for dataset status changes.
 */
public interface StatusPublisher {

  void publish(StatusMessage message);
}
