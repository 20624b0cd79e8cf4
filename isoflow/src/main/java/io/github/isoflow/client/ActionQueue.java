package io.github.isoflow.client;

import io.github.isoflow.model.ActionMessage;
import io.github.isoflow.model.ActionPriority;

/**
 * Priority queue consumed by workers. Ordering across and within priorities is up to
 * the queue.
 */
public interface ActionQueue {

  void publish(ActionMessage message, ActionPriority priority);
}
