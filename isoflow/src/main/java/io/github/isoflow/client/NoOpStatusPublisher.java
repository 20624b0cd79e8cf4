package io.github.isoflow.client;

import io.github.isoflow.model.StatusMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Status publisher used in local execution mode, where nobody listens.
 */
public class NoOpStatusPublisher implements StatusPublisher {

  private static final Logger log = LoggerFactory.getLogger(NoOpStatusPublisher.class);

  @Override
  public void publish(final StatusMessage message) {
    log.trace("publish({}) skipped", message);
  }
}
