package io.github.isoflow.client;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Implementations of the external services the core talks to.
 */
@Value.Immutable
public interface Collaborators {

  SearchIndex searchIndex();

  ActionQueue actionQueue();

  ImageStore imageStore();

  MolDbService molDbService();

  JobFactory jobFactory();

  RawDataStore rawDataStore();

  /**
   * Status channel, required in queue execution mode.
   *
   * @return the status publisher
   */
  Optional<StatusPublisher> statusPublisher();

}
