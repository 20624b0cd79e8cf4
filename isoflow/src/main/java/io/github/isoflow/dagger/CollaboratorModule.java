package io.github.isoflow.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.isoflow.client.ActionQueue;
import io.github.isoflow.client.Collaborators;
import io.github.isoflow.client.ImageStore;
import io.github.isoflow.client.JobFactory;
import io.github.isoflow.client.MolDbService;
import io.github.isoflow.client.NoOpStatusPublisher;
import io.github.isoflow.client.RawDataStore;
import io.github.isoflow.client.SearchIndex;
import io.github.isoflow.client.StatusPublisher;
import io.github.isoflow.model.Configuration;
import io.github.isoflow.model.ExecutionMode;
import javax.inject.Singleton;

/**
 * Binds the external service implementations supplied by the host application.
 */
@Module
public class CollaboratorModule {

  private final Collaborators collaborators;

  /**
   * Instantiates a new Collaborator module.
   *
   * @param collaborators the collaborators
   */
  public CollaboratorModule(final Collaborators collaborators) {
    this.collaborators = collaborators;
  }

  @Provides
  @Singleton
  public SearchIndex searchIndex() {
    return collaborators.searchIndex();
  }

  @Provides
  @Singleton
  public ActionQueue actionQueue() {
    return collaborators.actionQueue();
  }

  @Provides
  @Singleton
  public ImageStore imageStore() {
    return collaborators.imageStore();
  }

  @Provides
  @Singleton
  public MolDbService molDbService() {
    return collaborators.molDbService();
  }

  @Provides
  @Singleton
  public JobFactory jobFactory() {
    return collaborators.jobFactory();
  }

  @Provides
  @Singleton
  public RawDataStore rawDataStore() {
    return collaborators.rawDataStore();
  }

  /**
   * Status publisher. Nobody listens for status changes in local mode.
   *
   * @param configuration the configuration
   * @return the status publisher
   */
  @Provides
  @Singleton
  public StatusPublisher statusPublisher(final Configuration configuration) {
    if (configuration.executionMode() == ExecutionMode.LOCAL) {
      return new NoOpStatusPublisher();
    }
    return collaborators.statusPublisher()
        .orElseThrow(() -> new IllegalStateException("A status publisher is required in queue execution mode"));
  }
}
