package io.github.isoflow.dagger;

import dagger.Component;
import io.github.isoflow.client.Collaborators;
import io.github.isoflow.dispatch.ActionDispatchers;
import io.github.isoflow.dispatch.ActionMessageHandler;
import io.github.isoflow.dispatch.DirectActionDispatcher;
import io.github.isoflow.dispatch.QueuedActionDispatcher;
import io.github.isoflow.isotope.MolecularDbResolver;
import io.github.isoflow.manager.DatasetManager;
import io.github.isoflow.model.Configuration;
import io.github.isoflow.optical.OpticalImageRegistrar;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;

/**
 * The interface Isoflow component.
 */
@Singleton
@Component(modules = {IsoflowModule.class, ConfigurationModule.class, CommonModule.class, CollaboratorModule.class})
public interface IsoflowComponent {

  /**
   * Instance isoflow component.
   *
   * @param configuration the configuration
   * @param collaborators the collaborators
   * @return the isoflow component
   */
  static IsoflowComponent instance(final Configuration configuration, final Collaborators collaborators) {
    return DaggerIsoflowComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .collaboratorModule(new CollaboratorModule(collaborators))
        .build();
  }

  /**
   * Dataset manager.
   *
   * @return the dataset manager
   */
  DatasetManager datasetManager();

  /**
   * Dispatchers by mode.
   *
   * @return the action dispatchers
   */
  ActionDispatchers actionDispatchers();

  DirectActionDispatcher directActionDispatcher();

  QueuedActionDispatcher queuedActionDispatcher();

  /**
   * Worker side message handler.
   *
   * @return the action message handler
   */
  ActionMessageHandler actionMessageHandler();

  OpticalImageRegistrar opticalImageRegistrar();

  MolecularDbResolver molecularDbResolver();

  /**
   * Jdbi (for testing).
   *
   * @return the jdbi
   */
  Jdbi jdbi();
}
