package io.github.isoflow.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.isoflow.dbu.model.Database;
import io.github.isoflow.model.Configuration;
import javax.inject.Singleton;

/**
 * Makes the runtime configuration injectable.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }

  @Provides
  @Singleton
  public Database database() {
    return configuration.database();
  }
}
