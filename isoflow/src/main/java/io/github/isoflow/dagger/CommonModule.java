package io.github.isoflow.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.isoflow.model.Configuration;
import io.github.isoflow.optical.OpticalImageRegistrar;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * Shared infrastructure.
 */
@Module
public class CommonModule {

  /**
   * Pool resampling optical image zoom levels. Threads are daemons so an idle pool never
   * keeps the process alive.
   *
   * @param configuration the configuration
   * @return the executor service
   */
  @Provides
  @Singleton
  @Named(OpticalImageRegistrar.OPTICAL_EXECUTOR)
  public ExecutorService opticalImageExecutor(final Configuration configuration) {
    final AtomicInteger counter = new AtomicInteger();
    final ThreadFactory threadFactory = runnable -> {
      final Thread thread = new Thread(runnable, "optical-image-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
    return Executors.newFixedThreadPool(configuration.opticalImageThreads(), threadFactory);
  }
}
