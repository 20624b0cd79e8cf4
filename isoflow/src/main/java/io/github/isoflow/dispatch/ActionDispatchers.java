package io.github.isoflow.dispatch;

import io.github.isoflow.model.DispatchMode;
import javax.inject.Inject;
import javax.inject.Provider;
import javax.inject.Singleton;

/**
 * Selects the dispatcher implementing a mode.
 */
@Singleton
public class ActionDispatchers {

  private final Provider<DirectActionDispatcher> direct;
  private final Provider<QueuedActionDispatcher> queued;

  /**
   * Instantiates a new Action dispatchers.
   *
   * @param direct the direct dispatcher provider
   * @param queued the queued dispatcher provider
   */
  @Inject
  public ActionDispatchers(final Provider<DirectActionDispatcher> direct,
                           final Provider<QueuedActionDispatcher> queued) {
    this.direct = direct;
    this.queued = queued;
  }

  /**
   * Dispatcher for the mode.
   *
   * @param mode the mode
   * @return the dispatcher
   */
  public ActionDispatcher create(final DispatchMode mode) {
    return switch (mode) {
      case DIRECT -> direct.get();
      case QUEUED -> queued.get();
    };
  }
}
