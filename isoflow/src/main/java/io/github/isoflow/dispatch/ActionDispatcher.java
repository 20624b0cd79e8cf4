package io.github.isoflow.dispatch;

import io.github.isoflow.model.ActionIntent;
import io.github.isoflow.model.ActionPriority;
import io.github.isoflow.model.Dataset;
import io.github.isoflow.model.DispatchMode;

/**
 * Turns dataset actions into storage mutations, search index updates, and either an
 * immediate job start or a queued message.
 */
public interface ActionDispatcher {

  /**
   * The mode this dispatcher implements.
   *
   * @return the mode
   */
  DispatchMode mode();

  /**
   * Dispatch a classified intent.
   *
   * @param intent the intent
   */
  default void process(final ActionIntent intent) {
    switch (intent.action()) {
      case ADD:
        add(intent.dataset(), intent.delFirst(), intent.priority());
        break;
      case UPDATE:
        update(intent.dataset(), intent.priority());
        break;
      case DELETE:
        delete(intent.dataset(), intent.delRawData());
        break;
      default:
        throw new IllegalArgumentException("Wrong action: " + intent.action());
    }
  }

  /**
   * Annotate the dataset.
   *
   * @param dataset  the dataset
   * @param delFirst delete the existing dataset and its results first
   * @param priority the priority
   */
  void add(Dataset dataset, boolean delFirst, ActionPriority priority);

  /**
   * Apply an update of the dataset.
   *
   * @param dataset  the dataset in its requested state
   * @param priority the priority
   */
  void update(Dataset dataset, ActionPriority priority);

  /**
   * Delete the dataset and everything derived from it.
   *
   * @param dataset    the dataset
   * @param delRawData also delete the raw input data
   */
  void delete(Dataset dataset, boolean delRawData);
}
