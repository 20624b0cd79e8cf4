package io.github.isoflow.dispatch;

import io.github.isoflow.client.ActionQueue;
import io.github.isoflow.diff.UpdatePlanner;
import io.github.isoflow.exception.DatasetAlreadyExistsException;
import io.github.isoflow.manager.DatasetManager;
import io.github.isoflow.model.ActionIntent;
import io.github.isoflow.model.ActionMessage;
import io.github.isoflow.model.ActionPriority;
import io.github.isoflow.model.Dataset;
import io.github.isoflow.model.DatasetAction;
import io.github.isoflow.model.DatasetStatus;
import io.github.isoflow.model.DispatchMode;
import io.github.isoflow.model.ImmutableActionMessage;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Defers actions to workers: marks the dataset QUEUED and publishes a message on the
 * priority queue.
 */
@Singleton
public class QueuedActionDispatcher implements ActionDispatcher {

  private static final Logger log = LoggerFactory.getLogger(QueuedActionDispatcher.class);

  private final DatasetManager datasetManager;
  private final UpdatePlanner updatePlanner;
  private final ActionMessageFactory messageFactory;
  private final ActionQueue actionQueue;

  /**
   * Instantiates a new Queued action dispatcher.
   *
   * @param datasetManager the dataset manager
   * @param updatePlanner  the update planner
   * @param messageFactory the message factory
   * @param actionQueue    the action queue
   */
  @Inject
  public QueuedActionDispatcher(final DatasetManager datasetManager,
                                final UpdatePlanner updatePlanner,
                                final ActionMessageFactory messageFactory,
                                final ActionQueue actionQueue) {
    this.datasetManager = datasetManager;
    this.updatePlanner = updatePlanner;
    this.messageFactory = messageFactory;
    this.actionQueue = actionQueue;
  }

  @Override
  public DispatchMode mode() {
    return DispatchMode.QUEUED;
  }

  /**
   * Queue an annotation run.
   *
   * @throws DatasetAlreadyExistsException if the dataset is stored and delFirst is not set
   */
  @Override
  public void add(final Dataset dataset, final boolean delFirst, final ActionPriority priority) {
    if (!delFirst && datasetManager.isStored(dataset.id())) {
      throw new DatasetAlreadyExistsException(dataset.id() + " - " + dataset.name());
    }
    post(dataset, messageFactory.builder(dataset, DatasetAction.ADD).delFirst(delFirst).build(), priority);
  }

  /**
   * Classify the change against the stored dataset and queue what it requires, if anything.
   */
  @Override
  public void update(final Dataset dataset, final ActionPriority priority) {
    final Dataset stored = datasetManager.load(dataset.id());
    final Optional<ActionIntent> intent = updatePlanner.plan(stored, dataset, priority);
    if (intent.isEmpty()) {
      log.info("Nothing to update: {} {}", dataset.id(), dataset.name());
      return;
    }
    final ActionIntent planned = intent.get();
    final ImmutableActionMessage.Builder message = messageFactory.builder(dataset, planned.action());
    if (planned.delFirst()) {
      message.delFirst(true);
    }
    post(dataset, message.build(), planned.priority());
  }

  /**
   * Queue a delete. Always allowed and always at HIGH priority.
   */
  @Override
  public void delete(final Dataset dataset, final boolean delRawData) {
    post(dataset, messageFactory.builder(dataset, DatasetAction.DELETE).delRawData(delRawData).build(),
        ActionPriority.HIGH);
  }

  private void post(final Dataset dataset, final ActionMessage message, final ActionPriority priority) {
    datasetManager.setStatus(dataset, DatasetStatus.QUEUED);
    actionQueue.publish(message, priority);
    log.info("New message posted with priority {}: {}", priority, message);
  }
}
