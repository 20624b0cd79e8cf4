package io.github.isoflow.dispatch;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.isoflow.manager.DatasetManager;
import io.github.isoflow.model.ActionIntent;
import io.github.isoflow.model.ActionMessage;
import io.github.isoflow.model.ActionPriority;
import io.github.isoflow.model.Dataset;
import io.github.isoflow.model.DatasetAction;
import io.github.isoflow.model.ImmutableActionIntent;
import io.github.isoflow.model.ImmutableDataset;
import java.time.Instant;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker side of the action queue: executes a consumed message in process.
 */
@Singleton
public class ActionMessageHandler {

  private static final Logger log = LoggerFactory.getLogger(ActionMessageHandler.class);

  private final DatasetManager datasetManager;
  private final DirectActionDispatcher dispatcher;

  /**
   * Instantiates a new Action message handler.
   *
   * @param datasetManager the dataset manager
   * @param dispatcher     the direct dispatcher
   */
  @Inject
  public ActionMessageHandler(final DatasetManager datasetManager,
                              final DirectActionDispatcher dispatcher) {
    this.datasetManager = datasetManager;
    this.dispatcher = dispatcher;
  }

  /**
   * Handle a message. The dataset is loaded from storage, so the message only has to
   * identify it. A DELETE for a dataset that is no longer stored still runs, on the
   * fields the message carries, so that an interrupted delete can be repeated.
   *
   * @param message  the message
   * @param priority the priority it was consumed with
   */
  public void handle(final ActionMessage message, final ActionPriority priority) {
    log.info("handle({}, {}, {})", message.dsId(), message.action(), priority);
    final Dataset dataset;
    if (message.action() == DatasetAction.DELETE && !datasetManager.isStored(message.dsId())) {
      log.warn("Dataset {} is not stored, deleting what is left of it", message.dsId());
      dataset = fromMessage(message);
    } else {
      dataset = datasetManager.load(message.dsId());
    }
    final ActionIntent intent = ImmutableActionIntent.builder()
        .dataset(dataset)
        .action(message.action())
        .priority(priority)
        .delFirst(message.action() == DatasetAction.ADD && message.delFirst().orElse(false))
        .delRawData(message.action() == DatasetAction.DELETE && message.delRawData().orElse(false))
        .build();
    dispatcher.process(intent);
  }

  private Dataset fromMessage(final ActionMessage message) {
    return ImmutableDataset.builder()
        .id(message.dsId())
        .name(message.dsName())
        .inputPath(message.inputPath())
        .uploadDate(Instant.EPOCH)
        .metadata(JsonNodeFactory.instance.objectNode())
        .config(JsonNodeFactory.instance.objectNode())
        .build();
  }
}
