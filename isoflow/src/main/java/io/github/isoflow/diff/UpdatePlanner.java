package io.github.isoflow.diff;

import io.github.isoflow.model.ActionIntent;
import io.github.isoflow.model.ActionPriority;
import io.github.isoflow.model.ConfigDiff;
import io.github.isoflow.model.Configuration;
import io.github.isoflow.model.Dataset;
import io.github.isoflow.model.DatasetAction;
import io.github.isoflow.model.ImmutableActionIntent;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which action an update of a stored dataset requires.
 *
 * <table>
 *   <caption>Decision table</caption>
 *   <tr><th>config diff</th><th>metadata changed</th><th>action</th></tr>
 *   <tr><td>INSTR_PARAMS_DIFF</td><td>any</td><td>ADD, delete first, caller priority</td></tr>
 *   <tr><td>NEW_MOL_DB</td><td>any</td><td>ADD, caller priority</td></tr>
 *   <tr><td>EQUAL</td><td>true</td><td>UPDATE, HIGH</td></tr>
 *   <tr><td>EQUAL</td><td>false</td><td>nothing</td></tr>
 * </table>
 */
@Singleton
public class UpdatePlanner {

  private static final Logger log = LoggerFactory.getLogger(UpdatePlanner.class);

  private final ConfigDiffClassifier classifier;
  private final Configuration configuration;

  /**
   * Instantiates a new Update planner.
   *
   * @param classifier    the classifier
   * @param configuration the configuration
   */
  @Inject
  public UpdatePlanner(final ConfigDiffClassifier classifier,
                       final Configuration configuration) {
    this.classifier = classifier;
    this.configuration = configuration;
  }

  /**
   * Plan the action for an update.
   *
   * @param stored   the stored dataset
   * @param updated  the requested state
   * @param priority the caller priority
   * @return the action, empty when nothing has to run
   */
  public Optional<ActionIntent> plan(final Dataset stored, final Dataset updated, final ActionPriority priority) {
    final ConfigDiff configDiff = classifier.classify(stored.config(), updated.config());
    final boolean metadataChanged = classifier.metadataChanged(stored.metadata(), updated.metadata());
    log.debug("plan({}): config diff {}, metadata changed {}", updated.id(), configDiff, metadataChanged);

    switch (configDiff) {
      case INSTR_PARAMS_DIFF:
        return Optional.of(intent(updated, DatasetAction.ADD, priority).delFirst(true).build());
      case NEW_MOL_DB:
        return Optional.of(intent(updated, DatasetAction.ADD, priority).build());
      case EQUAL:
        if (metadataChanged) {
          return Optional.of(intent(updated, DatasetAction.UPDATE, ActionPriority.HIGH).build());
        }
        if (configuration.reindexOnRemovedMolDb()
            && !classifier.removedMolDbs(stored.config(), updated.config()).isEmpty()) {
          log.info("Molecular databases removed from {}, reindexing", updated.id());
          return Optional.of(intent(updated, DatasetAction.UPDATE, ActionPriority.HIGH).build());
        }
        return Optional.empty();
      default:
        throw new IllegalArgumentException("Unsupported config diff: " + configDiff);
    }
  }

  private ImmutableActionIntent.Builder intent(final Dataset dataset,
                                               final DatasetAction action,
                                               final ActionPriority priority) {
    return ImmutableActionIntent.builder().dataset(dataset).action(action).priority(priority);
  }
}
