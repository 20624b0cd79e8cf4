package io.github.isoflow.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.isoflow.model.ActionMessage;
import io.github.isoflow.model.Dataset;
import io.github.isoflow.model.DatasetAction;
import io.github.isoflow.model.ImmutableActionMessage;
import java.util.Locale;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Builds action queue messages.
 */
@Singleton
public class ActionMessageFactory {

  @Inject
  public ActionMessageFactory() {
    // Default constructor
  }

  /**
   * Message for a dataset action, without extras.
   *
   * @param dataset the dataset
   * @param action  the action
   * @return the message builder
   */
  public ImmutableActionMessage.Builder builder(final Dataset dataset, final DatasetAction action) {
    return ImmutableActionMessage.builder()
        .dsId(dataset.id())
        .dsName(dataset.name())
        .inputPath(dataset.inputPath())
        .userEmail(userEmail(dataset))
        .action(action);
  }

  /**
   * Message for a dataset action, without extras.
   *
   * @param dataset the dataset
   * @param action  the action
   * @return the message
   */
  public ActionMessage create(final Dataset dataset, final DatasetAction action) {
    return builder(dataset, action).build();
  }

  /**
   * Submitter email at {@code Submitted_By.Submitter.Email}, lower-cased.
   *
   * @param dataset the dataset
   * @return the email
   */
  public Optional<String> userEmail(final Dataset dataset) {
    final JsonNode email = dataset.metadata().path("Submitted_By").path("Submitter").path("Email");
    if (!email.isTextual() || email.asText().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(email.asText().toLowerCase(Locale.ROOT));
  }
}
