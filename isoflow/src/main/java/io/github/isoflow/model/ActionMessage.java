package io.github.isoflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Message published to the action queue and consumed by workers.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableActionMessage.class)
@JsonDeserialize(as = ImmutableActionMessage.class)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface ActionMessage {

  @JsonProperty("ds_id")
  String dsId();

  @JsonProperty("ds_name")
  String dsName();

  @JsonProperty("input_path")
  String inputPath();

  /**
   * Lower-cased email of the submitter, when the metadata carries one.
   *
   * @return the email
   */
  @JsonProperty("user_email")
  Optional<String> userEmail();

  @JsonProperty("action")
  DatasetAction action();

  @JsonProperty("del_first")
  Optional<Boolean> delFirst();

  @JsonProperty("del_raw_data")
  Optional<Boolean> delRawData();

}
