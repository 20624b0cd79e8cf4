package io.github.isoflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Dataset status notification.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableStatusMessage.class)
@JsonDeserialize(as = ImmutableStatusMessage.class)
public interface StatusMessage {

  @JsonProperty("ds_id")
  @Value.Parameter
  String dsId();

  @JsonProperty("status")
  @Value.Parameter
  DatasetStatus status();

}
