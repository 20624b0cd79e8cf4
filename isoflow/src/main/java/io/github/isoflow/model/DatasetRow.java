package io.github.isoflow.model;

import java.time.Instant;
import org.immutables.value.Value;

/**
 * Dataset table row, JSON columns kept as text.
 */
@Value.Immutable
public interface DatasetRow {

  String id();

  String name();

  String inputPath();

  Instant uploadDt();

  String metadata();

  String config();

  String status();

  boolean publicDataset();

  String molDbs();

}
