package io.github.isoflow.model;

import org.immutables.value.Value;

/**
 * Annotation job of a dataset against one molecular database.
 */
@Value.Immutable
public interface JobRecord {

  long id();

  String dsId();

  int dbId();

}
