package io.github.isoflow.model;

/**
 * Kind of difference between two dataset configurations.
 */
public enum ConfigDiff {

  /**
   * Nothing that requires reprocessing changed.
   */
  EQUAL,

  /**
   * Only the molecular database selection changed, and at least one database was added.
   */
  NEW_MOL_DB,

  /**
   * Instrument or isotope generation parameters changed.
   */
  INSTR_PARAMS_DIFF
}
