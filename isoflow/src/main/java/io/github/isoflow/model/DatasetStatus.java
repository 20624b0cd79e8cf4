package io.github.isoflow.model;

/**
 * Stage of the dataset lifecycle.
 */
public enum DatasetStatus {

  /**
   * The dataset is just saved to the database.
   */
  NEW,

  /**
   * The dataset is queued for processing.
   */
  QUEUED,

  /**
   * The processing is in progress.
   */
  STARTED,

  /**
   * The processing or reindexing finished successfully.
   */
  FINISHED,

  /**
   * An error occurred during processing.
   */
  FAILED,

  /**
   * The search index records are being rebuilt because of changed metadata.
   */
  INDEXING,

  /**
   * The dataset has been deleted. Terminal.
   */
  DELETED
}
