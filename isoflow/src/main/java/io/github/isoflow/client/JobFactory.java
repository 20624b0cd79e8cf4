package io.github.isoflow.client;

import io.github.isoflow.model.Dataset;

/**
 * Starts the annotation computation of a dataset.
 */
public interface JobFactory {

  void run(Dataset dataset);
}
