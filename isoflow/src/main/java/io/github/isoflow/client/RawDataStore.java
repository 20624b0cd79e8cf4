package io.github.isoflow.client;

/**
 * Object store holding uploaded raw input data.
 */
public interface RawDataStore {

  void deleteInputData(String inputPath);
}
