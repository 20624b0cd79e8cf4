package io.github.isoflow.client;

import io.github.isoflow.model.IsotopeGenerationConfig;
import io.github.isoflow.model.MolecularDb;

/**
 * Search index holding dataset documents and annotations.
 */
public interface SearchIndex {

  /**
   * Refresh the dataset document from storage.
   *
   * @param dsId the dataset id
   */
  void syncDataset(String dsId);

  /**
   * Remove every document of the dataset.
   *
   * @param dsId the dataset id
   */
  void deleteDataset(String dsId);

  /**
   * Index the annotations of the dataset against one molecular database.
   *
   * @param dsId   the dataset id
   * @param molDb  the molecular database
   * @param config isotope generation parameters used to compute the ion m/z values
   */
  void indexDataset(String dsId, MolecularDb molDb, IsotopeGenerationConfig config);
}
