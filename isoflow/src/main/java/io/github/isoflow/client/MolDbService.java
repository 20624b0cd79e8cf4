package io.github.isoflow.client;

import io.github.isoflow.model.MolecularDb;
import io.github.isoflow.model.Molecule;
import java.util.List;
import java.util.Optional;

/**
 * Read only molecular database service.
 */
public interface MolDbService {

  MolecularDb findById(int id);

  /**
   * Databases with the name, all versions when no version is given.
   *
   * @param name    the name
   * @param version the version
   * @return matching databases, latest version first
   */
  List<MolecularDb> findByNameVersion(String name, Optional<String> version);

  List<String> fetchFormulas(int dbId);

  List<Molecule> fetchMolecules(int dbId, String formula);
}
