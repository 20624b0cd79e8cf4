package io.github.isoflow.isotope;

import io.github.isoflow.client.MolDbService;
import io.github.isoflow.dao.SumFormulaDao;
import io.github.isoflow.exception.MolecularDbNotFoundException;
import io.github.isoflow.model.IsotopeGenerationConfig;
import io.github.isoflow.model.MolDbRef;
import io.github.isoflow.model.MolecularDb;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Looks up molecular databases in the molecular database service.
 */
@Singleton
public class MolecularDbResolver {

  private final MolDbService molDbService;
  private final SumFormulaDao sumFormulaDao;
  private final IsotopePeakAssembler peakAssembler;

  /**
   * Instantiates a new Molecular db resolver.
   *
   * @param molDbService  the mol db service
   * @param sumFormulaDao the sum formula dao
   * @param peakAssembler the peak assembler
   */
  @Inject
  public MolecularDbResolver(final MolDbService molDbService,
                             final SumFormulaDao sumFormulaDao,
                             final IsotopePeakAssembler peakAssembler) {
    this.molDbService = molDbService;
    this.sumFormulaDao = sumFormulaDao;
    this.peakAssembler = peakAssembler;
  }

  /**
   * By id.
   *
   * @param id                the id
   * @param isotopeGeneration the isotope generation config
   * @return the database
   */
  public MolecularDatabase byId(final int id, final IsotopeGenerationConfig isotopeGeneration) {
    return open(molDbService.findById(id), isotopeGeneration);
  }

  /**
   * By name, latest version when no version is given.
   *
   * @param name              the name
   * @param version           the version
   * @param isotopeGeneration the isotope generation config
   * @return the database
   * @throws MolecularDbNotFoundException if nothing matches
   */
  public MolecularDatabase byName(final String name,
                                  final Optional<String> version,
                                  final IsotopeGenerationConfig isotopeGeneration) {
    final List<MolecularDb> matches = molDbService.findByNameVersion(name, version);
    if (matches.isEmpty()) {
      throw new MolecularDbNotFoundException("Molecular database not found: " + name + version.map(v -> " " + v).orElse(""));
    }
    return open(matches.get(0), isotopeGeneration);
  }

  /**
   * A database selected in a dataset config.
   *
   * @param ref               the reference
   * @param isotopeGeneration the isotope generation config
   * @return the database
   */
  public MolecularDatabase resolve(final MolDbRef ref, final IsotopeGenerationConfig isotopeGeneration) {
    return byName(ref.name(), ref.version(), isotopeGeneration);
  }

  private MolecularDatabase open(final MolecularDb molecularDb, final IsotopeGenerationConfig isotopeGeneration) {
    return new MolecularDatabase(molecularDb, isotopeGeneration, molDbService, sumFormulaDao, peakAssembler);
  }
}
