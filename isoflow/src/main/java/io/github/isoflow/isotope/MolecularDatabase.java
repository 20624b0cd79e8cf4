package io.github.isoflow.isotope;

import io.github.isoflow.client.MolDbService;
import io.github.isoflow.dao.SumFormulaDao;
import io.github.isoflow.model.IsotopeGenerationConfig;
import io.github.isoflow.model.MolecularDb;
import io.github.isoflow.model.Molecule;
import io.github.isoflow.model.SumFormula;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A molecular database searched with one isotope generation config. Formulas and peak
 * tables are loaded once per instance.
 */
public class MolecularDatabase {

  private static final Logger log = LoggerFactory.getLogger(MolecularDatabase.class);

  private final MolecularDb molecularDb;
  private final IsotopeGenerationConfig isotopeGeneration;
  private final MolDbService molDbService;
  private final SumFormulaDao sumFormulaDao;
  private final IsotopePeakAssembler peakAssembler;
  private final Map<Long, PeakTable> peakTables = new ConcurrentHashMap<>();
  private Map<Integer, String> formulas;

  /**
   * Instantiates a new Molecular database.
   *
   * @param molecularDb       the molecular db
   * @param isotopeGeneration the isotope generation config
   * @param molDbService      the mol db service
   * @param sumFormulaDao     the sum formula dao
   * @param peakAssembler     the peak assembler
   */
  public MolecularDatabase(final MolecularDb molecularDb,
                           final IsotopeGenerationConfig isotopeGeneration,
                           final MolDbService molDbService,
                           final SumFormulaDao sumFormulaDao,
                           final IsotopePeakAssembler peakAssembler) {
    this.molecularDb = molecularDb;
    this.isotopeGeneration = isotopeGeneration;
    this.molDbService = molDbService;
    this.sumFormulaDao = sumFormulaDao;
    this.peakAssembler = peakAssembler;
  }

  public int id() {
    return molecularDb.id();
  }

  public String name() {
    return molecularDb.name();
  }

  public String version() {
    return molecularDb.version();
  }

  public MolecularDb molecularDb() {
    return molecularDb;
  }

  public IsotopeGenerationConfig isotopeGeneration() {
    return isotopeGeneration;
  }

  /**
   * Sum formulas by id, in id order. The formulas are copied from the molecular
   * database service into the sum_formula table the first time the database is used.
   *
   * @return the formulas
   */
  public synchronized Map<Integer, String> formulas() {
    if (formulas == null) {
      final List<String> fetched = molDbService.fetchFormulas(id());
      if (sumFormulaDao.count(id()) == 0) {
        log.info("Inserting {} sum formulas of {}", fetched.size(), this);
        sumFormulaDao.insert(id(), fetched);
      }
      final Map<Integer, String> result = new LinkedHashMap<>();
      for (final SumFormula formula : sumFormulaDao.findByDb(id())) {
        result.put(formula.id(), formula.sf());
      }
      formulas = Collections.unmodifiableMap(result);
    }
    return formulas;
  }

  /**
   * Molecules of the database with the sum formula.
   *
   * @param formula the sum formula
   * @return the molecules
   */
  public List<Molecule> molecules(final String formula) {
    return molDbService.fetchMolecules(id(), formula);
  }

  /**
   * Target and decoy peaks searched by a job.
   *
   * @param jobId the job id
   * @return the peak table
   */
  public PeakTable peakTable(final long jobId) {
    return peakTables.computeIfAbsent(jobId, job -> peakAssembler.assemble(id(), isotopeGeneration, job));
  }

  @Override
  public String toString() {
    return molecularDb.name() + " " + molecularDb.version();
  }
}
