package io.github.isoflow.isotope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.isoflow.dao.TheorPeaksDao;
import io.github.isoflow.exception.PeakTableConsistencyException;
import io.github.isoflow.model.ImmutablePeakRow;
import io.github.isoflow.model.IsotopeGenerationConfig;
import io.github.isoflow.model.PeakRow;
import io.github.isoflow.model.TheorPeakRow;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the target and decoy peak table a job searches for.
 */
@Singleton
public class IsotopePeakAssembler {

  private static final Logger log = LoggerFactory.getLogger(IsotopePeakAssembler.class);

  private final TheorPeaksDao theorPeaksDao;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Isotope peak assembler.
   *
   * @param theorPeaksDao the theor peaks dao
   * @param objectMapper  the object mapper
   */
  @Inject
  public IsotopePeakAssembler(final TheorPeaksDao theorPeaksDao,
                              final ObjectMapper objectMapper) {
    this.theorPeaksDao = theorPeaksDao;
    this.objectMapper = objectMapper;
  }

  /**
   * Target ions are every formula of the database with every configured adduct. Decoy
   * ions are every formula with the decoy adduct the job assigned to it.
   *
   * @param dbId   the molecular database id
   * @param config the isotope generation config
   * @param jobId  the job id
   * @return the peak table
   * @throws PeakTableConsistencyException if no target or no decoy peaks match, or an ion occurs twice
   */
  public PeakTable assemble(final int dbId, final IsotopeGenerationConfig config, final long jobId) {
    final List<TheorPeakRow> target = theorPeaksDao.findTargetPeaks(dbId, config.adducts(),
        config.roundedSigma(), config.isocalcPtsPerMz(), config.chargeDescriptor());
    if (target.isEmpty()) {
      throw new PeakTableConsistencyException("No formulas matching the criteria were found in theor_peaks (target)");
    }
    final List<TheorPeakRow> decoy = theorPeaksDao.findDecoyPeaks(dbId, jobId,
        config.roundedSigma(), config.isocalcPtsPerMz(), config.chargeDescriptor());
    if (decoy.isEmpty()) {
      throw new PeakTableConsistencyException("No formulas matching the criteria were found in theor_peaks (decoy)");
    }

    final List<PeakRow> rows = new ArrayList<>(target.size() + decoy.size());
    target.forEach(row -> rows.add(toPeakRow(row)));
    decoy.forEach(row -> rows.add(toPeakRow(row)));
    final PeakTable table = PeakTable.of(rows);
    log.info("Loaded {} sum formula, adduct combinations for db {} job {}", table.size(), dbId, jobId);
    return table;
  }

  private PeakRow toPeakRow(final TheorPeakRow row) {
    return ImmutablePeakRow.builder()
        .formulaId(row.formulaId())
        .adduct(row.adduct())
        .centroidMzs(readArray(row.centrMzs()))
        .centroidInts(readArray(row.centrInts()))
        .build();
  }

  private double[] readArray(final String json) {
    try {
      return objectMapper.readValue(json, double[].class);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt centroid array: " + json, e);
    }
  }
}
