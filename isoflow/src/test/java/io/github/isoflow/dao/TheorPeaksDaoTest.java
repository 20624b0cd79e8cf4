package io.github.isoflow.dao;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.isoflow.BaseJdbiTest;
import io.github.isoflow.model.SumFormula;
import io.github.isoflow.model.TheorPeakRow;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TheorPeaksDaoTest extends BaseJdbiTest {

  private static final int DB_ID = 0;
  private static final long JOB_ID = 7L;
  private static final BigDecimal SIGMA = new BigDecimal("0.000619");

  private TheorPeaksDao dao;
  private Map<String, Integer> formulaIds;

  @BeforeEach
  void setup() {
    dao = jdbi.onDemand(TheorPeaksDao.class);
    final SumFormulaDao sumFormulaDao = jdbi.onDemand(SumFormulaDao.class);
    sumFormulaDao.insert(DB_ID, List.of("H2O", "Au"));
    sumFormulaDao.insert(1, List.of("H2O"));
    formulaIds = sumFormulaDao.findByDb(DB_ID).stream().collect(Collectors.toMap(SumFormula::sf, SumFormula::id));

    for (final String sf : List.of("H2O", "Au")) {
      for (final String adduct : List.of("+H", "+Na", "+He", "+Li")) {
        dao.insertPeaks(sf, adduct, 0.000619, "+1", 8078, "[100.0, 200.0]", "[100.0, 10.0]");
      }
      dao.insertPeaks(sf, "+H", 0.01, "+1", 8078, "[1.0]", "[1.0]");
      dao.insertPeaks(sf, "+H", 0.000619, "-1", 8078, "[2.0]", "[2.0]");
    }
    dao.insertDecoyAdduct(JOB_ID, DB_ID, formulaIds.get("H2O"), "+H", "+He");
    dao.insertDecoyAdduct(JOB_ID, DB_ID, formulaIds.get("Au"), "+H", "+Li");
    dao.insertDecoyAdduct(JOB_ID + 1, DB_ID, formulaIds.get("Au"), "+H", "+He");
  }

  @Test
  void findTargetPeaks() {
    final List<TheorPeakRow> rows = dao.findTargetPeaks(DB_ID, List.of("+H", "+Na"), SIGMA, 8078, "+1");

    assertThat(rows).extracting(TheorPeakRow::formulaId).containsExactly(
        formulaIds.get("H2O"), formulaIds.get("H2O"), formulaIds.get("Au"), formulaIds.get("Au"));
    assertThat(rows).extracting(TheorPeakRow::adduct).containsExactly("+H", "+Na", "+H", "+Na");
    assertThat(rows.get(0).centrMzs()).isEqualTo("[100.0, 200.0]");
    assertThat(rows.get(0).centrInts()).isEqualTo("[100.0, 10.0]");
  }

  @Test
  void findTargetPeaks_otherCharge() {
    assertThat(dao.findTargetPeaks(DB_ID, List.of("+H"), SIGMA, 8078, "-1"))
        .extracting(TheorPeakRow::centrMzs)
        .containsExactly("[2.0]", "[2.0]");
    assertThat(dao.findTargetPeaks(DB_ID, List.of("+H"), SIGMA, 1000, "+1")).isEmpty();
  }

  @Test
  void findDecoyPeaks() {
    final List<TheorPeakRow> rows = dao.findDecoyPeaks(DB_ID, JOB_ID, SIGMA, 8078, "+1");

    assertThat(rows).extracting(TheorPeakRow::formulaId)
        .containsExactly(formulaIds.get("H2O"), formulaIds.get("Au"));
    assertThat(rows).extracting(TheorPeakRow::adduct).containsExactly("+He", "+Li");
  }

  @Test
  void findDecoyPeaks_unknownJob() {
    assertThat(dao.findDecoyPeaks(DB_ID, 99L, SIGMA, 8078, "+1")).isEmpty();
  }

}
