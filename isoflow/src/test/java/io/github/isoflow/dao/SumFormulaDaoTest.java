package io.github.isoflow.dao;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.isoflow.BaseJdbiTest;
import io.github.isoflow.model.SumFormula;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SumFormulaDaoTest extends BaseJdbiTest {

  private SumFormulaDao dao;

  @BeforeEach
  void setup() {
    dao = jdbi.onDemand(SumFormulaDao.class);
  }

  @Test
  void insert_count_findByDb() {
    assertThat(dao.count(0)).isZero();

    dao.insert(0, List.of("H2O", "C5H4N4O", "Au"));
    dao.insert(1, List.of("CO2"));

    assertThat(dao.count(0)).isEqualTo(3);
    assertThat(dao.count(1)).isEqualTo(1);
    assertThat(dao.findByDb(0)).extracting(SumFormula::sf).containsExactly("H2O", "C5H4N4O", "Au");
    assertThat(dao.findByDb(0)).extracting(SumFormula::id).isSorted().doesNotHaveDuplicates();
  }

}
