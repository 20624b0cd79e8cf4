package io.github.isoflow.dao;

import io.github.isoflow.model.SumFormula;
import java.util.List;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

/**
 * Sum formulas of the molecular databases, with the ids theoretical peaks are joined on.
 */
public interface SumFormulaDao {

  @SqlQuery("SELECT COUNT(*) FROM sum_formula WHERE db_id = :dbId")
  int count(@Bind("dbId") int dbId);

  @SqlBatch("INSERT INTO sum_formula (db_id, sf) VALUES (:dbId, :sf)")
  void insert(@Bind("dbId") int dbId, @Bind("sf") List<String> formulas);

  @SqlQuery("SELECT id, sf FROM sum_formula WHERE db_id = :dbId ORDER BY id")
  List<SumFormula> findByDb(@Bind("dbId") int dbId);

}
