package io.github.isoflow.dao;

import io.github.isoflow.model.JobRecord;
import java.util.List;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Annotation jobs. Rows are written by the job runner.
 */
public interface JobDao {

  @SqlQuery("SELECT id, ds_id, db_id FROM job WHERE ds_id = :dsId ORDER BY id")
  List<JobRecord> findByDataset(@Bind("dsId") String dsId);

  @SqlUpdate("INSERT INTO job (db_id, ds_id, status) VALUES (:dbId, :dsId, :status)")
  @GetGeneratedKeys
  long insert(@Bind("dbId") int dbId, @Bind("dsId") String dsId, @Bind("status") String status);

  @SqlUpdate("DELETE FROM job WHERE id = :id")
  int delete(@Bind("id") long id);

}
