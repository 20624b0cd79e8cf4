package io.github.isoflow.dao;

import java.util.List;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Isotope image ids stored with annotation metrics. Each row holds a JSON array of image
 * ids, one per isotope peak, null where a peak has no image.
 */
public interface IsoImageDao {

  @SqlQuery("SELECT m.iso_image_ids FROM iso_image_metrics m JOIN job j ON j.id = m.job_id "
      + "WHERE j.ds_id = :dsId ORDER BY m.job_id, m.sf_id, m.adduct")
  List<String> findIsoImageIds(@Bind("dsId") String dsId);

  @SqlUpdate("INSERT INTO iso_image_metrics (job_id, db_id, sf_id, adduct, iso_image_ids) "
      + "VALUES (:jobId, :dbId, :sfId, :adduct, :isoImageIds)")
  void insert(@Bind("jobId") long jobId,
              @Bind("dbId") int dbId,
              @Bind("sfId") int sfId,
              @Bind("adduct") String adduct,
              @Bind("isoImageIds") String isoImageIds);

}
