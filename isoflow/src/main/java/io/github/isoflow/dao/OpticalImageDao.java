package io.github.isoflow.dao;

import io.github.isoflow.model.OpticalTile;
import java.util.List;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindPojo;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;

/**
 * Zoomed optical image tiles.
 */
public interface OpticalImageDao {

  @SqlQuery("SELECT id, ds_id, zoom FROM optical_image WHERE ds_id = :dsId ORDER BY zoom")
  List<OpticalTile> findByDataset(@Bind("dsId") String dsId);

  @SqlUpdate("DELETE FROM optical_image WHERE ds_id = :dsId")
  int deleteByDataset(@Bind("dsId") String dsId);

  @SqlBatch("INSERT INTO optical_image (id, ds_id, zoom) VALUES (:id, :dsId, :zoom)")
  void insert(@BindPojo List<OpticalTile> tiles);

  /**
   * Replace the tile rows of a dataset in one transaction.
   *
   * @param dsId  the dataset id
   * @param tiles the new tiles
   */
  @Transaction
  default void replace(final String dsId, final List<OpticalTile> tiles) {
    deleteByDataset(dsId);
    if (!tiles.isEmpty()) {
      insert(tiles);
    }
  }

}
