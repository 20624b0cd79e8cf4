package io.github.isoflow.dao;

import io.github.isoflow.model.DatasetRow;
import java.util.Optional;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindPojo;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Dataset table.
 */
public interface DatasetDao {

  /**
   * Columns mapped onto {@link DatasetRow}.
   */
  String COLUMNS = "id, name, input_path, upload_dt, metadata, config, status, is_public AS public_dataset, mol_dbs";

  @SqlQuery("SELECT " + COLUMNS + " FROM dataset WHERE id = :id")
  Optional<DatasetRow> find(@Bind("id") String id);

  @SqlQuery("SELECT COUNT(*) FROM dataset WHERE id = :id")
  int count(@Bind("id") String id);

  default boolean exists(final String id) {
    return count(id) > 0;
  }

  @SqlUpdate("INSERT INTO dataset (id, name, input_path, upload_dt, metadata, config, status, is_public, mol_dbs) "
      + "VALUES (:id, :name, :inputPath, :uploadDt, :metadata, :config, :status, :publicDataset, :molDbs)")
  void insert(@BindPojo DatasetRow row);

  @SqlUpdate("UPDATE dataset SET name = :name, input_path = :inputPath, upload_dt = :uploadDt, metadata = :metadata, "
      + "config = :config, status = :status, is_public = :publicDataset, mol_dbs = :molDbs WHERE id = :id")
  int update(@BindPojo DatasetRow row);

  @SqlUpdate("DELETE FROM dataset WHERE id = :id")
  int delete(@Bind("id") String id);

  @SqlQuery("SELECT ion_img_storage_type FROM dataset WHERE id = :id")
  Optional<String> findIonImageStorageType(@Bind("id") String id);

  @SqlQuery("SELECT optical_image FROM dataset WHERE id = :id")
  Optional<String> findRawOpticalImageId(@Bind("id") String id);

  @SqlQuery("SELECT optical_transform FROM dataset WHERE id = :id")
  Optional<String> findOpticalTransform(@Bind("id") String id);

  @SqlUpdate("UPDATE dataset SET optical_image = :imageId, optical_transform = :transform WHERE id = :id")
  int updateRawOpticalImage(@Bind("id") String id,
                            @Bind("imageId") String imageId,
                            @Bind("transform") String transform);

  @SqlUpdate("UPDATE dataset SET optical_image = NULL, optical_transform = NULL WHERE id = :id")
  int clearRawOpticalImage(@Bind("id") String id);

}
