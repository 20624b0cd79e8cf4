package io.github.isoflow.dao;

import io.github.isoflow.model.TheorPeakRow;
import java.math.BigDecimal;
import java.util.List;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Precomputed theoretical isotope peaks.
 */
public interface TheorPeaksDao {

  /**
   * Peaks of every formula of a database combined with the configured target adducts.
   *
   * @param dbId     the molecular database id
   * @param adducts  the target adducts
   * @param sigma    sigma rounded to six decimals
   * @param ptsPerMz points per m/z
   * @param charge   the charge descriptor
   * @return the rows sorted by formula id and adduct
   */
  @SqlQuery("SELECT sf.id AS formula_id, p.adduct, p.centr_mzs, p.centr_ints "
      + "FROM theor_peaks p "
      + "JOIN sum_formula sf ON sf.sf = p.sf AND sf.db_id = :dbId "
      + "WHERE p.adduct IN (<adducts>) AND ROUND(CAST(p.sigma AS DECIMAL(20, 10)), 6) = :sigma "
      + "AND p.pts_per_mz = :ptsPerMz AND p.charge = :charge "
      + "ORDER BY sf.id, p.adduct")
  List<TheorPeakRow> findTargetPeaks(@Bind("dbId") int dbId,
                                     @BindList("adducts") List<String> adducts,
                                     @Bind("sigma") BigDecimal sigma,
                                     @Bind("ptsPerMz") int ptsPerMz,
                                     @Bind("charge") String charge);

  /**
   * Peaks of every formula of a database combined with the decoy adduct the job assigned to it.
   *
   * @param dbId     the molecular database id
   * @param jobId    the job id
   * @param sigma    sigma rounded to six decimals
   * @param ptsPerMz points per m/z
   * @param charge   the charge descriptor
   * @return the rows sorted by formula id and adduct
   */
  @SqlQuery("SELECT DISTINCT sf.id AS formula_id, td.decoy_add AS adduct, p.centr_mzs, p.centr_ints "
      + "FROM theor_peaks p "
      + "JOIN sum_formula sf ON sf.sf = p.sf AND sf.db_id = :dbId "
      + "JOIN target_decoy_add td ON td.job_id = :jobId AND td.db_id = sf.db_id "
      + "AND td.sf_id = sf.id AND td.decoy_add = p.adduct "
      + "WHERE ROUND(CAST(p.sigma AS DECIMAL(20, 10)), 6) = :sigma "
      + "AND p.pts_per_mz = :ptsPerMz AND p.charge = :charge "
      + "ORDER BY formula_id, adduct")
  List<TheorPeakRow> findDecoyPeaks(@Bind("dbId") int dbId,
                                    @Bind("jobId") long jobId,
                                    @Bind("sigma") BigDecimal sigma,
                                    @Bind("ptsPerMz") int ptsPerMz,
                                    @Bind("charge") String charge);

  @SqlUpdate("INSERT INTO theor_peaks (sf, adduct, sigma, charge, pts_per_mz, centr_mzs, centr_ints) "
      + "VALUES (:sf, :adduct, :sigma, :charge, :ptsPerMz, :centrMzs, :centrInts)")
  void insertPeaks(@Bind("sf") String sf,
                   @Bind("adduct") String adduct,
                   @Bind("sigma") double sigma,
                   @Bind("charge") String charge,
                   @Bind("ptsPerMz") int ptsPerMz,
                   @Bind("centrMzs") String centrMzs,
                   @Bind("centrInts") String centrInts);

  @SqlUpdate("INSERT INTO target_decoy_add (job_id, db_id, sf_id, target_add, decoy_add) "
      + "VALUES (:jobId, :dbId, :sfId, :targetAdd, :decoyAdd)")
  void insertDecoyAdduct(@Bind("jobId") long jobId,
                         @Bind("dbId") int dbId,
                         @Bind("sfId") int sfId,
                         @Bind("targetAdd") String targetAdd,
                         @Bind("decoyAdd") String decoyAdd);

}
