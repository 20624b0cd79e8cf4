package io.github.isoflow.isotope;

import io.github.isoflow.exception.PeakTableConsistencyException;
import io.github.isoflow.model.ImmutableIonPeak;
import io.github.isoflow.model.Ion;
import io.github.isoflow.model.IonPeak;
import io.github.isoflow.model.PeakRow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Theoretical peaks of all target and decoy ions searched by a job, sorted by formula id
 * and adduct. Each ion occurs exactly once. Derived views are computed on first use.
 */
public final class PeakTable {

  private final List<PeakRow> rows;
  private List<IonPeak> ionPeaks;
  private Map<Ion, double[]> intensities;
  private List<Ion> ions;

  private PeakTable(final List<PeakRow> rows) {
    this.rows = rows;
  }

  /**
   * Sort the rows and check each ion occurs once.
   *
   * @param rows the rows
   * @return the table
   * @throws PeakTableConsistencyException if an ion occurs more than once
   */
  public static PeakTable of(final List<PeakRow> rows) {
    final List<PeakRow> sorted = new ArrayList<>(rows);
    sorted.sort(Comparator.comparing(PeakRow::ion));
    final long unique = sorted.stream().map(PeakRow::ion).distinct().count();
    if (unique != sorted.size()) {
      throw new PeakTableConsistencyException(
          "Not unique formula-adduct combinations " + unique + " != " + sorted.size());
    }
    return new PeakTable(Collections.unmodifiableList(sorted));
  }

  public List<PeakRow> rows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  /**
   * Every peak of every ion, sorted by m/z.
   *
   * @return the peaks
   */
  public synchronized List<IonPeak> ionPeaks() {
    if (ionPeaks == null) {
      final List<IonPeak> peaks = new ArrayList<>();
      for (final PeakRow row : rows) {
        final double[] mzs = row.centroidMzs();
        for (int i = 0; i < mzs.length; i++) {
          peaks.add(ImmutableIonPeak.of(row.formulaId(), row.adduct(), i, mzs[i]));
        }
      }
      peaks.sort(Comparator.comparingDouble(IonPeak::mz));
      ionPeaks = Collections.unmodifiableList(peaks);
    }
    return ionPeaks;
  }

  /**
   * Centroid intensities per ion. The arrays are copies of the row arrays, shared by
   * every caller of this view, and must not be modified.
   *
   * @return the intensities
   */
  public synchronized Map<Ion, double[]> intensities() {
    if (intensities == null) {
      final Map<Ion, double[]> result = new LinkedHashMap<>();
      for (final PeakRow row : rows) {
        result.put(row.ion(), row.centroidInts());
      }
      intensities = Collections.unmodifiableMap(result);
    }
    return intensities;
  }

  /**
   * Ions in table order.
   *
   * @return the ions
   */
  public synchronized List<Ion> ions() {
    if (ions == null) {
      final List<Ion> result = new ArrayList<>(rows.size());
      for (final PeakRow row : rows) {
        result.add(row.ion());
      }
      ions = Collections.unmodifiableList(result);
    }
    return ions;
  }

  @Override
  public String toString() {
    return "PeakTable{" + rows.size() + " ions}";
  }
}
