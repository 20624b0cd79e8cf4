package io.github.isoflow.diff;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.isoflow.converter.DatasetConfigConverter;
import io.github.isoflow.model.ConfigDiff;
import io.github.isoflow.model.MolDbRef;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Classifies the change between two dataset configurations.
 *
 * <p>Comparisons are structural, object key order does not matter. Removing a database
 * from the selection is not a difference on its own, see {@link #removedMolDbs}.
 */
@Singleton
public class ConfigDiffClassifier {

  private final DatasetConfigConverter configConverter;

  /**
   * Instantiates a new Config diff classifier.
   *
   * @param configConverter the config converter
   */
  @Inject
  public ConfigDiffClassifier(final DatasetConfigConverter configConverter) {
    this.configConverter = configConverter;
  }

  /**
   * Classify.
   *
   * @param oldConfig the stored config
   * @param newConfig the requested config
   * @return the diff
   */
  public ConfigDiff classify(final ObjectNode oldConfig, final ObjectNode newConfig) {
    if (oldConfig.equals(newConfig)) {
      return ConfigDiff.EQUAL;
    }
    if (!configConverter.withoutDatabases(oldConfig).equals(configConverter.withoutDatabases(newConfig))) {
      return ConfigDiff.INSTR_PARAMS_DIFF;
    }
    final Set<MolDbRef> added = molDbSet(newConfig);
    added.removeAll(molDbSet(oldConfig));
    return added.isEmpty() ? ConfigDiff.EQUAL : ConfigDiff.NEW_MOL_DB;
  }

  /**
   * Databases selected in the old config but not in the new one.
   *
   * @param oldConfig the stored config
   * @param newConfig the requested config
   * @return the removed databases
   */
  public Set<MolDbRef> removedMolDbs(final ObjectNode oldConfig, final ObjectNode newConfig) {
    final Set<MolDbRef> removed = molDbSet(oldConfig);
    removed.removeAll(molDbSet(newConfig));
    return removed;
  }

  /**
   * Metadata changed.
   *
   * @param oldMetadata the stored metadata
   * @param newMetadata the requested metadata
   * @return true if they differ
   */
  public boolean metadataChanged(final ObjectNode oldMetadata, final ObjectNode newMetadata) {
    return !oldMetadata.equals(newMetadata);
  }

  private Set<MolDbRef> molDbSet(final ObjectNode config) {
    return new LinkedHashSet<>(configConverter.databases(config));
  }
}
