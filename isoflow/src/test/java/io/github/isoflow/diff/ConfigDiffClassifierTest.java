package io.github.isoflow.diff;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.isoflow.DatasetFixtures;
import io.github.isoflow.converter.DatasetConfigConverter;
import io.github.isoflow.model.ConfigDiff;
import io.github.isoflow.model.ImmutableMolDbRef;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConfigDiffClassifierTest {

  private ConfigDiffClassifier classifier;

  @BeforeEach
  void setup() {
    classifier = new ConfigDiffClassifier(new DatasetConfigConverter(new ObjectMapper()));
  }

  private ObjectNode withDatabases(final String databases) {
    return DatasetFixtures.withDatabases(DatasetFixtures.dataset(), databases).config();
  }

  @Test
  void classify_equal() {
    assertThat(classifier.classify(DatasetFixtures.config(), DatasetFixtures.config())).isEqualTo(ConfigDiff.EQUAL);
  }

  @Test
  void classify_keyOrderIgnored() {
    final ObjectNode reordered = DatasetFixtures.json("""
        {
          "image_generation": {"nlevels": 30, "ppm": 3.0},
          "isotope_generation": {
            "isocalc_pts_per_mz": 8078,
            "isocalc_sigma": 0.000619,
            "charge": {"n_charges": 1, "polarity": "+"},
            "adducts": ["+H", "+Na"]
          },
          "databases": [{"version": "2016", "name": "HMDB"}]
        }
        """);

    assertThat(classifier.classify(DatasetFixtures.config(), reordered)).isEqualTo(ConfigDiff.EQUAL);
  }

  @Test
  void classify_instrumentParameters() {
    final ObjectNode updated = DatasetFixtures.config();
    ((ObjectNode) updated.get("image_generation")).put("ppm", 2.0);

    assertThat(classifier.classify(DatasetFixtures.config(), updated)).isEqualTo(ConfigDiff.INSTR_PARAMS_DIFF);
  }

  @Test
  void classify_instrumentParametersWinOverDatabases() {
    final ObjectNode updated = withDatabases("[{\"name\": \"HMDB\", \"version\": \"2016\"}, {\"name\": \"ChEBI\"}]");
    ((ObjectNode) updated.get("image_generation")).put("ppm", 2.0);

    assertThat(classifier.classify(DatasetFixtures.config(), updated)).isEqualTo(ConfigDiff.INSTR_PARAMS_DIFF);
  }

  @Test
  void classify_newDatabase() {
    final ObjectNode updated = withDatabases("[{\"name\": \"HMDB\", \"version\": \"2016\"}, {\"name\": \"ChEBI\"}]");

    assertThat(classifier.classify(DatasetFixtures.config(), updated)).isEqualTo(ConfigDiff.NEW_MOL_DB);
  }

  @Test
  void classify_newDatabaseVersion() {
    final ObjectNode updated = withDatabases("[{\"name\": \"HMDB\", \"version\": \"2017\"}]");

    assertThat(classifier.classify(DatasetFixtures.config(), updated)).isEqualTo(ConfigDiff.NEW_MOL_DB);
  }

  @Test
  void classify_removedDatabase() {
    final ObjectNode old = withDatabases("[{\"name\": \"HMDB\", \"version\": \"2016\"}, {\"name\": \"ChEBI\"}]");

    assertThat(classifier.classify(old, DatasetFixtures.config())).isEqualTo(ConfigDiff.EQUAL);
    assertThat(classifier.removedMolDbs(old, DatasetFixtures.config()))
        .containsExactly(ImmutableMolDbRef.of("ChEBI", Optional.empty()));
  }

  @Test
  void classify_reorderedDatabases() {
    final ObjectNode old = withDatabases("[{\"name\": \"HMDB\", \"version\": \"2016\"}, {\"name\": \"ChEBI\"}]");
    final ObjectNode updated = withDatabases("[{\"name\": \"ChEBI\"}, {\"name\": \"HMDB\", \"version\": \"2016\"}]");

    assertThat(classifier.classify(old, updated)).isEqualTo(ConfigDiff.EQUAL);
  }

  @Test
  void metadataChanged() {
    final ObjectNode updated = DatasetFixtures.metadata();
    updated.put("Additional", "info");

    assertThat(classifier.metadataChanged(DatasetFixtures.metadata(), DatasetFixtures.metadata())).isFalse();
    assertThat(classifier.metadataChanged(DatasetFixtures.metadata(), updated)).isTrue();
  }

}
