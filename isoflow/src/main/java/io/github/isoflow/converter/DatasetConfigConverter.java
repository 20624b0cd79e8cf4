package io.github.isoflow.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.isoflow.model.ImmutableMolDbRef;
import io.github.isoflow.model.IsotopeGenerationConfig;
import io.github.isoflow.model.MolDbRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Reads the typed sections of a dataset config document.
 */
@Singleton
public class DatasetConfigConverter {

  /**
   * Key of the molecular database selection.
   */
  public static final String DATABASES = "databases";

  /**
   * Key of the isotope generation parameters.
   */
  public static final String ISOTOPE_GENERATION = "isotope_generation";

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Dataset config converter.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public DatasetConfigConverter(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Molecular database selection, in config order. Missing list means no selection.
   *
   * @param config the config
   * @return the databases
   */
  public List<MolDbRef> databases(final ObjectNode config) {
    final JsonNode databases = config.path(DATABASES);
    final List<MolDbRef> result = new ArrayList<>();
    for (final JsonNode entry : databases) {
      final JsonNode name = entry.get("name");
      if (name == null || name.isNull()) {
        throw new IllegalArgumentException("Molecular database entry without a name: " + entry);
      }
      final JsonNode version = entry.get("version");
      result.add(ImmutableMolDbRef.of(name.asText(),
          version == null || version.isNull() ? Optional.empty() : Optional.of(version.asText())));
    }
    return result;
  }

  /**
   * The config without the molecular database selection.
   *
   * @param config the config
   * @return a copy without {@value #DATABASES}
   */
  public ObjectNode withoutDatabases(final ObjectNode config) {
    final ObjectNode copy = config.deepCopy();
    copy.remove(DATABASES);
    return copy;
  }

  /**
   * Isotope generation parameters.
   *
   * @param config the config
   * @return the parameters
   */
  public IsotopeGenerationConfig isotopeGeneration(final ObjectNode config) {
    final JsonNode section = config.get(ISOTOPE_GENERATION);
    if (section == null || !section.isObject()) {
      throw new IllegalArgumentException("Dataset config has no " + ISOTOPE_GENERATION + " section");
    }
    try {
      return objectMapper.treeToValue(section, IsotopeGenerationConfig.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid " + ISOTOPE_GENERATION + " section: " + section, e);
    }
  }
}
