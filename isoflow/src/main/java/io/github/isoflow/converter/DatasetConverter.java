package io.github.isoflow.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.isoflow.model.Dataset;
import io.github.isoflow.model.DatasetRow;
import io.github.isoflow.model.DatasetStatus;
import io.github.isoflow.model.ImmutableDataset;
import io.github.isoflow.model.ImmutableDatasetRow;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Converts datasets to and from dataset table rows.
 */
@Singleton
public class DatasetConverter {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Dataset converter.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public DatasetConverter(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * To row.
   *
   * @param dataset the dataset
   * @return the dataset row
   */
  public DatasetRow toRow(final Dataset dataset) {
    return ImmutableDatasetRow.builder()
        .id(dataset.id())
        .name(dataset.name())
        .inputPath(dataset.inputPath())
        .uploadDt(dataset.uploadDate())
        .metadata(write(dataset.metadata()))
        .config(write(dataset.config()))
        .status(dataset.status().name())
        .publicDataset(dataset.isPublic())
        .molDbs(write(dataset.molDbs()))
        .build();
  }

  /**
   * To dataset.
   *
   * @param row the row
   * @return the dataset
   */
  public Dataset toDataset(final DatasetRow row) {
    try {
      return ImmutableDataset.builder()
          .id(row.id())
          .name(row.name())
          .inputPath(row.inputPath())
          .uploadDate(row.uploadDt())
          .metadata(readObject(row.metadata()))
          .config(readObject(row.config()))
          .status(DatasetStatus.valueOf(row.status()))
          .isPublic(row.publicDataset())
          .molDbs(row.molDbs() == null ? List.of() : objectMapper.readValue(row.molDbs(), STRING_LIST))
          .build();
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt dataset row " + row.id(), e);
    }
  }

  private ObjectNode readObject(final String json) throws JsonProcessingException {
    if (json == null) {
      return objectMapper.createObjectNode();
    }
    final JsonNode node = objectMapper.readTree(json);
    if (!node.isObject()) {
      throw new IllegalStateException("Expected a JSON object: " + json);
    }
    return (ObjectNode) node;
  }

  private String write(final Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to serialize " + value, e);
    }
  }
}
