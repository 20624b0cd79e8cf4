package io.github.isoflow.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Converts the isotope image id arrays stored with annotation metrics.
 */
@Singleton
public class ImageIdsConverter {

  private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Image ids converter.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public ImageIdsConverter(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Image ids, one per isotope peak. Entries are null where a peak has no image.
   *
   * @param json the stored array, may be null
   * @return the ids
   */
  public List<String> toIds(final String json) {
    if (json == null) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, ID_LIST);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt isotope image ids: " + json, e);
    }
  }

  /**
   * To json.
   *
   * @param ids the ids
   * @return the json array
   */
  public String toJson(final List<String> ids) {
    try {
      return objectMapper.writeValueAsString(ids);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to write isotope image ids", e);
    }
  }
}
