package com.github.spud.intake.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

/**
 * Shared Jackson helpers. Dates are written as ISO strings, never as timestamps.
 */
public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = new ObjectMapper()
    .registerModule(new JavaTimeModule())
    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private static final JsonUtils INSTANCE = new JsonUtils();

  public static ObjectMapper objectMapper() {
    return objectMapper;
  }

  public static JsonNode readTree(String json) {
    return INSTANCE.tryParse(() -> objectMapper.readTree(json), Exception.class);
  }

  /**
   * Lenient variant for model supplied tool arguments: blank input reads as an empty object.
   */
  public static JsonNode readArguments(String json) {
    if (json == null || json.isBlank()) {
      return objectMapper.createObjectNode();
    }
    return readTree(json);
  }

  public static String toJson(Object obj) {
    return INSTANCE.tryParse(() -> objectMapper.writeValueAsString(obj), Exception.class);
  }

  public static String toPrettyJson(Object obj) {
    return INSTANCE.tryParse(
      () -> objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj), Exception.class);
  }

  public static <T> T convert(Object value, TypeReference<T> typeReference) {
    return objectMapper.convertValue(value, typeReference);
  }

  @Override
  public Map<String, Object> parseMap(String json) throws JsonParseException {
    return Collections.emptyMap();
  }

  @Override
  public List<Object> parseList(String json) throws JsonParseException {
    return Collections.emptyList();
  }

}
