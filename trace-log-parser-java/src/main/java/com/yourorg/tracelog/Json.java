package com.yourorg.tracelog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared Jackson setup plus the small null-tolerant accessors every reader in this package uses.
 * Report POJOs expose public camelCase fields; on disk they are snake_case.
 */
public final class Json {

  public static final ObjectMapper MAPPER = new ObjectMapper()
      .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  public static final ObjectWriter PRETTY = MAPPER.writerWithDefaultPrettyPrinter();

  private Json() {}

  /** Parses {@code text} and returns it only if it is a JSON object; otherwise null. */
  public static ObjectNode readObject(String text) {
    try {
      JsonNode n = MAPPER.readTree(text);
      return n != null && n.isObject() ? (ObjectNode) n : null;
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  public static String compact(JsonNode n) throws JsonProcessingException {
    return MAPPER.writeValueAsString(n);
  }

  public static String pretty(Object o) throws JsonProcessingException {
    return PRETTY.writeValueAsString(o);
  }

  /** Field value, or null when absent or JSON null. */
  public static JsonNode present(JsonNode n, String f) {
    if (n == null) return null;
    JsonNode x = n.get(f);
    return x != null && !x.isNull() && !x.isMissingNode() ? x : null;
  }

  public static String textAt(JsonNode n, String f) {
    JsonNode x = present(n, f);
    return x != null ? x.asText() : null;
  }

  public static Long longAtOrNull(JsonNode n, String f) {
    JsonNode x = present(n, f);
    return x != null && x.isIntegralNumber() ? x.asLong() : null;
  }

  public static Integer intAtOrNull(JsonNode n, String f) {
    JsonNode x = present(n, f);
    return x != null && x.isIntegralNumber() ? x.asInt() : null;
  }

  /** Text field that must be present; used by handlers whose metadata is malformed without it. */
  public static String requireText(JsonNode n, String f) {
    JsonNode x = present(n, f);
    if (x == null || !x.isTextual()) {
      throw new IllegalArgumentException("missing string field '" + f + "'");
    }
    return x.asText();
  }
}
