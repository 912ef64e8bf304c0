package com.acme.homelander.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Map;

/**
 * Shared Jackson mapper for the fulfillment wire format. Nulls are never written and unknown request
 * fields are ignored. A null for a primitive field fails the read, and parameterless commands
 * serialize as an empty object.
 */
public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .setDefaultPropertyInclusion(
              JsonInclude.Value.construct(JsonInclude.Include.NON_NULL, JsonInclude.Include.NON_NULL))
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
          .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

  private Jsons() {}

  public static ObjectMapper mapper() {
    return M;
  }

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  public static String toPrettyJson(Object o) {
    try {
      return M.writerWithDefaultPrettyPrinter().writeValueAsString(o);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  public static JsonNode toTree(Object o) {
    return M.valueToTree(o);
  }

  /**
   * Convert an object to a Map<String, Object> by serializing through Jackson. Used to flatten
   * value records into state fragments.
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> toMap(Object o) {
    try {
      return M.convertValue(o, Map.class);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }
}
