package io.intellixity.arbor.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.arbor.error.PredicateException;

/** Reads and writes {@link QuerySpec}s in their JSON request form. */
public final class QuerySpecJson {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private QuerySpecJson() {}

  public static QuerySpec read(String json) {
    try {
      return MAPPER.readValue(json, QuerySpec.class);
    } catch (JsonProcessingException e) {
      throw new PredicateException("Invalid query JSON: " + e.getOriginalMessage());
    }
  }

  public static String write(QuerySpec spec) {
    try {
      return MAPPER.writeValueAsString(spec);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to write query JSON", e);
    }
  }
}
