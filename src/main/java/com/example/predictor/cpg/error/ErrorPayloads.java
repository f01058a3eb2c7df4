package com.example.predictor.cpg.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builds the standard {@code {"error": [{<key>: <message>}, ...]}} body. */
public final class ErrorPayloads {

  public static final String ERROR_FIELD = "error";

  private ErrorPayloads() {
  }

  public static Map<String, Object> toPayload(PredictorException ex) {
    return toPayload(ex.getErrorKey(), ex.getReasons());
  }

  public static Map<String, Object> toPayload(String errorKey, List<String> messages) {
    List<Map<String, String>> entries = messages.stream()
        .map(message -> Map.of(errorKey, message))
        .toList();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(ERROR_FIELD, entries);
    return payload;
  }
}
