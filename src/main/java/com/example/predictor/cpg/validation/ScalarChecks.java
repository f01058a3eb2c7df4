package com.example.predictor.cpg.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/** Shared node-type checks used by the field validators. */
final class ScalarChecks {

  private ScalarChecks() {
  }

  /**
   * Accepts a single string value. Lists and any other non-string node are reported on the
   * context.
   *
   * @return the string when the node is one, empty otherwise
   */
  static Optional<String> scalarString(ValidationContext context, String field, JsonNode value) {
    if (value != null && value.isArray()) {
      context.reject("'" + field + "' should only have 1 value");
      return Optional.empty();
    }
    if (value == null || !value.isTextual()) {
      context.reject("'" + field + "' value should be a string");
      return Optional.empty();
    }
    return Optional.of(value.textValue());
  }

  static Set<String> fieldNames(ObjectNode node) {
    Set<String> names = new LinkedHashSet<>();
    Iterator<String> it = node.fieldNames();
    it.forEachRemaining(names::add);
    return names;
  }

  /** Renders a node for a message: strings without quotes, everything else as JSON. */
  static String display(JsonNode node) {
    return node.isTextual() ? node.textValue() : node.toString();
  }
}
