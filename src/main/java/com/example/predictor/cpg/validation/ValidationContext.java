package com.example.predictor.cpg.validation;

import com.example.predictor.cpg.error.ErrorAccumulator;
import com.example.predictor.cpg.error.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;
import java.util.stream.StreamSupport;

/**
 * Carries the decoded payload through the validation stages together with the accumulator that
 * collects violations. Created per validation call and never shared.
 */
public class ValidationContext {

  private final ObjectNode payload;
  private final ErrorAccumulator errors = new ErrorAccumulator();

  public ValidationContext(ObjectNode payload) {
    this.payload = Objects.requireNonNull(payload, "payload");
  }

  public ObjectNode getPayload() {
    return payload;
  }

  /** The value of a top-level key, or {@code null} when the key is absent. */
  public JsonNode field(String key) {
    return payload.get(key);
  }

  public boolean has(String key) {
    return payload.has(key);
  }

  /** Task objects; only valid once the {@link ValidationStage#STRUCTURE} stage passed. */
  public List<ObjectNode> tasks() {
    ArrayNode array = (ArrayNode) payload.get(PayloadKeys.PREDICTION_TASKS);
    return StreamSupport.stream(array.spliterator(), false)
        .map(ObjectNode.class::cast)
        .toList();
  }

  /** Records a {@code bad_prediction_request} violation. */
  public void reject(String message) {
    errors.add(ErrorKind.BAD_PREDICTION_REQUEST, message);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public ErrorAccumulator getErrors() {
    return errors;
  }
}
