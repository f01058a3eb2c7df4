package com.example.predictor.cpg.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collects error messages per {@link ErrorKind} for a single validation call. Instances are owned
 * by one call and never shared between requests.
 */
public class ErrorAccumulator {

  private final Map<ErrorKind, List<String>> messages = new EnumMap<>(ErrorKind.class);

  public ErrorAccumulator add(ErrorKind kind, String message) {
    Objects.requireNonNull(kind, "kind");
    messages.computeIfAbsent(kind, k -> new ArrayList<>())
        .add(Objects.requireNonNull(message, "message"));
    return this;
  }

  public ErrorAccumulator addAll(ErrorKind kind, List<String> more) {
    more.forEach(message -> add(kind, message));
    return this;
  }

  public boolean isEmpty() {
    return messages.values().stream().allMatch(List::isEmpty);
  }

  public List<String> get(ErrorKind kind) {
    return Collections.unmodifiableList(messages.getOrDefault(kind, List.of()));
  }

  /** All messages, grouped by kind in declaration order. */
  public List<String> all() {
    List<String> union = new ArrayList<>();
    messages.values().forEach(union::addAll);
    return union;
  }

  /**
   * Throws the union of all collected messages. The exception type follows the first kind with
   * messages, in {@link ErrorKind} declaration order.
   */
  public void raiseIfAny() {
    if (isEmpty()) {
      return;
    }
    ErrorKind kind = messages.entrySet().stream()
        .filter(e -> !e.getValue().isEmpty())
        .map(Map.Entry::getKey)
        .findFirst()
        .orElseThrow();
    List<String> union = all();
    switch (kind) {
      case BAD_PREDICTION_REQUEST -> throw new BadPredictionRequestException(union);
      case PREDICTION_REQUEST_FAILED -> throw new PredictionFailedException(union);
      default -> throw new ServerErrorException(String.join("; ", union));
    }
  }
}
