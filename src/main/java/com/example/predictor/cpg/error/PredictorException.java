package com.example.predictor.cpg.error;

import java.util.List;
import java.util.Objects;
import org.springframework.http.HttpStatus;

/**
 * Base class for every error the service reports to its callers. Carries all messages collected
 * by the failing stage so the caller can fix the request in a single round trip.
 */
public abstract class PredictorException extends RuntimeException {

  private final ErrorKind kind;
  private final List<String> reasons;

  protected PredictorException(ErrorKind kind, String message) {
    super(Objects.requireNonNull(message, "message"));
    this.kind = Objects.requireNonNull(kind, "kind");
    this.reasons = List.of(message);
  }

  protected PredictorException(ErrorKind kind, String message, Throwable cause) {
    super(Objects.requireNonNull(message, "message"), cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.reasons = List.of(message);
  }

  protected PredictorException(ErrorKind kind, List<String> reasons) {
    super(formatMessage(reasons));
    this.kind = Objects.requireNonNull(kind, "kind");
    this.reasons = List.copyOf(reasons);
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getErrorKey() {
    return kind.getKey();
  }

  public HttpStatus getStatus() {
    return kind.getStatus();
  }

  public List<String> getReasons() {
    return reasons;
  }

  private static String formatMessage(List<String> reasons) {
    Objects.requireNonNull(reasons, "reasons");
    if (reasons.isEmpty()) {
      throw new IllegalArgumentException("reasons must not be empty");
    }
    if (reasons.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("reasons must not contain null entries");
    }
    return String.join("; ", reasons);
  }
}
