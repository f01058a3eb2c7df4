package com.example.predictor.cpg.error;

import org.springframework.http.HttpStatus;

/** Error categories reported to clients, each with a stable key and a fixed HTTP status. */
public enum ErrorKind {
  /** Malformed or unsupported wire format, missing keys, bad values or ranges. */
  BAD_PREDICTION_REQUEST("bad_prediction_request", HttpStatus.BAD_REQUEST),
  /** Well-formed request the model cannot honour. */
  PREDICTION_REQUEST_FAILED("prediction_request_failed", HttpStatus.UNPROCESSABLE_ENTITY),
  /** Serialization failures and unexpected exceptions. */
  SERVER_ERROR("server_error", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String key;
  private final HttpStatus status;

  ErrorKind(String key, HttpStatus status) {
    this.key = key;
    this.status = status;
  }

  public String getKey() {
    return key;
  }

  public HttpStatus getStatus() {
    return status;
  }
}
