package com.example.predictor.cpg.error;

import java.util.List;

/** The request is unacceptable: malformed body, missing keys, invalid values. */
public class BadPredictionRequestException extends PredictorException {

  public BadPredictionRequestException(String message) {
    super(ErrorKind.BAD_PREDICTION_REQUEST, message);
  }

  public BadPredictionRequestException(String message, Throwable cause) {
    super(ErrorKind.BAD_PREDICTION_REQUEST, message, cause);
  }

  public BadPredictionRequestException(List<String> reasons) {
    super(ErrorKind.BAD_PREDICTION_REQUEST, reasons);
  }
}
