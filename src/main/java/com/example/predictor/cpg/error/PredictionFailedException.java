package com.example.predictor.cpg.error;

import java.util.List;

/** The request was valid but the model could not complete the prediction. */
public class PredictionFailedException extends PredictorException {

  public PredictionFailedException(String message) {
    super(ErrorKind.PREDICTION_REQUEST_FAILED, message);
  }

  public PredictionFailedException(List<String> reasons) {
    super(ErrorKind.PREDICTION_REQUEST_FAILED, reasons);
  }
}
