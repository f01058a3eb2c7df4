package com.example.predictor.cpg.error;

/** Backend failure: serialization problems, unreadable resources, unexpected crashes. */
public class ServerErrorException extends PredictorException {

  public ServerErrorException(String message) {
    super(ErrorKind.SERVER_ERROR, message);
  }

  public ServerErrorException(String message, Throwable cause) {
    super(ErrorKind.SERVER_ERROR, message, cause);
  }
}
