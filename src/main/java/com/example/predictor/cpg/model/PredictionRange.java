package com.example.predictor.cpg.model;

import lombok.Value;

/** Inclusive {@code [start, end]} window into a flanked sequence. */
@Value
public class PredictionRange {
  int start;
  int end;

  /** Returns the inclusive slice of {@code sequence}. */
  public String slice(String sequence) {
    return sequence.substring(start, end + 1);
  }
}
