package com.example.predictor.cpg.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** Requested output granularity. */
public enum Readout {
  POINT("point"),
  TRACK("track"),
  INTERACTION_MATRIX("interaction_matrix");

  private final String wireName;

  Readout(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  public static Optional<Readout> fromWireName(String value) {
    return Arrays.stream(values()).filter(r -> r.wireName.equals(value)).findFirst();
  }

  public static List<String> wireNames() {
    return Arrays.stream(values()).map(Readout::getWireName).toList();
  }
}
