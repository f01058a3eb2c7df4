package com.example.predictor.cpg.model;

import java.util.Arrays;
import java.util.Optional;

public enum Scale {
  LINEAR("linear"),
  LOG("log");

  private final String wireName;

  Scale(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  public static Optional<Scale> fromWireName(String value) {
    return Arrays.stream(values()).filter(s -> s.wireName.equals(value)).findFirst();
  }
}
