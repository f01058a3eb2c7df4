package com.example.predictor.cpg.validation;

import java.util.List;

/** Field names of the prediction request payload. */
public final class PayloadKeys {

  public static final String READOUT = "readout";
  public static final String PREDICTION_TASKS = "prediction_tasks";
  public static final String SEQUENCES = "sequences";
  public static final String PREDICTION_RANGES = "prediction_ranges";
  public static final String UPSTREAM_SEQ = "upstream_seq";
  public static final String DOWNSTREAM_SEQ = "downstream_seq";

  public static final String TASK_NAME = "name";
  public static final String TASK_TYPE = "type";
  public static final String TASK_CELL_TYPE = "cell_type";
  public static final String TASK_SPECIES = "species";
  public static final String TASK_SCALE = "scale";

  public static final List<String> MANDATORY_TOP_LEVEL = List.of(READOUT, PREDICTION_TASKS, SEQUENCES);
  public static final List<String> MANDATORY_TASK = List.of(TASK_NAME, TASK_TYPE, TASK_CELL_TYPE, TASK_SPECIES);

  private PayloadKeys() {
  }
}
