package com.example.predictor.cpg.validation;

/**
 * Identifies where in the validation pipeline a validator runs. Stages execute in declaration
 * order and each one gates the next: later stages may assume the guarantees of earlier ones.
 */
public enum ValidationStage {
  /** Presence of the mandatory top-level keys. */
  REQUIRED_KEYS,
  /** Container shapes later stages walk over: task list, sequence map, range map. */
  STRUCTURE,
  /** Presence of the mandatory keys inside every prediction task. */
  TASK_REQUIRED_KEYS,
  /** Value checks on readout, task fields, ranges and flanks, all accumulated together. */
  FIELD_VALUES
}
