package com.example.predictor.cpg.validation;

/** Contract for one check executed as part of request validation. */
public interface PayloadValidator {

  /** The stage in which the validator should be executed. */
  ValidationStage stage();

  /** Runs the check and records every violation on the context; never throws for bad input. */
  void validate(ValidationContext context);
}
