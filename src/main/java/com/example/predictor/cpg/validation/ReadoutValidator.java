package com.example.predictor.cpg.validation;

import com.example.predictor.cpg.model.Readout;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** The readout must be one string from the recognised set. */
@Component
@Order(10)
public class ReadoutValidator implements PayloadValidator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.FIELD_VALUES;
  }

  @Override
  public void validate(ValidationContext context) {
    ScalarChecks.scalarString(context, PayloadKeys.READOUT, context.field(PayloadKeys.READOUT))
        .filter(readout -> Readout.fromWireName(readout).isEmpty())
        .ifPresent(readout -> context.reject(
            "readout requested is not recognized. Please choose from "
                + "['point', 'track', 'interaction_matrix']"));
  }
}
