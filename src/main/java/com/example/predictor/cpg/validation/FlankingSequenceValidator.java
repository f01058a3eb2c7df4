package com.example.predictor.cpg.validation;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Optional flanks must be single strings. */
@Component
@Order(40)
public class FlankingSequenceValidator implements PayloadValidator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.FIELD_VALUES;
  }

  @Override
  public void validate(ValidationContext context) {
    for (String key : new String[] {PayloadKeys.UPSTREAM_SEQ, PayloadKeys.DOWNSTREAM_SEQ}) {
      if (context.has(key)) {
        ScalarChecks.scalarString(context, key, context.field(key));
      }
    }
  }
}
