package com.example.predictor.cpg.validation;

import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Ensures the mandatory top-level keys are present. */
@Component
@Order(0)
public class RequiredKeysValidator implements PayloadValidator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.REQUIRED_KEYS;
  }

  @Override
  public void validate(ValidationContext context) {
    List<String> missing = PayloadKeys.MANDATORY_TOP_LEVEL.stream()
        .filter(key -> !context.has(key))
        .sorted()
        .toList();
    if (!missing.isEmpty()) {
      context.reject("The following mandatory top-level keys are missing from the JSON: "
          + String.join(", ", missing));
    }
  }
}
