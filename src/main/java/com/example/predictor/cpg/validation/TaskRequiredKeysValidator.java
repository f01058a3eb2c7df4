package com.example.predictor.cpg.validation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Ensures every prediction task carries its mandatory keys. Tasks are identified by their name,
 * falling back to their position in the list.
 */
@Component
@Order(0)
public class TaskRequiredKeysValidator implements PayloadValidator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.TASK_REQUIRED_KEYS;
  }

  @Override
  public void validate(ValidationContext context) {
    List<ObjectNode> tasks = context.tasks();
    for (int index = 0; index < tasks.size(); index++) {
      ObjectNode task = tasks.get(index);
      List<String> missing = PayloadKeys.MANDATORY_TASK.stream()
          .filter(key -> !task.has(key))
          .sorted()
          .toList();
      if (missing.isEmpty()) {
        continue;
      }
      String identifier = task.has(PayloadKeys.TASK_NAME)
          ? ScalarChecks.display(task.get(PayloadKeys.TASK_NAME))
          : "at index " + index;
      context.reject("Mandatory keys missing from prediction_task '" + identifier + "': "
          + String.join(", ", missing));
    }
  }
}
