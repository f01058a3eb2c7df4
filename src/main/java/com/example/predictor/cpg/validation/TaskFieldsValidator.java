package com.example.predictor.cpg.validation;

import com.example.predictor.cpg.model.Scale;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Value checks on every prediction task. Runs after {@link TaskRequiredKeysValidator}, so the
 * mandatory keys are known to exist.
 */
@Component
@Order(20)
public class TaskFieldsValidator implements PayloadValidator {

  static final Set<String> KNOWN_TYPES = Set.of("accessibility", "expression");
  static final List<String> TYPE_PREFIXES = List.of("binding_", "expression_", "conformation_");

  @Override
  public ValidationStage stage() {
    return ValidationStage.FIELD_VALUES;
  }

  @Override
  public void validate(ValidationContext context) {
    List<ObjectNode> tasks = context.tasks();
    tasks.forEach(task -> ScalarChecks.scalarString(
        context, PayloadKeys.TASK_NAME, task.get(PayloadKeys.TASK_NAME)));
    tasks.forEach(task -> checkType(context, task));
    tasks.forEach(task -> ScalarChecks.scalarString(
        context, PayloadKeys.TASK_CELL_TYPE, task.get(PayloadKeys.TASK_CELL_TYPE)));
    tasks.forEach(task -> ScalarChecks.scalarString(
        context, PayloadKeys.TASK_SPECIES, task.get(PayloadKeys.TASK_SPECIES)));
    tasks.stream()
        .filter(task -> task.has(PayloadKeys.TASK_SCALE))
        .forEach(task -> checkScale(context, task));
  }

  private void checkType(ValidationContext context, ObjectNode task) {
    ScalarChecks.scalarString(context, PayloadKeys.TASK_TYPE, task.get(PayloadKeys.TASK_TYPE))
        .filter(type -> !isRecognizedType(type))
        .ifPresent(type -> context.reject("prediction type " + type + " is not recognized"));
  }

  private void checkScale(ValidationContext context, ObjectNode task) {
    ScalarChecks.scalarString(context, PayloadKeys.TASK_SCALE, task.get(PayloadKeys.TASK_SCALE))
        .filter(scale -> Scale.fromWireName(scale).isEmpty())
        .ifPresent(scale -> context.reject(
            "scale requested is not recognized. Please choose from ['log', 'linear']"));
  }

  static boolean isRecognizedType(String type) {
    return KNOWN_TYPES.contains(type) || TYPE_PREFIXES.stream().anyMatch(type::startsWith);
  }
}
