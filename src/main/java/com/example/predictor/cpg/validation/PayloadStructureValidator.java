package com.example.predictor.cpg.validation;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.Map;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Checks the container shapes the later stages walk over: a list of task objects, a map of
 * sequence strings and, when sent, a map of ranges.
 */
@Component
@Order(0)
public class PayloadStructureValidator implements PayloadValidator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.STRUCTURE;
  }

  @Override
  public void validate(ValidationContext context) {
    JsonNode tasks = context.field(PayloadKeys.PREDICTION_TASKS);
    if (!tasks.isArray()) {
      context.reject("'prediction_tasks' must be a list of prediction task objects");
    } else {
      for (int i = 0; i < tasks.size(); i++) {
        if (!tasks.get(i).isObject()) {
          context.reject("prediction_task at index " + i + " must be an object");
        }
      }
    }

    JsonNode sequences = context.field(PayloadKeys.SEQUENCES);
    if (!sequences.isObject()) {
      context.reject("'sequences' must be an object mapping sequence ids to sequences");
    } else {
      Iterator<Map.Entry<String, JsonNode>> it = sequences.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> entry = it.next();
        if (!entry.getValue().isTextual()) {
          context.reject("sequence '" + entry.getKey() + "' must be a string");
        }
      }
    }

    if (context.has(PayloadKeys.PREDICTION_RANGES)
        && !context.field(PayloadKeys.PREDICTION_RANGES).isObject()) {
      context.reject("'prediction_ranges' must be an object mapping sequence ids to ranges");
    }
  }
}
