package com.example.predictor.cpg.validation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.stereotype.Service;

/**
 * Coordinates all registered {@link PayloadValidator} beans. Validators of one stage all run, in
 * {@code @Order} order, and accumulate; the first stage that produced violations raises them
 * together.
 */
@Slf4j
@Service
public class PayloadValidationService {

  private final Map<ValidationStage, List<PayloadValidator>> validatorsByStage =
      new EnumMap<>(ValidationStage.class);

  public PayloadValidationService(List<PayloadValidator> validators) {
    List<PayloadValidator> safeValidators = new ArrayList<>(validators == null ? List.of() : validators);
    safeValidators.removeIf(Objects::isNull);
    AnnotationAwareOrderComparator.sort(safeValidators);
    safeValidators.forEach(v -> validatorsByStage.computeIfAbsent(v.stage(), s -> new ArrayList<>()).add(v));
  }

  /**
   * Validates a decoded request payload.
   *
   * @throws com.example.predictor.cpg.error.BadPredictionRequestException with every violation of
   *     the first failing stage
   */
  public void validate(ObjectNode payload) {
    ValidationContext context = new ValidationContext(payload);
    for (ValidationStage stage : ValidationStage.values()) {
      for (PayloadValidator validator : validatorsByStage.getOrDefault(stage, List.of())) {
        validator.validate(context);
      }
      if (context.hasErrors()) {
        log.warn("Request rejected at stage {}: {}", stage, context.getErrors().all());
        context.getErrors().raiseIfAny();
      }
    }
  }
}
