package com.example.predictor.cpg.validation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TaskFieldsValidatorTest {

  @Test
  void recognisesFixedTypesAndPrefixes() {
    assertThat(TaskFieldsValidator.isRecognizedType("accessibility")).isTrue();
    assertThat(TaskFieldsValidator.isRecognizedType("expression")).isTrue();
    assertThat(TaskFieldsValidator.isRecognizedType("binding_CTCF")).isTrue();
    assertThat(TaskFieldsValidator.isRecognizedType("expression_RNA")).isTrue();
    assertThat(TaskFieldsValidator.isRecognizedType("conformation_loop")).isTrue();
  }

  @Test
  void rejectsEverythingElse() {
    assertThat(TaskFieldsValidator.isRecognizedType("binding")).isFalse();
    assertThat(TaskFieldsValidator.isRecognizedType("Accessibility")).isFalse();
    assertThat(TaskFieldsValidator.isRecognizedType("")).isFalse();
  }
}
