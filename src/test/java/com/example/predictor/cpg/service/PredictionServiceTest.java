package com.example.predictor.cpg.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.example.predictor.cpg.codec.PayloadCodec;
import com.example.predictor.cpg.config.PredictorProperties;
import com.example.predictor.cpg.error.BadPredictionRequestException;
import com.example.predictor.cpg.error.PredictionFailedException;
import com.example.predictor.cpg.prediction.CpgPredictor;
import com.example.predictor.cpg.preprocess.SequencePreprocessor;
import com.example.predictor.cpg.response.PredictionResponse;
import com.example.predictor.cpg.response.TaskPredictionResponse;
import com.example.predictor.cpg.validation.FlankingSequenceValidator;
import com.example.predictor.cpg.validation.PayloadStructureValidator;
import com.example.predictor.cpg.validation.PayloadValidationService;
import com.example.predictor.cpg.validation.PredictionRangesValidator;
import com.example.predictor.cpg.validation.ReadoutValidator;
import com.example.predictor.cpg.validation.RequiredKeysValidator;
import com.example.predictor.cpg.validation.TaskFieldsValidator;
import com.example.predictor.cpg.validation.TaskRequiredKeysValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class PredictionServiceTest {

  private final PredictorProperties properties = new PredictorProperties();
  private final PredictionService service = newService(properties);

  private static PredictionService newService(PredictorProperties properties) {
    PayloadValidationService validationService = new PayloadValidationService(List.of(
        new RequiredKeysValidator(),
        new PayloadStructureValidator(),
        new TaskRequiredKeysValidator(),
        new ReadoutValidator(),
        new TaskFieldsValidator(),
        new PredictionRangesValidator(),
        new FlankingSequenceValidator()));
    return new PredictionService(
        new PayloadCodec(new ObjectMapper(), properties),
        validationService,
        new PredictionRequestMapper(),
        new SequencePreprocessor(properties),
        new CpgPredictor(properties),
        properties);
  }

  @Test
  void pointPredictionReportsRequestedAndActualFields() {
    PredictionResponse response = run("""
        {
          "readout": "point",
          "prediction_tasks": [
            {"name": "t1", "type": "accessibility", "cell_type": "HepG2", "species": "human"},
            {"name": "t2", "type": "binding_CTCF", "cell_type": "K562", "species": "mouse", "scale": "log"}
          ],
          "sequences": {"s1": "ACGCGT"}
        }
        """);

    assertThat(response.getPredictorName()).isEqualTo("CpG Predictor");
    assertThat(response.getBinSize()).isNull();
    assertThat(response.getPredictionTasks()).hasSize(2);

    TaskPredictionResponse linear = response.getPredictionTasks().get(0);
    assertThat(linear.getName()).isEqualTo("t1");
    assertThat(linear.getTypeRequested()).isEqualTo("accessibility");
    assertThat(linear.getTypeActual()).containsExactly("NA");
    assertThat(linear.getCellTypeRequested()).isEqualTo("HepG2");
    assertThat(linear.getCellTypeActual()).isEqualTo("NA");
    assertThat(linear.getSpeciesRequested()).isEqualTo("human");
    assertThat(linear.getSpeciesActual()).isEqualTo("NA");
    assertThat(linear.getScalePredictionRequested()).isNull();
    assertThat(linear.getScalePredictionActual()).isEqualTo("linear");
    assertThat(linear.getPredictions().get("s1").get(0)).isCloseTo(1.0 / 3, within(1e-6));

    TaskPredictionResponse log = response.getPredictionTasks().get(1);
    assertThat(log.getScalePredictionRequested()).isEqualTo("log");
    assertThat(log.getScalePredictionActual()).isEqualTo("log");
    assertThat(log.getPredictions().get("s1").get(0)).isCloseTo(-1.585, within(1e-3));
  }

  @Test
  void trackPredictionCarriesBinSizeAndOneValuePerBase() {
    PredictionResponse response = run("""
        {
          "readout": "track",
          "prediction_tasks": [{"name": "t1", "type": "expression", "cell_type": "HepG2", "species": "human"}],
          "sequences": {"s1": "ACGTACGT", "s2": "AAA"}
        }
        """);

    assertThat(response.getBinSize()).isEqualTo(1);
    assertThat(response.getPredictionTasks().get(0).getPredictions().get("s1")).hasSize(8);
    assertThat(response.getPredictionTasks().get(0).getPredictions().get("s2")).containsExactly(0.0, 0.0, 0.0);
  }

  @Test
  void flankedThenTrimmedSequenceIsScored() {
    PredictionResponse response = run("""
        {
          "readout": "point",
          "prediction_tasks": [{"name": "t1", "type": "accessibility", "cell_type": "c", "species": "s"}],
          "sequences": {"s1": "AT"},
          "prediction_ranges": {"s1": [0, 1]},
          "upstream_seq": "CG"
        }
        """);

    assertThat(response.getPredictionTasks().get(0).getPredictions().get("s1").get(0))
        .isCloseTo((1 + 1e-9) / 2, within(1e-12));
  }

  @Test
  void emptyRangeLeavesSequenceUntouched() {
    PredictionResponse response = run("""
        {
          "readout": "point",
          "prediction_tasks": [{"name": "t1", "type": "accessibility", "cell_type": "c", "species": "s"}],
          "sequences": {"s1": "ACGCGT"},
          "prediction_ranges": {"s1": []}
        }
        """);

    assertThat(response.getPredictionTasks().get(0).getPredictions().get("s1").get(0))
        .isCloseTo((2 + 1e-9) / 6, within(1e-12));
  }

  @Test
  void validationErrorsSurfaceThroughTheMono() {
    StepVerifier.create(service.run(utf8("{\"readout\": \"point\"}"), "application/json"))
        .expectErrorSatisfies(ex -> assertThat(ex)
            .isInstanceOf(BadPredictionRequestException.class)
            .hasMessageContaining("prediction_tasks, sequences"))
        .verify();
  }

  @Test
  void alphabetViolationsAreUnprocessable() {
    assertThatThrownBy(() -> run("""
        {
          "readout": "point",
          "prediction_tasks": [{"name": "t1", "type": "accessibility", "cell_type": "c", "species": "s"}],
          "sequences": {"s1": "ACGU"}
        }
        """))
        .isInstanceOf(PredictionFailedException.class)
        .hasMessage("sequence 's1' has invalid character(s): [U]");
  }

  private PredictionResponse run(String json) {
    return service.run(utf8(json), "application/json").block();
  }

  private static byte[] utf8(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
