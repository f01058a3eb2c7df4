package com.example.predictor.cpg.service;

import com.example.predictor.cpg.codec.PayloadCodec;
import com.example.predictor.cpg.config.PredictorProperties;
import com.example.predictor.cpg.model.PredictionRequest;
import com.example.predictor.cpg.model.PredictionTask;
import com.example.predictor.cpg.model.Readout;
import com.example.predictor.cpg.prediction.CpgPredictor;
import com.example.predictor.cpg.prediction.TaskPrediction;
import com.example.predictor.cpg.preprocess.SequencePreprocessor;
import com.example.predictor.cpg.response.PredictionResponse;
import com.example.predictor.cpg.response.TaskPredictionResponse;
import com.example.predictor.cpg.validation.PayloadValidationService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Runs one prediction request end to end: decode, validate, map, preprocess, then score every
 * task. Holds no per-request state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionService {

  static final int TRACK_BIN_SIZE = 1;

  private final PayloadCodec codec;
  private final PayloadValidationService validationService;
  private final PredictionRequestMapper requestMapper;
  private final SequencePreprocessor preprocessor;
  private final CpgPredictor predictor;
  private final PredictorProperties properties;

  public Mono<PredictionResponse> run(byte[] body, String contentType) {
    return Mono.fromCallable(() -> predict(codec.decode(body, contentType)));
  }

  public PredictionResponse predict(ObjectNode payload) {
    validationService.validate(payload);
    PredictionRequest request = requestMapper.toRequest(payload);
    log.info("Request keys 'type', 'cell_type' and 'species' are ignored by {}", properties.getName());

    Map<String, String> sequences = preprocessor.preprocess(request);
    Readout readout = request.getReadout();

    List<TaskPredictionResponse> tasks = request.getPredictionTasks().stream()
        .map(task -> toTaskResponse(task, predictor.predict(sequences, readout, task.getScale())))
        .toList();

    return PredictionResponse.builder()
        .predictorName(properties.getName())
        .binSize(readout == Readout.TRACK ? TRACK_BIN_SIZE : null)
        .predictionTasks(tasks)
        .build();
  }

  private TaskPredictionResponse toTaskResponse(PredictionTask task, TaskPrediction prediction) {
    log.debug("Task '{}' scored {} sequences on {} scale", task.getName(),
        prediction.getPredictions().size(), prediction.getScale().getWireName());
    return TaskPredictionResponse.builder()
        .name(task.getName())
        .typeRequested(task.getType())
        .cellTypeRequested(task.getCellType())
        .speciesRequested(task.getSpecies())
        .scalePredictionRequested(task.getScale() == null ? null : task.getScale().getWireName())
        .scalePredictionActual(prediction.getScale().getWireName())
        .predictions(prediction.getPredictions())
        .build();
  }
}
