package com.example.predictor.cpg.service;

import com.example.predictor.cpg.model.PredictionRange;
import com.example.predictor.cpg.model.PredictionRequest;
import com.example.predictor.cpg.model.PredictionTask;
import com.example.predictor.cpg.model.Readout;
import com.example.predictor.cpg.model.Scale;
import com.example.predictor.cpg.validation.PayloadKeys;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Maps a payload that passed validation onto {@link PredictionRequest}. Every call builds fresh
 * collections, so nothing is shared with the decoded tree or with other requests.
 */
@Component
public class PredictionRequestMapper {

  public PredictionRequest toRequest(ObjectNode payload) {
    Map<String, String> sequences = new LinkedHashMap<>();
    payload.get(PayloadKeys.SEQUENCES).fields()
        .forEachRemaining(e -> sequences.put(e.getKey(), e.getValue().textValue()));

    Map<String, PredictionRange> ranges = new LinkedHashMap<>();
    JsonNode rangesNode = payload.get(PayloadKeys.PREDICTION_RANGES);
    if (rangesNode != null) {
      rangesNode.fields().forEachRemaining(e -> {
        JsonNode range = e.getValue();
        if (!range.isEmpty()) {
          ranges.put(e.getKey(), new PredictionRange(range.get(0).intValue(), range.get(1).intValue()));
        }
      });
    }

    List<PredictionTask> tasks = new ArrayList<>();
    payload.get(PayloadKeys.PREDICTION_TASKS).forEach(task -> tasks.add(toTask(task)));

    return PredictionRequest.builder()
        .readout(Readout.fromWireName(payload.get(PayloadKeys.READOUT).textValue()).orElseThrow())
        .predictionTasks(List.copyOf(tasks))
        .sequences(sequences)
        .predictionRanges(ranges)
        .upstreamSeq(textOrEmpty(payload.get(PayloadKeys.UPSTREAM_SEQ)))
        .downstreamSeq(textOrEmpty(payload.get(PayloadKeys.DOWNSTREAM_SEQ)))
        .build();
  }

  private PredictionTask toTask(JsonNode task) {
    JsonNode scale = task.get(PayloadKeys.TASK_SCALE);
    return PredictionTask.builder()
        .name(task.get(PayloadKeys.TASK_NAME).textValue())
        .type(task.get(PayloadKeys.TASK_TYPE).textValue())
        .cellType(task.get(PayloadKeys.TASK_CELL_TYPE).textValue())
        .species(task.get(PayloadKeys.TASK_SPECIES).textValue())
        .scale(scale == null ? null : Scale.fromWireName(scale.textValue()).orElseThrow())
        .build();
  }

  private static String textOrEmpty(JsonNode node) {
    return node == null ? "" : node.textValue();
  }
}
