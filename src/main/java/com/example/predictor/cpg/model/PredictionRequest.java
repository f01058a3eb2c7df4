package com.example.predictor.cpg.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Typed view of a validated prediction request. Sequence and range maps keep the order in which
 * the caller sent them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class PredictionRequest {
  private Readout readout;

  @Builder.Default
  private List<PredictionTask> predictionTasks = List.of();

  @Builder.Default
  private Map<String, String> sequences = new LinkedHashMap<>();

  /** Non-empty ranges only; an empty {@code []} range leaves its sequence untrimmed. */
  @Builder.Default
  private Map<String, PredictionRange> predictionRanges = new LinkedHashMap<>();

  @Builder.Default
  private String upstreamSeq = "";

  @Builder.Default
  private String downstreamSeq = "";
}
