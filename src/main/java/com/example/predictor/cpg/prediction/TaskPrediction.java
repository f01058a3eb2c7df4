package com.example.predictor.cpg.prediction;

import com.example.predictor.cpg.model.Scale;
import java.util.List;
import java.util.Map;
import lombok.Value;

/** Per-sequence predictions for one task plus the scale actually applied. */
@Value
public class TaskPrediction {
  Map<String, List<Double>> predictions;
  Scale scale;
}
