package com.example.predictor.cpg.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
@JsonPropertyOrder({"predictor_name", "bin_size", "prediction_tasks"})
public class PredictionResponse {

  @JsonProperty("predictor_name")
  private String predictorName;

  /** Only set for track readouts. */
  @JsonProperty("bin_size")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  private Integer binSize;

  @JsonProperty("prediction_tasks")
  private List<TaskPredictionResponse> predictionTasks;
}
