package com.example.predictor.cpg.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Result block for one prediction task. The {@code *_actual} fields report "NA" because this
 * model ignores type, cell type and species.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
@JsonPropertyOrder({
    "name", "type_requested", "type_actual", "cell_type_requested", "cell_type_actual",
    "species_requested", "species_actual", "scale_prediction_requested",
    "scale_prediction_actual", "predictions"
})
public class TaskPredictionResponse {
  public static final String NOT_APPLICABLE = "NA";

  private String name;

  @JsonProperty("type_requested")
  private String typeRequested;

  @JsonProperty("type_actual")
  @Builder.Default
  private List<String> typeActual = List.of(NOT_APPLICABLE);

  @JsonProperty("cell_type_requested")
  private String cellTypeRequested;

  @JsonProperty("cell_type_actual")
  @Builder.Default
  private String cellTypeActual = NOT_APPLICABLE;

  @JsonProperty("species_requested")
  private String speciesRequested;

  @JsonProperty("species_actual")
  @Builder.Default
  private String speciesActual = NOT_APPLICABLE;

  @JsonProperty("scale_prediction_requested")
  private String scalePredictionRequested;

  @JsonProperty("scale_prediction_actual")
  private String scalePredictionActual;

  private Map<String, List<Double>> predictions;
}
