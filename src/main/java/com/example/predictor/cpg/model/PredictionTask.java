package com.example.predictor.cpg.model;

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
public class PredictionTask {
  private String name;
  private String type;
  private String cellType;
  private String species;

  /** Null when the caller did not ask for a scale. */
  private Scale scale;
}
