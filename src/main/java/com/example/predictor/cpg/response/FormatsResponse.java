package com.example.predictor.cpg.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FormatsResponse {

  @JsonProperty("predictor_supported_request_formats")
  private List<String> supportedRequestFormats;

  @JsonProperty("predictor_supported_response_formats")
  private List<String> supportedResponseFormats;
}
