package com.example.predictor.cpg.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.predictor.cpg.model.PredictionRange;
import com.example.predictor.cpg.model.PredictionRequest;
import com.example.predictor.cpg.model.Readout;
import com.example.predictor.cpg.model.Scale;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PredictionRequestMapperTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final PredictionRequestMapper mapper = new PredictionRequestMapper();

  @Test
  void mapsEveryFieldAndDropsEmptyRanges() throws Exception {
    ObjectNode payload = (ObjectNode) objectMapper.readTree("""
        {
          "readout": "track",
          "prediction_tasks": [
            {"name": "t1", "type": "accessibility", "cell_type": "HepG2", "species": "human", "scale": "log"},
            {"name": "t2", "type": "expression", "cell_type": "K562", "species": "mouse"}
          ],
          "sequences": {"s2": "CCGG", "s1": "ACGT"},
          "prediction_ranges": {"s2": [], "s1": [1, 2]},
          "upstream_seq": "AA"
        }
        """);

    PredictionRequest request = mapper.toRequest(payload);

    assertThat(request.getReadout()).isEqualTo(Readout.TRACK);
    assertThat(request.getSequences()).containsExactly(Map.entry("s2", "CCGG"), Map.entry("s1", "ACGT"));
    assertThat(request.getPredictionRanges()).containsExactly(Map.entry("s1", new PredictionRange(1, 2)));
    assertThat(request.getUpstreamSeq()).isEqualTo("AA");
    assertThat(request.getDownstreamSeq()).isEmpty();
    assertThat(request.getPredictionTasks()).hasSize(2);
    assertThat(request.getPredictionTasks().get(0).getScale()).isEqualTo(Scale.LOG);
    assertThat(request.getPredictionTasks().get(1).getScale()).isNull();
    assertThat(request.getPredictionTasks().get(1).getCellType()).isEqualTo("K562");
  }

  @Test
  void eachCallBuildsItsOwnSequenceMap() throws Exception {
    ObjectNode payload = (ObjectNode) objectMapper.readTree("""
        {"readout": "point", "prediction_tasks": [], "sequences": {"s1": "ACGT"}}
        """);

    PredictionRequest first = mapper.toRequest(payload);
    PredictionRequest second = mapper.toRequest(payload);
    first.getSequences().put("s1", "TTTT");

    assertThat(second.getSequences()).containsEntry("s1", "ACGT");
  }
}
