package com.example.predictor.cpg.prediction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.example.predictor.cpg.config.PredictorProperties;
import com.example.predictor.cpg.model.Readout;
import com.example.predictor.cpg.model.Scale;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CpgPredictorTest {

  private final CpgPredictor predictor = new CpgPredictor(new PredictorProperties());

  @Test
  void countsEveryCpgPosition() {
    assertThat(CpgPredictor.countCpg("ACGCGT")).isEqualTo(2);
    assertThat(CpgPredictor.countCpg("CGCGCG")).isEqualTo(3);
    assertThat(CpgPredictor.countCpg("GCGC")).isEqualTo(1);
    assertThat(CpgPredictor.countCpg("AAAA")).isZero();
  }

  @Test
  void pointLinearIsSmoothedCpgFraction() {
    TaskPrediction prediction = predictor.predict(Map.of("s1", "ACGCGT"), Readout.POINT, Scale.LINEAR);

    assertThat(prediction.getPredictions().get("s1"))
        .singleElement()
        .satisfies(v -> assertThat(v).isCloseTo((2 + 1e-9) / 6, within(1e-12)));
    assertThat(prediction.getScale()).isEqualTo(Scale.LINEAR);
  }

  @Test
  void pointLogIsLog2OfSmoothedFraction() {
    TaskPrediction prediction = predictor.predict(Map.of("s1", "ACGCGT"), Readout.POINT, Scale.LOG);

    assertThat(prediction.getPredictions().get("s1").get(0)).isCloseTo(-1.585, within(1e-3));
    assertThat(prediction.getScale()).isEqualTo(Scale.LOG);
  }

  @Test
  void missingScaleResolvesToLinear() {
    TaskPrediction prediction = predictor.predict(Map.of("s1", "cg"), Readout.POINT, null);

    assertThat(prediction.getScale()).isEqualTo(Scale.LINEAR);
    assertThat(prediction.getPredictions().get("s1").get(0)).isCloseTo(0.5, within(1e-6));
  }

  @Test
  void cpgFreeSequenceStaysFiniteOnLogScale() {
    double value = CpgPredictor.cpgMean("AAAA", Scale.LOG);

    assertThat(value).isFinite().isCloseTo(Math.log(1e-9 / 4) / Math.log(2), within(1e-9));
  }

  @Test
  void trackHasOneValuePerBase() {
    TaskPrediction prediction = predictor.predict(Map.of("s1", "CGAT"), Readout.TRACK, Scale.LINEAR);

    // Every 50 bp window clips to the whole 4 bp sequence.
    assertThat(prediction.getPredictions().get("s1")).containsExactly(25.0, 25.0, 25.0, 25.0);
  }

  @Test
  void trackWindowIsClippedAndHalfOpen() {
    List<Double> track = CpgPredictor.cpgTrack("CGAAAA", Scale.LINEAR, 4);

    assertThat(track).hasSize(6);
    assertThat(track.get(0)).isCloseTo(50.0, within(1e-9));
    assertThat(track.get(1)).isCloseTo(100.0 / 3, within(1e-9));
    assertThat(track.get(2)).isCloseTo(25.0, within(1e-9));
    assertThat(track.subList(3, 6)).containsExactly(0.0, 0.0, 0.0);
  }

  @Test
  void trackLogAddsEpsilonBeforeLog2() {
    List<Double> track = CpgPredictor.cpgTrack("AAAA", Scale.LOG, 50);

    assertThat(track).hasSize(4)
        .allSatisfy(v -> assertThat(v).isCloseTo(Math.log(1e-9) / Math.log(2), within(1e-9)));
  }
}
