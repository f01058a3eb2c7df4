package com.example.predictor.cpg.prediction;

import com.example.predictor.cpg.config.PredictorProperties;
import com.example.predictor.cpg.model.Readout;
import com.example.predictor.cpg.model.Scale;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Deterministic placeholder model: CpG ("CG" dinucleotide) density per sequence, either as one
 * value ({@code point}) or one value per base ({@code track}).
 *
 * <p>Callers pass sequences that already passed preprocessing: non-empty and over
 * {@code A, C, G, T, N}.
 */
@Component
@RequiredArgsConstructor
public class CpgPredictor {

  /** Smoothing constant that keeps {@code log2} finite for CpG-free sequences. */
  public static final double EPSILON = 1e-9;

  private static final String CPG = "CG";

  private final PredictorProperties properties;

  public TaskPrediction predict(Map<String, String> sequences, Readout readout, Scale requestedScale) {
    Scale scale = requestedScale == null ? Scale.LINEAR : requestedScale;
    Map<String, List<Double>> predictions = new LinkedHashMap<>();
    sequences.forEach((id, sequence) -> {
      switch (readout) {
        case POINT -> predictions.put(id, List.of(cpgMean(sequence, scale)));
        case TRACK -> predictions.put(id, cpgTrack(sequence, scale, properties.getTrackWindowSize()));
        default -> throw new IllegalArgumentException("Unsupported readout: " + readout);
      }
    });
    return new TaskPrediction(predictions, scale);
  }

  /** Smoothed fraction of positions that start a CpG. */
  static double cpgMean(String sequence, Scale scale) {
    String s = sequence.toUpperCase(Locale.ROOT);
    double mean = (countCpg(s) + EPSILON) / s.length();
    return scale == Scale.LOG ? log2(mean) : mean;
  }

  /**
   * CpGs per 100 bp in a window of {@code windowSize} centred on each base, clipped to the
   * sequence: positions {@code [max(0, i - half), min(length, i + half))}. Each window is counted
   * on its own substring.
   */
  static List<Double> cpgTrack(String sequence, Scale scale, int windowSize) {
    String s = sequence.toUpperCase(Locale.ROOT);
    int length = s.length();
    int half = windowSize / 2;
    List<Double> track = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      int start = Math.max(0, i - half);
      int end = Math.min(length, i + half);
      int windowLength = end - start;
      double density = windowLength > 0 ? (double) countCpg(s.substring(start, end)) / windowLength * 100 : 0.0;
      track.add(scale == Scale.LOG ? log2(density + EPSILON) : density);
    }
    return track;
  }

  /** Number of positions {@code i} where {@code s[i, i + 2) == "CG"}. */
  static int countCpg(String s) {
    int count = 0;
    for (int i = s.indexOf(CPG); i >= 0; i = s.indexOf(CPG, i + 1)) {
      count++;
    }
    return count;
  }

  private static double log2(double value) {
    return Math.log(value) / Math.log(2);
  }
}
