package com.example.predictor.cpg.preprocess;

import com.example.predictor.cpg.config.PredictorProperties;
import com.example.predictor.cpg.error.BadPredictionRequestException;
import com.example.predictor.cpg.error.ErrorAccumulator;
import com.example.predictor.cpg.error.ErrorKind;
import com.example.predictor.cpg.model.PredictionRange;
import com.example.predictor.cpg.model.PredictionRequest;
import com.example.predictor.cpg.model.Readout;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Model-specific preprocessing: flanking, then range trimming, then alphabet checks. Ranges index
 * into the flanked sequence. Each step returns a new map and never touches the request's own.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SequencePreprocessor {

  static final Set<Readout> SUPPORTED_READOUTS = Set.of(Readout.POINT, Readout.TRACK);
  static final String VALID_BASES = "ACGTN";

  private final PredictorProperties properties;

  /**
   * Produces the sequences the model will score.
   *
   * @throws BadPredictionRequestException when the readout is not served by this model
   * @throws com.example.predictor.cpg.error.PredictionFailedException when a final sequence is
   *     empty or has characters outside {@code A, C, G, T, N}
   */
  public Map<String, String> preprocess(PredictionRequest request) {
    checkReadout(request.getReadout());
    Map<String, String> flanked = applyFlanks(
        request.getSequences(), request.getUpstreamSeq(), request.getDownstreamSeq());
    Map<String, String> trimmed = applyRanges(flanked, request.getPredictionRanges());
    checkSequences(trimmed);
    return trimmed;
  }

  void checkReadout(Readout readout) {
    if (!SUPPORTED_READOUTS.contains(readout)) {
      throw new BadPredictionRequestException(
          properties.getName() + " cannot process '" + readout.getWireName() + "' readout type.");
    }
  }

  static Map<String, String> applyFlanks(Map<String, String> sequences, String upstream, String downstream) {
    String up = upstream == null ? "" : upstream;
    String down = downstream == null ? "" : downstream;
    Map<String, String> result = new LinkedHashMap<>(sequences);
    if (up.isEmpty() && down.isEmpty()) {
      return result;
    }
    log.info("Applying flanking: +{} bases upstream, +{} bases downstream", up.length(), down.length());
    result.replaceAll((id, sequence) -> up + sequence + down);
    return result;
  }

  static Map<String, String> applyRanges(Map<String, String> sequences, Map<String, PredictionRange> ranges) {
    Map<String, String> result = new LinkedHashMap<>(sequences);
    ranges.forEach((id, range) -> {
      result.put(id, range.slice(result.get(id)));
      log.info("Sequence '{}' trimmed to prediction range [{}, {}]", id, range.getStart(), range.getEnd());
    });
    return result;
  }

  static void checkSequences(Map<String, String> sequences) {
    ErrorAccumulator errors = new ErrorAccumulator();
    sequences.forEach((id, sequence) -> {
      if (sequence.isEmpty()) {
        errors.add(ErrorKind.PREDICTION_REQUEST_FAILED, "sequence '" + id + "' is empty");
      }
      Set<Character> invalid = new TreeSet<>();
      for (char base : sequence.toUpperCase(Locale.ROOT).toCharArray()) {
        if (VALID_BASES.indexOf(base) < 0) {
          invalid.add(base);
        }
      }
      if (!invalid.isEmpty()) {
        errors.add(ErrorKind.PREDICTION_REQUEST_FAILED,
            "sequence '" + id + "' has invalid character(s): " + invalid);
      }
    });
    errors.raiseIfAny();
  }
}
