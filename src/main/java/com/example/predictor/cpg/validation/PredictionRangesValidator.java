package com.example.predictor.cpg.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.StreamSupport;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Checks {@code prediction_ranges} against the pre-trim sequences: matching ids, and for each
 * non-empty range two non-negative integers {@code start <= end} inside the sequence.
 */
@Component
@Order(30)
public class PredictionRangesValidator implements PayloadValidator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.FIELD_VALUES;
  }

  @Override
  public void validate(ValidationContext context) {
    if (!context.has(PayloadKeys.PREDICTION_RANGES)) {
      return;
    }
    ObjectNode ranges = (ObjectNode) context.field(PayloadKeys.PREDICTION_RANGES);
    ObjectNode sequences = (ObjectNode) context.field(PayloadKeys.SEQUENCES);

    if (!ScalarChecks.fieldNames(ranges).equals(ScalarChecks.fieldNames(sequences))) {
      context.reject("sequence ids in prediction_ranges do not match those in sequences");
    }

    Iterator<Map.Entry<String, JsonNode>> it = ranges.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      JsonNode sequence = sequences.get(entry.getKey());
      int length = sequence == null ? 0 : sequence.textValue().length();
      checkRange(context, entry.getKey(), entry.getValue(), length);
    }
  }

  private void checkRange(ValidationContext context, String key, JsonNode range, int sequenceLength) {
    if (!range.isArray()) {
      context.reject("Values for '" + key + "' in 'prediction_ranges' must be in a list");
      return;
    }
    if (range.isEmpty()) {
      return;
    }
    if (range.size() != 2) {
      context.reject("Range array for '" + key + "' in 'prediction_ranges' must have 2 elements");
      return;
    }
    boolean integers = StreamSupport.stream(range.spliterator(), false)
        .allMatch(JsonNode::isIntegralNumber);
    if (!integers) {
      context.reject("Values in '" + key + "' in 'prediction_ranges' must be integers");
      return;
    }

    long start = asIndex(range.get(0));
    long end = asIndex(range.get(1));
    String received = " Received [" + start + ", " + end + "]";
    if (start < 0 || end < 0) {
      context.reject("Invalid range for '" + key + "' in 'prediction_ranges': "
          + "indices must be positive." + received);
    }
    if (start > end) {
      context.reject("Invalid range for '" + key + "' in 'prediction_ranges': start index ("
          + start + ") cannot be greater than end index (" + end + ")." + received);
    }
    if (start >= sequenceLength || end >= sequenceLength) {
      if (sequenceLength == 0) {
        context.reject("Invalid range for '" + key
            + "': cannot specify a range for a non-existent or empty sequence.");
      } else {
        context.reject("Invalid range for '" + key + "': index is out of bounds. "
            + "The maximum valid index for a sequence of length " + sequenceLength
            + " is " + (sequenceLength - 1) + ".");
      }
    }
  }

  // Integers beyond long are clamped so they still fail the bounds check.
  private static long asIndex(JsonNode node) {
    if (node.canConvertToLong()) {
      return node.longValue();
    }
    return node.bigIntegerValue().signum() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
  }
}
