package com.example.predictor.cpg.codec;

import com.example.predictor.cpg.config.PredictorProperties;
import com.example.predictor.cpg.error.BadPredictionRequestException;
import com.example.predictor.cpg.error.ErrorPayloads;
import com.example.predictor.cpg.error.PredictorException;
import com.example.predictor.cpg.error.ServerErrorException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Decodes request bodies and encodes responses in the negotiated wire format.
 *
 * <p>Request format comes from {@code Content-Type} (JSON when absent). Response format comes from
 * {@code Accept} intersected with the configured response formats, except that error responses
 * are always JSON. Every encoded body carries a {@code predictor_name} field.
 */
@Slf4j
@Component
public class PayloadCodec {

  public static final String PREDICTOR_NAME_FIELD = "predictor_name";

  private final ObjectMapper jsonMapper;
  private final ObjectMapper msgpackMapper;
  private final PredictorProperties properties;

  public PayloadCodec(ObjectMapper jsonMapper, PredictorProperties properties) {
    this.jsonMapper = jsonMapper;
    this.msgpackMapper = new ObjectMapper(new MessagePackFactory());
    this.properties = properties;
  }

  /**
   * Parses {@code body} according to the declared content type.
   *
   * @throws BadPredictionRequestException when the content type is unsupported, the bytes cannot
   *     be parsed, or the top-level value is not an object
   */
  public ObjectNode decode(byte[] body, String contentTypeHeader) {
    WireFormat format = resolveRequestFormat(contentTypeHeader);
    log.info("Decoding request body as {}", format);

    String label = format == WireFormat.MSGPACK ? "Could not decode MsgPack payload: "
        : "Could not parse JSON payload: ";
    if (body == null || body.length == 0) {
      throw new BadPredictionRequestException(label + "request body is empty");
    }

    JsonNode tree;
    try {
      tree = mapperFor(format).readTree(body);
    } catch (IOException | RuntimeException ex) {
      throw new BadPredictionRequestException(label + ex.getMessage(), ex);
    }
    if (tree == null || !tree.isObject()) {
      String kind = tree == null ? "nothing" : tree.getNodeType().name().toLowerCase(Locale.ROOT);
      throw new BadPredictionRequestException(label + "expected an object at the top level but got " + kind);
    }
    return (ObjectNode) tree;
  }

  /** Resolves the request format, defaulting to JSON when no header is sent. */
  public WireFormat resolveRequestFormat(String contentTypeHeader) {
    if (contentTypeHeader == null || contentTypeHeader.isBlank()) {
      log.info("Missing Content-Type header, decoding with JSON default");
      return WireFormat.JSON;
    }
    String declared = contentTypeHeader.trim().toLowerCase(Locale.ROOT);
    String mimeType = stripParameters(declared);
    List<String> supported = properties.getSupportedRequestFormats();
    if (!supported.contains(mimeType)) {
      throw new BadPredictionRequestException(
          "Unsupported Content-Type: " + declared + ". Must be one of " + supported);
    }
    return WireFormat.fromMimeType(mimeType)
        .orElseThrow(() -> new BadPredictionRequestException(
            "Unsupported Content-Type: " + declared + ". Must be one of " + supported));
  }

  /** Picks the response format: msgpack only for successes the client and server both allow. */
  public WireFormat negotiateResponseFormat(boolean error, String acceptHeader) {
    if (error) {
      return WireFormat.JSON;
    }
    if (!properties.getSupportedResponseFormats().contains(WireFormat.MSGPACK.getMimeType())) {
      return WireFormat.JSON;
    }
    return acceptsMsgpack(acceptHeader) ? WireFormat.MSGPACK : WireFormat.JSON;
  }

  /**
   * Serializes {@code payload} with the negotiated format.
   *
   * @throws ServerErrorException when serialization fails
   */
  public ResponseEntity<byte[]> encode(Object payload, HttpStatus status, boolean error, String acceptHeader) {
    WireFormat format = negotiateResponseFormat(error, acceptHeader);
    ObjectNode tree = withPredictorName(payload);
    byte[] bytes;
    try {
      bytes = mapperFor(format).writeValueAsBytes(tree);
    } catch (JsonProcessingException ex) {
      log.error("Failed to encode response as {}", format, ex);
      String message = format == WireFormat.MSGPACK
          ? "Failed to serialize successful response as MsgPack."
          : "Internal Server Error: Failed to serialize response as JSON: " + ex.getOriginalMessage();
      throw new ServerErrorException(message, ex);
    }
    return ResponseEntity.status(status)
        .contentType(format.toMediaType())
        .body(bytes);
  }

  /** Encodes an error body as JSON with the status of its error kind. */
  public ResponseEntity<byte[]> encodeError(PredictorException ex) {
    return encode(ErrorPayloads.toPayload(ex), ex.getStatus(), true, null);
  }

  private ObjectNode withPredictorName(Object payload) {
    JsonNode tree;
    try {
      tree = jsonMapper.valueToTree(payload);
    } catch (RuntimeException ex) {
      throw new ServerErrorException(
          "Internal Server Error: Failed to serialize response as JSON: " + ex.getMessage(), ex);
    }
    if (tree == null || !tree.isObject()) {
      throw new ServerErrorException("Internal Server Error: response payload must be an object");
    }
    ObjectNode node = (ObjectNode) tree;
    if (node.has(PREDICTOR_NAME_FIELD)) {
      return node;
    }
    ObjectNode named = jsonMapper.createObjectNode();
    named.put(PREDICTOR_NAME_FIELD, properties.getName());
    named.setAll(node);
    return named;
  }

  private ObjectMapper mapperFor(WireFormat format) {
    return format == WireFormat.MSGPACK ? msgpackMapper : jsonMapper;
  }

  private static boolean acceptsMsgpack(String acceptHeader) {
    if (acceptHeader == null || acceptHeader.isBlank()) {
      return false;
    }
    try {
      return MediaType.parseMediaTypes(acceptHeader.toLowerCase(Locale.ROOT)).stream()
          .anyMatch(WireFormat.MSGPACK.toMediaType()::equalsTypeAndSubtype);
    } catch (InvalidMediaTypeException ex) {
      log.warn("Ignoring malformed Accept header '{}': {}", acceptHeader, ex.getMessage());
      return false;
    }
  }

  private static String stripParameters(String contentType) {
    int semicolon = contentType.indexOf(';');
    return (semicolon < 0 ? contentType : contentType.substring(0, semicolon)).trim();
  }
}
