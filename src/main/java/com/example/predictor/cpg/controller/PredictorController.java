package com.example.predictor.cpg.controller;

import com.example.predictor.cpg.codec.PayloadCodec;
import com.example.predictor.cpg.config.PredictorProperties;
import com.example.predictor.cpg.error.BadPredictionRequestException;
import com.example.predictor.cpg.error.PredictorException;
import com.example.predictor.cpg.error.ServerErrorException;
import com.example.predictor.cpg.response.FormatsResponse;
import com.example.predictor.cpg.service.HelpMetadataService;
import com.example.predictor.cpg.service.PredictionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@Tag(name = "CpG Predictor", description = "CpG density predictions, supported formats and help")
@RequiredArgsConstructor
public class PredictorController {

    private static final byte[] EMPTY_BODY = new byte[0];

    private final PredictionService predictionService;
    private final HelpMetadataService helpMetadataService;
    private final PayloadCodec codec;
    private final PredictorProperties properties;

    @PostMapping("/predict")
    @Operation(
            summary = "Predict CpG density",
            description = "Validates and preprocesses the sequences, then returns one prediction block per task. "
                    + "Accepts JSON or MessagePack; errors are always JSON."
    )
    public Mono<ResponseEntity<byte[]>> predict(
            @RequestBody(required = false) Mono<byte[]> body,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
        // Body read failures share the error translation below.
        return body
                .onErrorMap(PredictorController::exceedsBufferLimit, ex -> new BadPredictionRequestException(
                        "Request body exceeds the configured size limit: " + ex.getMessage(), ex))
                .defaultIfEmpty(EMPTY_BODY)
                .flatMap(bytes -> predictionService.run(bytes, contentType))
                .map(response -> codec.encode(response, HttpStatus.OK, false, accept))
                .onErrorResume(ex -> Mono.just(toErrorResponse(ex, "predict")))
                .doFinally(signal -> log.info("Request complete, {} is ready for the next request", properties.getName()));
    }

    @GetMapping("/formats")
    @Operation(summary = "List the request and response formats this predictor supports")
    public Mono<ResponseEntity<byte[]>> formats(
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
        FormatsResponse formats = FormatsResponse.builder()
                .supportedRequestFormats(List.copyOf(properties.getSupportedRequestFormats()))
                .supportedResponseFormats(List.copyOf(properties.getSupportedResponseFormats()))
                .build();
        return Mono.fromCallable(() -> codec.encode(formats, HttpStatus.OK, false, accept))
                .onErrorResume(ex -> Mono.just(toErrorResponse(ex, "formats")));
    }

    @GetMapping("/help")
    @Operation(summary = "Return the predictor's help and model metadata document")
    public Mono<ResponseEntity<byte[]>> help(
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
        return helpMetadataService.load()
                .map(help -> codec.encode(help, HttpStatus.OK, false, accept))
                .onErrorResume(ex -> Mono.just(toErrorResponse(ex, "help")));
    }

    private static boolean exceedsBufferLimit(Throwable ex) {
        return ex instanceof DataBufferLimitException || ex.getCause() instanceof DataBufferLimitException;
    }

    // Single translation point from the error taxonomy to a status and a JSON error body.
    private ResponseEntity<byte[]> toErrorResponse(Throwable ex, String endpoint) {
        PredictorException error;
        if (ex instanceof PredictorException known) {
            log.warn("{} request failed with {}: {}", endpoint, known.getErrorKey(), known.getReasons());
            error = known;
        } else {
            log.error("Unexpected failure while handling {} request", endpoint, ex);
            error = new ServerErrorException("An unexpected internal error occurred: " + ex.getMessage() + ".", ex);
        }
        return codec.encodeError(error);
    }
}
