package com.example.predictor.cpg.service;

import com.example.predictor.cpg.config.PredictorProperties;
import com.example.predictor.cpg.error.ServerErrorException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Serves the static help/metadata document describing this predictor. */
@Slf4j
@Service
@RequiredArgsConstructor
public class HelpMetadataService {

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;
  private final PredictorProperties properties;

  /** Reads the help file on each call so edits are picked up without a restart. */
  public Mono<JsonNode> load() {
    return Mono.fromCallable(this::read).subscribeOn(Schedulers.boundedElastic());
  }

  JsonNode read() {
    Resource resource = resourceLoader.getResource(properties.getHelpFile());
    try (InputStream in = resource.getInputStream()) {
      return objectMapper.readTree(in);
    } catch (IOException ex) {
      log.error("Could not read help file {}", properties.getHelpFile(), ex);
      throw new ServerErrorException("Error reading help file: " + ex.getMessage(), ex);
    }
  }
}
