package com.example.predictor.cpg.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "CpG Predictor API",
        version = "v1",
        description = "CpG density predictions over DNA sequences with JSON/MessagePack negotiation."
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("CpG Predictor API")
            .version("v1")
            .description("Swagger UI for the predict, formats and help endpoints.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi predictorApi() {
    return GroupedOpenApi.builder()
        .group("predictor")
        .packagesToScan("com.example.predictor.cpg.controller")
        .pathsToMatch("/predict", "/formats", "/help")
        .build();
  }
}
