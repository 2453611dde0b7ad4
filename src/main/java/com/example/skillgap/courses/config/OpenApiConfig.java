package com.example.skillgap.courses.config;

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
        title = "Course Match API",
        version = "v1",
        description = "Course cache administration and health endpoints."
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
            .title("Course Match API")
            .version("v1")
            .description("Swagger UI for the course availability cache.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi courseCacheApi() {
    return GroupedOpenApi.builder()
        .group("course-cache")
        .packagesToScan("com.example.skillgap.courses.controller")
        .pathsToMatch("/api/v1/**")
        .build();
  }

  @Bean
  public GroupedOpenApi healthApi() {
    return GroupedOpenApi.builder()
        .group("health")
        .pathsToMatch("/health")
        .build();
  }
}
