package com.ospicorp.demandtrends.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo(@Value("${trends.openapi.server-url:/}") String serverUrl) {
    return new OpenAPI()
        .info(new Info()
            .title("Demand Trends API")
            .version("v1")
            .description("Trend decomposition, seasonality, change points, demand forecasts "
                + "and Erlang-C capacity plans for service desk metrics")
            .contact(new Contact().name("Workforce Analytics Team").email("analytics@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url(serverUrl)))
        .externalDocs(new ExternalDocumentation()
            .description("Error reference")
            .url("https://docs.demand-trends.dev/problems"));
  }
}
