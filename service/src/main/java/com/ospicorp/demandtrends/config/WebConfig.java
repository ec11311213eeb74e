package com.ospicorp.demandtrends.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.cfg.EnumFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class WebConfig {

  @Bean
  RestTemplate historyRestTemplate(RestTemplateBuilder builder,
      TrendAnalysisProperties properties) {
    return builder
        .setConnectTimeout(properties.getHistory().getConnectTimeout())
        .setReadTimeout(properties.getHistory().getReadTimeout())
        .build();
  }

  // Enum values travel as lowercase codes ("daily", "trending_up_with_seasonality").
  @Bean
  Jackson2ObjectMapperBuilderCustomizer lowercaseEnums() {
    return builder -> builder
        .featuresToEnable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .postConfigurer(mapper -> mapper.configure(EnumFeature.WRITE_ENUMS_TO_LOWERCASE, true));
  }
}
