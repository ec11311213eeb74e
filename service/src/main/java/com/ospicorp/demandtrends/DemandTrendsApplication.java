package com.ospicorp.demandtrends;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(TrendAnalysisProperties.class)
public class DemandTrendsApplication {

  public static void main(String[] args) {
    SpringApplication.run(DemandTrendsApplication.class, args);
  }
}
