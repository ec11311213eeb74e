package com.ospicorp.demandtrends.web;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Service banner and liveness ping. */
@RestController
public class RootController {
  private static final List<String> ENDPOINTS = List.of(
      "/v1/trends/{entityType}/{metric}",
      "/v1/trends/bulk",
      "/v1/trends/compare",
      "/v1/capacity/{entityType}/plan");

  private final String serviceName;
  private final Clock clock;

  public RootController(@Value("${spring.application.name:demand-trends}") String serviceName,
      Clock clock) {
    this.serviceName = serviceName;
    this.clock = clock;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", serviceName);
    body.put("status", "ok");
    body.put("endpoints", ENDPOINTS);
    body.put("docs", "/swagger-ui.html");
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true, "time", clock.instant().toString()));
  }
}
