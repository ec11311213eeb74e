package com.ospicorp.demandtrends.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ProblemDetailsHandlerTest {

  @Autowired
  private TestRestTemplate rest;

  @Test
  void invalidDepthReturnsProblemDetail() {
    ResponseEntity<Map> response = rest.getForEntity("/v1/trends/queue/ticket_arrivals?depth=deep",
        Map.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType()).isNotNull();
    assertThat(response.getHeaders().getContentType().toString()).contains("application/problem+json");
    Map<String, Object> body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body).containsKeys("type", "title", "status", "detail", "instance");
    assertThat(body.get("errorCode")).isEqualTo(2002);
  }

  @Test
  void invalidPathVariableReturnsProblemDetail() {
    ResponseEntity<Map> response = rest.getForEntity("/v1/trends/que*ue/ticket_arrivals",
        Map.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("type",
        "https://docs.demand-trends.dev/problems/invalid-parameter");
  }

  @Test
  void unknownRouteReturnsNotFoundProblem() {
    ResponseEntity<Map> response = rest.getForEntity("/v1/nothing-here", Map.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody()).containsEntry("instance", "/v1/nothing-here");
  }

  @Test
  void requestIdIsEchoed() {
    ResponseEntity<Map> response = rest.getForEntity("/v1/ping", Map.class);
    assertThat(response.getHeaders().getFirst(RequestLoggingFilter.REQUEST_ID_HEADER))
        .isNotBlank();
  }
}
