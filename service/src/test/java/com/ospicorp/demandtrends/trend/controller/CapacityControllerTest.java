package com.ospicorp.demandtrends.trend.controller;

import static com.ospicorp.demandtrends.support.SampleSeries.hourly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.ospicorp.demandtrends.trend.model.TimeWindow;
import com.ospicorp.demandtrends.trend.repository.TimeSeriesRepository;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CapacityControllerTest {

  @Autowired
  private TestRestTemplate rest;

  @MockBean
  private TimeSeriesRepository repository;

  @Test
  void planReturnsOneRecommendationPerHour() {
    when(repository.fetchHistory(eq("queue"), eq("cap-1"), eq("ticket_arrivals"),
        any(TimeWindow.class)))
        .thenReturn(hourly(Instant.parse("2024-03-01T00:00:00Z"), 336, i -> 60d));

    ResponseEntity<List<Map<String, Object>>> response = rest.exchange(
        "/v1/capacity/queue/plan?entity_id=cap-1&horizon_days=1&target_service_level=0.8",
        HttpMethod.GET, null, new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    List<Map<String, Object>> body = response.getBody();
    assertThat(body).hasSize(24);
    assertThat(body).allSatisfy(recommendation -> assertThat(recommendation)
        .containsEntry("recommended_agents", 18)
        .containsEntry("capped", false)
        .containsKeys("offered_load", "predicted_service_level", "cost_delta", "reason"));
  }

  @Test
  void targetAboveOneIsRejected() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/capacity/queue/plan?target_service_level=1.5", HttpMethod.GET, null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 2005);
  }

  @Test
  void zeroHorizonIsRejected() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/capacity/queue/plan?horizon_days=0", HttpMethod.GET, null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 2004);
  }

  @Test
  void horizonBeyondLimitIsBadRequest() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/capacity/queue/plan?horizon_days=90", HttpMethod.GET, null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsKey("detail");
  }

  @Test
  void nonNumericHorizonIsBadRequest() {
    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/v1/capacity/queue/plan?horizon_days=week", HttpMethod.GET, null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }
}
