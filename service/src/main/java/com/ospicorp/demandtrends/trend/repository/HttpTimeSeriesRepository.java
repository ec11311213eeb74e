package com.ospicorp.demandtrends.trend.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.Sample;
import com.ospicorp.demandtrends.trend.model.TimeWindow;
import com.ospicorp.demandtrends.trend.service.ExternalFetchException;
import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Reads history from the metrics store over HTTP. The store answers
 * {@code {"points": [["2024-01-01T00:00:00Z", 12.0], ...]}}; null values are dropped and
 * duplicate timestamps keep the last value.
 */
@Repository
public class HttpTimeSeriesRepository implements TimeSeriesRepository {

  private static final Logger log = LoggerFactory.getLogger(HttpTimeSeriesRepository.class);

  private final RestTemplate restTemplate;
  private final String baseUrl;

  public HttpTimeSeriesRepository(@Qualifier("historyRestTemplate") RestTemplate restTemplate,
      TrendAnalysisProperties properties) {
    this.restTemplate = restTemplate;
    String url = properties.getHistory().getBaseUrl();
    this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  @Override
  public List<Sample> fetchHistory(String entityType, String entityId, String metricName,
      TimeWindow window) {
    UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl)
        .path("/v1/history/{entityType}/{metric}")
        .queryParam("start", window.start().toString())
        .queryParam("end", window.end().toString());
    if (StringUtils.hasText(entityId)) {
      builder.queryParam("entity_id", entityId);
    }
    URI uri = builder.buildAndExpand(Map.of("entityType", entityType, "metric", metricName))
        .encode()
        .toUri();

    JsonNode body;
    try {
      body = restTemplate.getForObject(uri, JsonNode.class);
    } catch (RestClientException ex) {
      throw new ExternalFetchException("History fetch failed for " + entityType + "/"
          + metricName + ": " + ex.getMessage(), ex);
    }
    List<Sample> samples = parsePoints(body);
    log.debug("Fetched {} samples of {} for {} in [{}, {})", samples.size(), metricName,
        entityId == null ? entityType : entityType + "/" + entityId, window.start(), window.end());
    return samples;
  }

  private List<Sample> parsePoints(JsonNode body) {
    if (body == null) {
      return List.of();
    }
    JsonNode points = body.path("points");
    if (!points.isArray()) {
      return List.of();
    }
    TreeMap<Instant, Double> ordered = new TreeMap<>();
    for (JsonNode point : points) {
      if (!point.isArray() || point.size() < 2) {
        continue;
      }
      JsonNode value = point.get(1);
      if (value == null || !value.isNumber() || !Double.isFinite(value.asDouble())) {
        continue;
      }
      try {
        ordered.put(Instant.parse(point.get(0).asText()), value.asDouble());
      } catch (DateTimeParseException ex) {
        throw new ExternalFetchException("History store returned a malformed timestamp: "
            + point.get(0).asText(), ex);
      }
    }
    List<Sample> samples = new ArrayList<>(ordered.size());
    ordered.forEach((timestamp, value) -> samples.add(new Sample(timestamp, value)));
    return samples;
  }
}
