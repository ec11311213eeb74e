package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.ComparisonType;
import com.ospicorp.demandtrends.trend.model.enums.DifferenceType;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import com.ospicorp.demandtrends.trend.model.enums.TrendDirection;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ComparisonResult(
    @JsonProperty("comparison_id") String comparisonId,
    @JsonProperty("comparison_type") ComparisonType comparisonType,
    @JsonProperty("entity_type") String entityType,
    Period period,
    List<ComparedEntity> entities,
    List<ComparisonMetric> metrics,
    @JsonProperty("key_differences") List<KeyDifference> keyDifferences,
    @JsonProperty("statistical_tests") List<StatisticalTest> statisticalTests,
    List<TrendInsight> insights,
    List<TrendRecommendation> recommendations,
    List<String> failures,
    @JsonProperty("created_at") Instant createdAt
) {

  public ComparisonResult {
    entities = List.copyOf(entities);
    metrics = List.copyOf(metrics);
    keyDifferences = List.copyOf(keyDifferences);
    statisticalTests = List.copyOf(statisticalTests);
    insights = List.copyOf(insights);
    recommendations = List.copyOf(recommendations);
    failures = List.copyOf(failures);
  }

  public record ComparedEntity(
      @JsonProperty("entity_id") String entityId,
      @JsonProperty("analysis_window") TimeWindow analysisWindow,
      @JsonProperty("baseline_metrics") Map<String, Double> baselineMetrics
  ) {

    public ComparedEntity {
      baselineMetrics = Map.copyOf(baselineMetrics);
    }
  }

  public record ComparisonMetric(
      @JsonProperty("metric_name") String metricName,
      Map<String, Double> values,
      @JsonProperty("percentage_changes") Map<String, Double> percentageChanges,
      @JsonProperty("absolute_changes") Map<String, Double> absoluteChanges,
      @JsonProperty("statistical_significance") Map<String, Double> statisticalSignificance,
      @JsonProperty("trend_directions") Map<String, TrendDirection> trendDirections
  ) {

    public ComparisonMetric {
      values = Map.copyOf(values);
      percentageChanges = Map.copyOf(percentageChanges);
      absoluteChanges = Map.copyOf(absoluteChanges);
      statisticalSignificance = Map.copyOf(statisticalSignificance);
      trendDirections = Map.copyOf(trendDirections);
    }
  }

  public record KeyDifference(
      @JsonProperty("metric_name") String metricName,
      DifferenceType type,
      double magnitude,
      @JsonProperty("entities_affected") List<String> entitiesAffected,
      double confidence
  ) {

    public KeyDifference {
      entitiesAffected = List.copyOf(entitiesAffected);
    }
  }

  public record StatisticalTest(
      @JsonProperty("metric_name") String metricName,
      @JsonProperty("entity_id") String entityId,
      @JsonProperty("test_name") String testName,
      @JsonProperty("test_statistic") double testStatistic,
      @JsonProperty("p_value") double pValue,
      @JsonProperty("effect_size") double effectSize,
      String conclusion
  ) {}
}
