package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.trend.model.CompareRequest;
import com.ospicorp.demandtrends.trend.model.ComparisonResult;
import com.ospicorp.demandtrends.trend.model.ComparisonResult.ComparedEntity;
import com.ospicorp.demandtrends.trend.model.ComparisonResult.ComparisonMetric;
import com.ospicorp.demandtrends.trend.model.ComparisonResult.KeyDifference;
import com.ospicorp.demandtrends.trend.model.ComparisonResult.StatisticalTest;
import com.ospicorp.demandtrends.trend.model.SeriesSummary.HalfStats;
import com.ospicorp.demandtrends.trend.model.TrendAnalysisResult;
import com.ospicorp.demandtrends.trend.model.TrendInsight;
import com.ospicorp.demandtrends.trend.model.enums.DifferenceType;
import com.ospicorp.demandtrends.trend.model.enums.TrendDirection;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Compares per-entity analyses. Each window is split into an earlier and a later half; the later
 * half is the entity's current level and the change between halves drives the differences.
 */
@Component
public class EntityComparator {
  static final double CHANGE_THRESHOLD_PCT = 10d;
  static final double SIGNIFICANCE_LEVEL = 0.05;

  private final InsightGenerator insightGenerator;
  private final Clock clock;

  public EntityComparator(InsightGenerator insightGenerator, Clock clock) {
    this.insightGenerator = insightGenerator;
    this.clock = clock;
  }

  /**
   * @param analyses results keyed by entity id then metric name; pairs that failed are absent
   */
  public ComparisonResult compare(CompareRequest request,
      Map<String, Map<String, TrendAnalysisResult>> analyses, List<String> failures) {
    Instant now = clock.instant();

    List<ComparedEntity> entities = new ArrayList<>();
    for (String entityId : request.entityIds()) {
      Map<String, TrendAnalysisResult> byMetric = analyses.getOrDefault(entityId, Map.of());
      if (byMetric.isEmpty()) continue;
      Map<String, Double> baseline = new LinkedHashMap<>();
      byMetric.forEach((metric, result) -> baseline.put(metric, result.summary().mean()));
      TrendAnalysisResult first = byMetric.values().iterator().next();
      entities.add(new ComparedEntity(entityId, first.analysisWindow(), baseline));
    }

    List<ComparisonMetric> metrics = new ArrayList<>();
    List<StatisticalTest> tests = new ArrayList<>();
    List<KeyDifference> differences = new ArrayList<>();
    for (String metric : request.metricNames()) {
      Map<String, Double> values = new LinkedHashMap<>();
      Map<String, Double> percentageChanges = new LinkedHashMap<>();
      Map<String, Double> absoluteChanges = new LinkedHashMap<>();
      Map<String, Double> significance = new LinkedHashMap<>();
      Map<String, TrendDirection> directions = new LinkedHashMap<>();
      Map<String, Double> volatilityRatios = new LinkedHashMap<>();

      for (String entityId : request.entityIds()) {
        TrendAnalysisResult result = analyses.getOrDefault(entityId, Map.of()).get(metric);
        if (result == null) continue;
        HalfStats earlier = result.summary().earlierHalf();
        HalfStats later = result.summary().laterHalf();
        double change = later.mean() - earlier.mean();
        values.put(entityId, later.mean());
        absoluteChanges.put(entityId, change);
        percentageChanges.put(entityId, Math.abs(earlier.mean()) < Statistics.EPSILON
            ? 0d
            : change / Math.abs(earlier.mean()) * 100d);
        significance.put(entityId, result.statisticalSignificance());
        directions.put(entityId, result.trendDirection());
        if (earlier.variance() > Statistics.EPSILON) {
          volatilityRatios.put(entityId, Math.sqrt(later.variance() / earlier.variance()));
        }
        tests.add(welchTest(metric, entityId, earlier, later));
      }
      if (values.isEmpty()) continue;

      metrics.add(new ComparisonMetric(metric, values, percentageChanges, absoluteChanges,
          significance, directions));
      differences.addAll(keyDifferences(metric, percentageChanges, significance, directions,
          volatilityRatios));
    }

    List<TrendInsight> insights = insightGenerator.comparisonInsights(differences, tests);
    return new ComparisonResult("comparison_" + request.entityType() + "_" + now.toEpochMilli(),
        request.comparisonType(), request.entityType(), request.period(), entities, metrics,
        differences, tests, insights,
        insightGenerator.comparisonRecommendations(request.comparisonType(), differences),
        failures, now);
  }

  /** Welch's two-sample t-test with a normal approximation for the p-value. */
  static StatisticalTest welchTest(String metric, String entityId, HalfStats earlier,
      HalfStats later) {
    if (earlier.count() < 2 || later.count() < 2) {
      return new StatisticalTest(metric, entityId, "welch_t_test", 0d, 1d, 0d,
          "Insufficient data for a two-sample test");
    }
    double diff = later.mean() - earlier.mean();
    double standardError = Math.sqrt(earlier.variance() / earlier.count()
        + later.variance() / later.count());
    double t = diff == 0d ? 0d : diff / Math.max(standardError, Statistics.EPSILON);
    double p = Statistics.clampUnit(2d * (1d - Statistics.normalCdf(Math.abs(t))));
    double pooled = Math.sqrt((earlier.variance() + later.variance()) / 2d);
    double effect = pooled < Statistics.EPSILON ? 0d : diff / pooled;
    String conclusion = p < SIGNIFICANCE_LEVEL
        ? "Significant level shift between earlier and later halves"
        : "No significant level shift between earlier and later halves";
    return new StatisticalTest(metric, entityId, "welch_t_test", t, p, effect, conclusion);
  }

  private static List<KeyDifference> keyDifferences(String metric, Map<String, Double> pctChanges,
      Map<String, Double> significance, Map<String, TrendDirection> directions,
      Map<String, Double> volatilityRatios) {
    List<KeyDifference> differences = new ArrayList<>();

    List<String> increased = new ArrayList<>();
    List<String> decreased = new ArrayList<>();
    double maxIncrease = 0d;
    double maxDecrease = 0d;
    for (var entry : pctChanges.entrySet()) {
      double pct = entry.getValue();
      if (pct > CHANGE_THRESHOLD_PCT) {
        increased.add(entry.getKey());
        maxIncrease = Math.max(maxIncrease, pct);
      } else if (pct < -CHANGE_THRESHOLD_PCT) {
        decreased.add(entry.getKey());
        maxDecrease = Math.max(maxDecrease, -pct);
      }
    }
    if (!increased.isEmpty()) {
      differences.add(new KeyDifference(metric, DifferenceType.SIGNIFICANT_INCREASE, maxIncrease,
          increased, confidence(increased, significance)));
    }
    if (!decreased.isEmpty()) {
      differences.add(new KeyDifference(metric, DifferenceType.SIGNIFICANT_DECREASE, maxDecrease,
          decreased, confidence(decreased, significance)));
    }

    int distinctDirections = new HashSet<>(directions.values()).size();
    if (distinctDirections > 1) {
      List<String> all = new ArrayList<>(directions.keySet());
      differences.add(new KeyDifference(metric, DifferenceType.STRUCTURAL_CHANGE,
          (double) distinctDirections / all.size(), all, confidence(all, significance)));
    }

    List<String> volatilityShifted = new ArrayList<>();
    double maxShift = 0d;
    for (var entry : volatilityRatios.entrySet()) {
      double shift = Math.abs(entry.getValue() - 1d) * 100d;
      if (shift > CHANGE_THRESHOLD_PCT) {
        volatilityShifted.add(entry.getKey());
        maxShift = Math.max(maxShift, shift);
      }
    }
    if (!volatilityShifted.isEmpty()) {
      differences.add(new KeyDifference(metric, DifferenceType.VOLATILITY_CHANGE, maxShift,
          volatilityShifted, confidence(volatilityShifted, significance)));
    }
    return differences;
  }

  private static double confidence(List<String> entityIds, Map<String, Double> significance) {
    List<Double> values = entityIds.stream().map(significance::get).toList();
    return Math.min(0.95, Statistics.mean(values));
  }
}
