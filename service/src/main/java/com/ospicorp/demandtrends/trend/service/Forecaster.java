package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.ConfidenceInterval;
import com.ospicorp.demandtrends.trend.model.ExternalFactor;
import com.ospicorp.demandtrends.trend.model.ForecastPoint;
import com.ospicorp.demandtrends.trend.model.SeasonalPattern;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.springframework.stereotype.Service;

/**
 * Projects the last observed value along the fitted growth rate, modulated by the detected cycles
 * and the configured external factors.
 */
@Service
public class Forecaster {
  private static final Map<Double, Double> Z_SCORES = Map.of(
      0.8, 1.28,
      0.9, 1.64,
      0.95, 1.96,
      0.99, 2.58);

  private final TrendAnalysisProperties.Forecast settings;
  private final ExternalFactorEvaluator evaluator;
  private final ZoneId zone;

  public Forecaster(TrendAnalysisProperties properties, ExternalFactorEvaluator evaluator) {
    this.settings = properties.getForecast();
    this.evaluator = evaluator;
    this.zone = properties.getZone();
    settings.getIntervalLevels().forEach(Forecaster::zScore);
  }

  public List<ForecastPoint> forecast(TrendDecomposition decomposition,
      List<SeasonalPattern> patterns, Period period, int horizon, Instant lastTimestamp) {
    if (horizon < 1) {
      throw new IllegalArgumentException("horizon must be positive");
    }
    double volatility = decomposition.volatility();
    List<ForecastPoint> points = new ArrayList<>(horizon);
    for (int k = 1; k <= horizon; k++) {
      Instant timestamp = lastTimestamp.plus(period.length().multipliedBy(k));
      double trend = decomposition.lastValue() + decomposition.growthRatePerPeriod() * k;
      double seasonal = seasonalAdjustment(patterns, timestamp);
      Map<String, Double> impacts = externalImpacts(timestamp);
      double external = impacts.values().stream().mapToDouble(Double::doubleValue).sum();

      double estimate = trend * (1d + seasonal) * Math.max(0d, 1d + external);
      if (settings.isClampNonNegative()) {
        estimate = Math.max(0d, estimate);
      }
      double confidence = Math.max(settings.getMinConfidence(), settings.getBaseConfidence()
          - settings.getConfidenceDecay() * k - settings.getVolatilityPenaltyWeight() * volatility);
      double margin = Math.abs(estimate)
          * (settings.getBaseMarginRatio() + settings.getMarginVolatilityWeight() * volatility)
          * Math.sqrt(k);
      double lower = settings.isClampNonNegative()
          ? Math.max(0d, estimate - margin)
          : estimate - margin;

      double upper = estimate + margin;

      Map<String, Double> factors = new LinkedHashMap<>();
      factors.put("trend", trend);
      factors.put("seasonality", seasonal);
      factors.put("base_level", decomposition.lastValue());
      impacts.forEach(factors::putIfAbsent);

      points.add(new ForecastPoint(timestamp, k, estimate, lower, upper, confidence, trend,
          seasonal, external, intervals(estimate, lower, upper), factors));
    }
    return points;
  }

  /** Sum of cosine waves peaking at each cyclic pattern's phase, scaled by its strength. */
  double seasonalAdjustment(List<SeasonalPattern> patterns, Instant timestamp) {
    double adjustment = 0d;
    for (SeasonalPattern pattern : patterns) {
      if (!pattern.periodicity().isCyclic()) continue;
      int bucket = pattern.periodicity().bucketOf(timestamp, zone);
      double angle = 2d * Math.PI * (bucket - pattern.phase()) / pattern.periodLength();
      adjustment += pattern.strength() * Math.cos(angle);
    }
    return adjustment;
  }

  /** Impact of each configured factor at {@code timestamp}, keyed by factor name. */
  Map<String, Double> externalImpacts(Instant timestamp) {
    Map<String, Double> impacts = new LinkedHashMap<>();
    for (ExternalFactor factor : settings.getExternalFactors()) {
      impacts.merge(factor.name(), Statistics.finiteOr(evaluator.impact(factor, timestamp), 0d),
          Double::sum);
    }
    return impacts;
  }

  /**
   * Intervals at each configured confidence level around {@code estimate}, using half the width
   * of the forecast band as the standard error.
   */
  List<ConfidenceInterval> intervals(double estimate, double lower, double upper) {
    double standardError = (upper - lower) / 2d;
    List<ConfidenceInterval> intervals = new ArrayList<>(settings.getIntervalLevels().size());
    for (double level : settings.getIntervalLevels()) {
      double half = zScore(level) * standardError;
      double low = estimate - half;
      intervals.add(new ConfidenceInterval(level,
          settings.isClampNonNegative() ? Math.max(0d, low) : low, estimate + half));
    }
    return intervals;
  }

  static double zScore(double level) {
    Double z = Z_SCORES.get(level);
    if (z == null) {
      throw new IllegalArgumentException("Unsupported confidence level " + level
          + "; supported levels are " + new TreeSet<>(Z_SCORES.keySet()));
    }
    return z;
  }
}
