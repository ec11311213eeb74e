package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.trend.model.TrendComponent;
import com.ospicorp.demandtrends.trend.model.enums.ComponentKind;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import com.ospicorp.demandtrends.trend.model.enums.Periodicity;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Fitted model of a series: a least-squares line anchored at the first sample, per-bucket seasonal
 * offsets of the residuals and the ordered components with their explained variance.
 *
 * @param slope value change per millisecond
 * @param originMillis epoch millis of the first sample
 * @param originValue fitted value at {@code originMillis}
 * @param seasonalOffsets residual mean per phase bucket; all zero when no seasonal component was
 *     emitted
 */
public record TrendDecomposition(
    Period period,
    double slope,
    long originMillis,
    double originValue,
    double linearRSquared,
    Periodicity seasonalPeriodicity,
    List<Double> seasonalOffsets,
    ZoneId zone,
    List<TrendComponent> components,
    double mean,
    double lastValue,
    double residualStdDev,
    double volatility,
    int sampleCount
) {

  public TrendDecomposition {
    seasonalOffsets = List.copyOf(seasonalOffsets);
    components = List.copyOf(components);
  }

  /** Intercept of the fitted line at epoch zero. */
  public double intercept() {
    return originValue - slope * originMillis;
  }

  public double growthRatePerPeriod() {
    return slope * period.length().toMillis();
  }

  public double trendAt(Instant timestamp) {
    return originValue + slope * (timestamp.toEpochMilli() - originMillis);
  }

  public double seasonalOffsetAt(Instant timestamp) {
    return seasonalOffsets.get(seasonalPeriodicity.bucketOf(timestamp, zone));
  }

  public double reconstruct(Instant timestamp) {
    return trendAt(timestamp) + seasonalOffsetAt(timestamp);
  }

  public Optional<TrendComponent> component(ComponentKind kind) {
    return components.stream().filter(c -> c.kind() == kind).findFirst();
  }
}
