package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.OutlierPoint;
import com.ospicorp.demandtrends.trend.model.Sample;
import com.ospicorp.demandtrends.trend.model.enums.ComponentKind;
import com.ospicorp.demandtrends.trend.model.enums.InvestigationPriority;
import com.ospicorp.demandtrends.trend.model.enums.OutlierKind;
import com.ospicorp.demandtrends.trend.model.enums.Periodicity;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Scores each sample against a robust baseline: the decomposition's trend line, plus the median
 * trend residual of the sample's seasonal bucket when the decomposition found a seasonal
 * component, plus the local median of what remains. The score is the distance from that baseline
 * in robust local standard deviations (scaled MAD over a sliding window).
 */
@Service
public class OutlierScanner {

  private final TrendAnalysisProperties.Outliers settings;

  public OutlierScanner(TrendAnalysisProperties properties) {
    this.settings = properties.getOutliers();
  }

  public List<OutlierPoint> scan(List<Sample> samples, TrendDecomposition decomposition) {
    int n = samples.size();
    List<OutlierPoint> outliers = new ArrayList<>();
    if (n == 0) return outliers;

    double[] trend = new double[n];
    double[] residuals = new double[n];
    double absSum = 0d;
    for (int i = 0; i < n; i++) {
      Sample s = samples.get(i);
      trend[i] = decomposition.trendAt(s.timestamp());
      residuals[i] = s.value() - trend[i];
      absSum += Math.abs(s.value());
    }
    double[] seasonal = decomposition.component(ComponentKind.SEASONAL).isPresent()
        ? bucketMedians(samples, residuals, decomposition)
        : new double[n];
    double[] remainder = new double[n];
    for (int i = 0; i < n; i++) {
      remainder[i] = residuals[i] - seasonal[i];
    }

    double floor = Math.max(settings.getMinScale(),
        settings.getRelativeScaleFloor() * absSum / n);
    int half = Math.max(1, settings.getWindowSize() / 2);

    for (int i = 0; i < n; i++) {
      int from = Math.max(0, i - half);
      int to = Math.min(n, i + half + 1);
      double centre = Statistics.median(remainder, from, to);
      double scale = Math.max(Statistics.MAD_TO_SIGMA * Statistics.mad(remainder, from, to), floor);
      double deviation = remainder[i] - centre;
      double score = Math.abs(deviation) / scale;
      if (score < settings.getLowScore()) {
        continue;
      }
      Sample s = samples.get(i);
      double expected = trend[i] + seasonal[i] + centre;
      outliers.add(new OutlierPoint(s.timestamp(), s.value(), expected, score,
          deviation > 0 ? OutlierKind.SPIKE : OutlierKind.DROP, priorityOf(score)));
    }
    return outliers;
  }

  /** Per-sample median of the trend residuals sharing its seasonal bucket. */
  private static double[] bucketMedians(List<Sample> samples, double[] residuals,
      TrendDecomposition decomposition) {
    Periodicity periodicity = decomposition.seasonalPeriodicity();
    ZoneId zone = decomposition.zone();
    int n = samples.size();
    int[] buckets = new int[n];
    Map<Integer, List<Double>> byBucket = new HashMap<>();
    for (int i = 0; i < n; i++) {
      buckets[i] = periodicity.bucketOf(samples.get(i).timestamp(), zone);
      byBucket.computeIfAbsent(buckets[i], b -> new ArrayList<>()).add(residuals[i]);
    }
    Map<Integer, Double> medians = new HashMap<>();
    byBucket.forEach((bucket, values) -> {
      double[] v = values.stream().mapToDouble(Double::doubleValue).toArray();
      medians.put(bucket, Statistics.median(v, 0, v.length));
    });
    double[] seasonal = new double[n];
    for (int i = 0; i < n; i++) {
      seasonal[i] = medians.get(buckets[i]);
    }
    return seasonal;
  }

  InvestigationPriority priorityOf(double score) {
    if (score >= settings.getCriticalScore()) return InvestigationPriority.CRITICAL;
    if (score >= settings.getHighScore()) return InvestigationPriority.HIGH;
    if (score >= settings.getMediumScore()) return InvestigationPriority.MEDIUM;
    return InvestigationPriority.LOW;
  }
}
