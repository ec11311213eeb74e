package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.ChangePoint;
import com.ospicorp.demandtrends.trend.model.Sample;
import com.ospicorp.demandtrends.trend.model.enums.ChangeDirection;
import com.ospicorp.demandtrends.trend.model.enums.Significance;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Sliding-window level-shift detector: compares the mean of the {@code w} samples before an index
 * with the mean of the {@code w} samples from it onwards.
 */
@Service
public class ChangePointDetector {

  private final TrendAnalysisProperties.ChangePoints settings;
  private final ProbableCauseLookup causeLookup;

  public ChangePointDetector(TrendAnalysisProperties properties, ProbableCauseLookup causeLookup) {
    this.settings = properties.getChangePoints();
    this.causeLookup = causeLookup;
  }

  public List<ChangePoint> detect(List<Sample> samples) {
    int n = samples.size();
    List<ChangePoint> changePoints = new ArrayList<>();
    if (n < 2) return changePoints;

    double[] values = samples.stream().mapToDouble(Sample::value).toArray();
    int w = windowSize(n);

    Candidate best = null;
    for (int i = w; i < n - w; i++) {
      double before = Statistics.mean(values, i - w, i);
      double after = Statistics.mean(values, i, i + w);
      double delta = after - before;
      double threshold = settings.getThresholdMultiplier() * Statistics.stdDev(values, i - w, i + w);
      if (threshold <= Statistics.EPSILON || Math.abs(delta) <= threshold) {
        continue;
      }
      Candidate candidate = new Candidate(i, delta, threshold);
      if (best != null && i - best.lastIndex < w) {
        // same shift seen from a neighbouring index
        best = candidate.magnitude() > best.magnitude()
            ? candidate.extending(best)
            : best.extendedTo(i);
        continue;
      }
      if (best != null) {
        changePoints.add(toChangePoint(samples, best));
      }
      best = candidate;
    }
    if (best != null) {
      changePoints.add(toChangePoint(samples, best));
    }
    return changePoints;
  }

  int windowSize(int n) {
    return Math.max(1, Math.min(settings.getMaxWindow(), n / 5));
  }

  private ChangePoint toChangePoint(List<Sample> samples, Candidate candidate) {
    double magnitude = candidate.magnitude();
    ChangeDirection direction = candidate.delta > 0 ? ChangeDirection.INCREASE
        : ChangeDirection.DECREASE;
    Significance significance = magnitude > settings.getHighSignificanceMagnitude()
        ? Significance.HIGH
        : Significance.MEDIUM;
    boolean requiresAction = significance == Significance.HIGH
        || magnitude > settings.getActionMultiplier() * candidate.threshold;
    var timestamp = samples.get(candidate.index).timestamp();
    return new ChangePoint(timestamp, magnitude, direction,
        Math.min(magnitude / candidate.threshold, 1d), significance, requiresAction,
        causeLookup.causesFor(timestamp, direction));
  }

  private record Candidate(int index, double delta, double threshold, int lastIndex) {

    Candidate(int index, double delta, double threshold) {
      this(index, delta, threshold, index);
    }

    double magnitude() {
      return Math.abs(delta);
    }

    Candidate extending(Candidate previous) {
      return new Candidate(index, delta, threshold, Math.max(index, previous.lastIndex));
    }

    Candidate extendedTo(int i) {
      return new Candidate(index, delta, threshold, i);
    }
  }
}
