package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import org.springframework.stereotype.Component;

/** Centred moving average; the window shrinks at both ends of the series. */
@Component
public class MovingAverageCyclicalExtractor implements CyclicalComponentExtractor {
  private static final int MIN_WINDOW = 3;

  private final int configuredWindow;

  public MovingAverageCyclicalExtractor(TrendAnalysisProperties properties) {
    this.configuredWindow = properties.getDecomposition().getCyclicalWindow();
  }

  @Override
  public double[] extract(double[] residuals, Period period) {
    int n = residuals.length;
    double[] smoothed = new double[n];
    if (n < MIN_WINDOW) return smoothed;

    int window = configuredWindow > 0 ? configuredWindow : Math.max(MIN_WINDOW, n / 10);
    int half = window / 2;
    double[] prefix = new double[n + 1];
    for (int i = 0; i < n; i++) {
      prefix[i + 1] = prefix[i] + residuals[i];
    }
    for (int i = 0; i < n; i++) {
      int from = Math.max(0, i - half);
      int to = Math.min(n, i + half + 1);
      smoothed[i] = (prefix[to] - prefix[from]) / (to - from);
    }
    return smoothed;
  }
}
