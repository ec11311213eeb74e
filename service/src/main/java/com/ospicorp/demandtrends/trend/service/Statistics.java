package com.ospicorp.demandtrends.trend.service;

import java.util.Arrays;
import java.util.Collection;

/** Numeric helpers shared by the trend stages. Empty input yields 0 rather than NaN. */
public final class Statistics {
  static final double EPSILON = 1e-10;
  static final double MAD_TO_SIGMA = 1.4826;

  private Statistics() {
  }

  public static double mean(double[] values) {
    return mean(values, 0, values.length);
  }

  public static double mean(double[] values, int from, int to) {
    if (to <= from) return 0d;
    double sum = 0d;
    for (int i = from; i < to; i++) {
      sum += values[i];
    }
    return sum / (to - from);
  }

  public static double mean(Collection<Double> values) {
    if (values.isEmpty()) return 0d;
    double sum = 0d;
    for (double v : values) {
      sum += v;
    }
    return sum / values.size();
  }

  public static double stdDev(double[] values) {
    return stdDev(values, 0, values.length);
  }

  /** Population standard deviation of {@code values[from, to)}. */
  public static double stdDev(double[] values, int from, int to) {
    if (to - from < 2) return 0d;
    double mean = mean(values, from, to);
    double sumSq = 0d;
    for (int i = from; i < to; i++) {
      double d = values[i] - mean;
      sumSq += d * d;
    }
    return Math.sqrt(sumSq / (to - from));
  }

  /** Unbiased (n - 1) variance; 0 below two values. */
  public static double sampleVariance(double[] values, int from, int to) {
    int n = to - from;
    if (n < 2) return 0d;
    double mean = mean(values, from, to);
    double sumSq = 0d;
    for (int i = from; i < to; i++) {
      double d = values[i] - mean;
      sumSq += d * d;
    }
    return sumSq / (n - 1);
  }

  public static double median(double[] values, int from, int to) {
    int n = to - from;
    if (n <= 0) return 0d;
    double[] sorted = Arrays.copyOfRange(values, from, to);
    Arrays.sort(sorted);
    int mid = n / 2;
    return n % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2d;
  }

  /** Median absolute deviation around the median of {@code values[from, to)}. */
  public static double mad(double[] values, int from, int to) {
    int n = to - from;
    if (n <= 0) return 0d;
    double median = median(values, from, to);
    double[] deviations = new double[n];
    for (int i = 0; i < n; i++) {
      deviations[i] = Math.abs(values[from + i] - median);
    }
    return median(deviations, 0, n);
  }

  public static double coefficientOfVariation(double[] values) {
    double mean = mean(values);
    if (Math.abs(mean) < EPSILON) return 0d;
    return stdDev(values) / Math.abs(mean);
  }

  // Abramowitz-Stegun 26.2.17, absolute error below 7.5e-8.
  public static double normalCdf(double z) {
    if (Double.isNaN(z)) return 0.5;
    double t = 1d / (1d + 0.2316419 * Math.abs(z));
    double poly = t * (0.319381530 + t * (-0.356563782 + t * (1.781477937
        + t * (-1.821255978 + t * 1.330274429))));
    double tail = Math.exp(-z * z / 2d) / Math.sqrt(2d * Math.PI) * poly;
    return z >= 0 ? 1d - tail : tail;
  }

  public static double clampUnit(double value) {
    if (Double.isNaN(value)) return 0d;
    return Math.max(0d, Math.min(1d, value));
  }

  public static double finiteOr(double value, double fallback) {
    return Double.isFinite(value) ? value : fallback;
  }
}
