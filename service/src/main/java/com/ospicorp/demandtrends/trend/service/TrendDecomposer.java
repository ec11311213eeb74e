package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.Sample;
import com.ospicorp.demandtrends.trend.model.TrendComponent;
import com.ospicorp.demandtrends.trend.model.enums.ComponentKind;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import com.ospicorp.demandtrends.trend.model.enums.Periodicity;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Service;

@Service
public class TrendDecomposer {

  private final TrendAnalysisProperties.Decomposition settings;
  private final TrendAnalysisProperties.Analysis analysis;
  private final ZoneId zone;
  private final CyclicalComponentExtractor cyclicalExtractor;

  public TrendDecomposer(TrendAnalysisProperties properties,
      CyclicalComponentExtractor cyclicalExtractor) {
    this.settings = properties.getDecomposition();
    this.analysis = properties.getAnalysis();
    this.zone = properties.getZone();
    this.cyclicalExtractor = cyclicalExtractor;
  }

  public TrendDecomposition decompose(List<Sample> samples, Period period) {
    Sample.requireStrictlyAscending(samples);
    int n = samples.size();
    int required = analysis.minDataPointsFor(period);
    if (n < required) {
      throw new InsufficientDataException(period, n, required);
    }

    long origin = samples.get(0).epochMillis();
    double[] x = new double[n];
    double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = samples.get(i).epochMillis() - origin;
      y[i] = samples.get(i).value();
    }

    double meanX = Statistics.mean(x);
    double meanY = Statistics.mean(y);
    double sxx = 0d;
    double sxy = 0d;
    double tss = 0d;
    for (int i = 0; i < n; i++) {
      double dx = x[i] - meanX;
      double dy = y[i] - meanY;
      sxx += dx * dx;
      sxy += dx * dy;
      tss += dy * dy;
    }
    double slope = sxx == 0d ? 0d : sxy / sxx;
    double originValue = meanY - slope * meanX;

    double[] residuals = new double[n];
    double rss = 0d;
    for (int i = 0; i < n; i++) {
      residuals[i] = y[i] - (originValue + slope * x[i]);
      rss += residuals[i] * residuals[i];
    }
    boolean degenerate = tss <= Statistics.EPSILON;
    double linearR2 = degenerate ? 0d : Statistics.clampUnit(1d - rss / tss);

    List<TrendComponent> components = new ArrayList<>();
    if (linearR2 > settings.getLinearMinRSquared()) {
      double perPeriod = slope * period.length().toMillis();
      components.add(TrendComponent.of(ComponentKind.LINEAR, linearR2,
          String.format(Locale.ROOT, "y = %.6f * t + %.4f", perPeriod, originValue),
          String.format(Locale.ROOT, "Linear trend of %+.4f per %s",
              perPeriod, period.name().toLowerCase(Locale.ROOT))));
    }

    Periodicity periodicity = period.dominantPeriodicity();
    int buckets = periodicity.periodLength();
    double[] bucketMeans = bucketMeans(samples, residuals, periodicity);
    double seasonalShare = degenerate ? 0d : explainedShare(samples, residuals, bucketMeans,
        periodicity, tss);
    List<Double> offsets;
    if (seasonalShare > settings.getSeasonalMinStrength()) {
      components.add(TrendComponent.of(ComponentKind.SEASONAL, seasonalShare, null,
          String.format(Locale.ROOT, "%s seasonal cycle over %d buckets",
              periodicity.name().toLowerCase(Locale.ROOT), buckets)));
      offsets = new ArrayList<>(buckets);
      for (double m : bucketMeans) {
        offsets.add(m);
      }
      for (int i = 0; i < n; i++) {
        residuals[i] -= bucketMeans[periodicity.bucketOf(samples.get(i).timestamp(), zone)];
      }
    } else {
      offsets = Collections.nCopies(buckets, 0d);
    }
    double residualStd = Statistics.stdDev(residuals);

    double[] cycle = cyclicalExtractor.extract(residuals, period);
    double before = 0d;
    double after = 0d;
    for (int i = 0; i < n; i++) {
      before += residuals[i] * residuals[i];
      double remaining = residuals[i] - cycle[i];
      after += remaining * remaining;
    }
    double cyclicalShare = degenerate ? 0d : Statistics.clampUnit((before - after) / tss);
    if (cyclicalShare > settings.getCyclicalMinStrength()) {
      components.add(TrendComponent.of(ComponentKind.CYCLICAL, cyclicalShare, null,
          "Slow cyclical movement in the residuals"));
    }

    double explained = components.stream().mapToDouble(TrendComponent::rSquared).sum();
    double noise = Statistics.clampUnit(1d - explained);
    components.add(TrendComponent.of(ComponentKind.NOISE, noise, null,
        "Unexplained variation"));

    return new TrendDecomposition(period, slope, origin, originValue, linearR2, periodicity,
        offsets, zone, components, meanY, y[n - 1], residualStd,
        Statistics.coefficientOfVariation(y), n);
  }

  private double[] bucketMeans(List<Sample> samples, double[] residuals, Periodicity periodicity) {
    int buckets = periodicity.periodLength();
    double[] sums = new double[buckets];
    int[] counts = new int[buckets];
    for (int i = 0; i < residuals.length; i++) {
      int b = periodicity.bucketOf(samples.get(i).timestamp(), zone);
      sums[b] += residuals[i];
      counts[b]++;
    }
    double[] means = new double[buckets];
    for (int b = 0; b < buckets; b++) {
      means[b] = counts[b] == 0 ? 0d : sums[b] / counts[b];
    }
    return means;
  }

  private double explainedShare(List<Sample> samples, double[] residuals, double[] bucketMeans,
      Periodicity periodicity, double tss) {
    int populated = 0;
    boolean[] seen = new boolean[bucketMeans.length];
    double residualMean = Statistics.mean(residuals);
    double explained = 0d;
    for (int i = 0; i < residuals.length; i++) {
      int b = periodicity.bucketOf(samples.get(i).timestamp(), zone);
      if (!seen[b]) {
        seen[b] = true;
        populated++;
      }
      double d = bucketMeans[b] - residualMean;
      explained += d * d;
    }
    if (populated < 2) return 0d;
    return Statistics.clampUnit(explained / tss);
  }
}
