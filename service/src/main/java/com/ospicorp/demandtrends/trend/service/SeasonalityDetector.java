package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.DetectedPattern;
import com.ospicorp.demandtrends.trend.model.Holiday;
import com.ospicorp.demandtrends.trend.model.Sample;
import com.ospicorp.demandtrends.trend.model.SeasonalPattern;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import com.ospicorp.demandtrends.trend.model.enums.Periodicity;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Month;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class SeasonalityDetector {

  private final double minStrength;
  private final HolidayCalendar calendar;
  private final ZoneId zone;
  private final Clock clock;

  public SeasonalityDetector(TrendAnalysisProperties properties, HolidayCalendar calendar,
      Clock clock) {
    this.minStrength = properties.getSeasonality().getMinStrength();
    this.calendar = calendar;
    this.zone = properties.getZone();
    this.clock = clock;
  }

  /** Patterns stronger than the configured minimum, strongest first. */
  public List<SeasonalPattern> detect(List<Sample> samples, Period period) {
    List<SeasonalPattern> patterns = new ArrayList<>();
    for (Periodicity periodicity : period.seasonalPeriodicities()) {
      if (periodicity == Periodicity.HOLIDAY) {
        holidayPattern(samples, period).ifPresent(patterns::add);
        continue;
      }
      SeasonalPattern pattern = measure(samples, periodicity);
      if (pattern.strength() > minStrength) {
        patterns.add(pattern);
      }
    }
    patterns.sort(Comparator.comparingDouble(SeasonalPattern::strength).reversed());
    return patterns;
  }

  /** Measures a calendar cycle whether or not it clears the reporting threshold. */
  public SeasonalPattern measure(List<Sample> samples, Periodicity periodicity) {
    if (!periodicity.isCyclic()) {
      throw new IllegalArgumentException("Periodicity " + periodicity + " has no phase buckets");
    }
    int length = periodicity.periodLength();
    double[] sums = new double[length];
    int[] counts = new int[length];
    double grandSum = 0d;
    for (Sample s : samples) {
      int b = periodicity.bucketOf(s.timestamp(), zone);
      sums[b] += s.value();
      counts[b]++;
      grandSum += s.value();
    }

    List<Double> populatedMeans = new ArrayList<>();
    int peak = -1;
    int trough = -1;
    double[] means = new double[length];
    for (int b = 0; b < length; b++) {
      if (counts[b] == 0) continue;
      means[b] = sums[b] / counts[b];
      populatedMeans.add(means[b]);
      if (peak < 0 || means[b] > means[peak]) peak = b;
      if (trough < 0 || means[b] < means[trough]) trough = b;
    }
    if (populatedMeans.size() < 2) {
      return new SeasonalPattern(periodicity, 0d, Math.max(peak, 0), 0d, length, 0d, null, null,
          List.of());
    }

    double meanOfMeans = Statistics.mean(populatedMeans);
    double[] meansArray = populatedMeans.stream().mapToDouble(Double::doubleValue).toArray();
    double strength = Math.abs(meanOfMeans) < Statistics.EPSILON
        ? 0d
        : Statistics.clampUnit(Statistics.stdDev(meansArray) / Math.abs(meanOfMeans));
    double amplitude = means[peak] - means[trough];

    double grandMean = grandSum / samples.size();
    double ssTotal = 0d;
    for (Sample s : samples) {
      double d = s.value() - grandMean;
      ssTotal += d * d;
    }
    double ssBetween = 0d;
    for (int b = 0; b < length; b++) {
      if (counts[b] == 0) continue;
      double d = means[b] - grandMean;
      ssBetween += counts[b] * d * d;
    }
    double etaSquared = ssTotal <= Statistics.EPSILON ? 0d : ssBetween / ssTotal;
    double coverage = (double) populatedMeans.size() / length;
    double reliability = Statistics.clampUnit(etaSquared * coverage);

    ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);
    ZonedDateTime nextPeak = nextBucketStart(periodicity, peak, now);
    ZonedDateTime nextTrough = nextBucketStart(periodicity, trough, now);

    List<DetectedPattern> detected = new ArrayList<>();
    String unit = periodicity.name().toLowerCase(Locale.ROOT);
    detected.add(new DetectedPattern("Peak " + bucketUnit(periodicity),
        String.format(Locale.ROOT, "Highest %s average at %s (%.2f)", unit,
            bucketLabel(periodicity, peak), means[peak]),
        1d / length, strength, nextPeak.toInstant()));
    if (periodicity != Periodicity.MONTHLY) {
      detected.add(new DetectedPattern("Trough " + bucketUnit(periodicity),
          String.format(Locale.ROOT, "Lowest %s average at %s (%.2f)", unit,
              bucketLabel(periodicity, trough), means[trough]),
          1d / length, strength, nextTrough.toInstant()));
    }

    return new SeasonalPattern(periodicity, strength, peak, amplitude, length, reliability,
        nextPeak.toInstant(), nextTrough.toInstant(), detected);
  }

  /**
   * Holiday effect for hourly and daily data: samples within the configured window of a holiday
   * are compared against the mean of all other samples.
   */
  public Optional<SeasonalPattern> holidayPattern(List<Sample> samples, Period period) {
    if (calendar.isEmpty() || (period != Period.HOURLY && period != Period.DAILY)) {
      return Optional.empty();
    }
    List<Holiday> holidays = calendar.holidays();
    double[] deviationSums = new double[holidays.size()];
    int[] counts = new int[holidays.size()];
    List<Sample> ordinary = new ArrayList<>();
    List<int[]> holidaySamples = new ArrayList<>();

    for (int i = 0; i < samples.size(); i++) {
      var date = samples.get(i).timestamp().atZone(zone).toLocalDate();
      boolean matched = false;
      for (int h = 0; h < holidays.size(); h++) {
        if (calendar.isNear(holidays.get(h), date)) {
          holidaySamples.add(new int[] {i, h});
          matched = true;
        }
      }
      if (!matched) {
        ordinary.add(samples.get(i));
      }
    }
    if (ordinary.isEmpty() || holidaySamples.isEmpty()) {
      return Optional.empty();
    }

    double baseline = ordinary.stream().mapToDouble(Sample::value).average().orElse(0d);
    if (Math.abs(baseline) < Statistics.EPSILON) {
      return Optional.empty();
    }
    for (int[] match : holidaySamples) {
      deviationSums[match[1]] += Math.abs(samples.get(match[0]).value() - baseline);
      counts[match[1]]++;
    }

    ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);
    List<Double> impacts = new ArrayList<>();
    List<DetectedPattern> detected = new ArrayList<>();
    int strongest = -1;
    double strongestImpact = 0d;
    double weakestImpact = Double.MAX_VALUE;
    for (int h = 0; h < holidays.size(); h++) {
      if (counts[h] == 0) continue;
      double impact = deviationSums[h] / counts[h];
      impacts.add(impact);
      if (strongest < 0 || impact > strongestImpact) {
        strongest = h;
        strongestImpact = impact;
      }
      weakestImpact = Math.min(weakestImpact, impact);
      Holiday holiday = holidays.get(h);
      detected.add(new DetectedPattern(holiday.name(),
          String.format(Locale.ROOT, "Average deviation of %.2f from baseline within %d day(s)",
              impact, calendar.windowDays()),
          1d / Periodicity.HOLIDAY.periodLength(),
          Statistics.clampUnit(impact / Math.abs(baseline)),
          calendar.nextOccurrence(holiday, now).toInstant()));
    }

    double strength = Statistics.clampUnit(Statistics.mean(impacts) / Math.abs(baseline));
    if (strength <= minStrength) {
      return Optional.empty();
    }
    double reliability = Statistics.clampUnit((double) impacts.size() / holidays.size());
    return Optional.of(new SeasonalPattern(Periodicity.HOLIDAY, strength, strongest,
        strongestImpact - (impacts.size() > 1 ? weakestImpact : 0d),
        Periodicity.HOLIDAY.periodLength(), reliability,
        calendar.nextOccurrence(holidays.get(strongest), now).toInstant(), null, detected));
  }

  static ZonedDateTime nextBucketStart(Periodicity periodicity, int bucket, ZonedDateTime now) {
    ZonedDateTime candidate;
    switch (periodicity) {
      case HOURLY -> {
        candidate = now.truncatedTo(ChronoUnit.HOURS).withHour(bucket);
        if (!candidate.isAfter(now)) candidate = candidate.plusDays(1);
      }
      case WEEKLY -> {
        candidate = now.truncatedTo(ChronoUnit.DAYS)
            .with(TemporalAdjusters.nextOrSame(DayOfWeek.of(bucket + 1)));
        if (!candidate.isAfter(now)) candidate = candidate.plusWeeks(1);
      }
      case MONTHLY -> {
        candidate = now.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).withMonth(bucket + 1);
        if (!candidate.isAfter(now)) candidate = candidate.plusYears(1);
      }
      default -> throw new IllegalArgumentException("No phase buckets for " + periodicity);
    }
    return candidate;
  }

  private static String bucketUnit(Periodicity periodicity) {
    return switch (periodicity) {
      case HOURLY -> "hour";
      case WEEKLY -> "day";
      case MONTHLY -> "month";
      case HOLIDAY -> "holiday";
    };
  }

  private static String bucketLabel(Periodicity periodicity, int bucket) {
    return switch (periodicity) {
      case HOURLY -> String.format(Locale.ROOT, "%02d:00", bucket);
      case WEEKLY -> DayOfWeek.of(bucket + 1).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
      case MONTHLY -> Month.of(bucket + 1).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
      case HOLIDAY -> "holiday " + bucket;
    };
  }
}
