package com.ospicorp.demandtrends.trend.service;

import static com.ospicorp.demandtrends.support.SampleSeries.MONDAY;
import static com.ospicorp.demandtrends.support.SampleSeries.daily;
import static com.ospicorp.demandtrends.support.SampleSeries.hourly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.support.MutableClock;
import com.ospicorp.demandtrends.trend.model.DetectedPattern;
import com.ospicorp.demandtrends.trend.model.Holiday;
import com.ospicorp.demandtrends.trend.model.Sample;
import com.ospicorp.demandtrends.trend.model.SeasonalPattern;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import com.ospicorp.demandtrends.trend.model.enums.Periodicity;
import java.time.Instant;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeasonalityDetectorTest {

  // a Wednesday
  private static final Instant NOW = Instant.parse("2024-03-20T10:00:00Z");

  private static SeasonalityDetector detector(List<Holiday> holidays) {
    TrendAnalysisProperties properties = new TrendAnalysisProperties();
    properties.getSeasonality().setHolidays(holidays);
    return new SeasonalityDetector(properties, new HolidayCalendar(properties),
        new MutableClock(NOW));
  }

  @Test
  void weekdayWeekendSplitIsWeeklyPattern() {
    List<Sample> samples = daily(MONDAY, 90, i -> i % 7 < 5 ? 100d : 50d);

    SeasonalPattern weekly = detector(List.of()).measure(samples, Periodicity.WEEKLY);

    assertThat(weekly.strength()).isCloseTo(0.2635, within(1e-3));
    assertThat(weekly.amplitude()).isCloseTo(50d, within(1e-9));
    assertThat(weekly.phase()).isZero();
    assertThat(weekly.periodLength()).isEqualTo(7);
    assertThat(weekly.reliability()).isCloseTo(1d, within(1e-9));
    assertThat(weekly.nextPeak()).isEqualTo(Instant.parse("2024-03-25T00:00:00Z"));
    assertThat(weekly.nextTrough()).isEqualTo(Instant.parse("2024-03-23T00:00:00Z"));
    assertThat(weekly.detectedPatterns()).extracting(DetectedPattern::name)
        .containsExactly("Peak day", "Trough day");
  }

  @Test
  void detectReportsOnlyPatternsAboveThreshold() {
    List<Sample> samples = daily(MONDAY, 90, i -> i % 7 < 5 ? 100d : 50d);

    List<SeasonalPattern> patterns = detector(List.of()).detect(samples, Period.DAILY);

    assertThat(patterns).extracting(SeasonalPattern::periodicity)
        .containsExactly(Periodicity.WEEKLY);
  }

  @Test
  void flatSeriesHasNoSeasonality() {
    List<Sample> samples = daily(MONDAY, 60, i -> 42d);
    SeasonalityDetector detector = detector(List.of());

    assertThat(detector.measure(samples, Periodicity.WEEKLY).strength()).isZero();
    assertThat(detector.measure(samples, Periodicity.MONTHLY).strength()).isZero();
    assertThat(detector.detect(samples, Period.DAILY)).isEmpty();

    List<Sample> hours = hourly(MONDAY, 24 * 14, i -> 42d);
    assertThat(detector.measure(hours, Periodicity.HOURLY).strength()).isZero();
    assertThat(detector.measure(hours, Periodicity.WEEKLY).strength()).isZero();
    assertThat(detector.detect(hours, Period.HOURLY)).isEmpty();
  }

  @Test
  void singleBucketYieldsEmptyPattern() {
    // daily samples at midnight all fall into hour 0
    SeasonalPattern hourly = detector(List.of())
        .measure(daily(MONDAY, 30, i -> i), Periodicity.HOURLY);

    assertThat(hourly.strength()).isZero();
    assertThat(hourly.nextPeak()).isNull();
    assertThat(hourly.detectedPatterns()).isEmpty();
  }

  @Test
  void hourlyPeakFollowsBusyHour() {
    List<Sample> samples = hourly(MONDAY, 24 * 14, i -> i % 24 == 14 ? 90d : 30d);

    SeasonalPattern pattern = detector(List.of()).measure(samples, Periodicity.HOURLY);

    assertThat(pattern.phase()).isEqualTo(14);
    assertThat(pattern.nextPeak()).isEqualTo(Instant.parse("2024-03-20T14:00:00Z"));
    assertThat(pattern.nextTrough()).isEqualTo(Instant.parse("2024-03-21T00:00:00Z"));
  }

  @Test
  void monthlyPatternHasNoTroughEntry() {
    List<Sample> samples = daily(MONDAY, 366, i -> {
      int month = MONDAY.atZone(ZoneOffset.UTC).plusDays(i).getMonthValue();
      return month == 12 ? 300d : 100d;
    });

    SeasonalPattern monthly = detector(List.of()).measure(samples, Periodicity.MONTHLY);

    assertThat(monthly.phase()).isEqualTo(11);
    assertThat(monthly.detectedPatterns()).extracting(DetectedPattern::name)
        .containsExactly("Peak month");
    assertThat(monthly.nextPeak()).isEqualTo(Instant.parse("2024-12-01T00:00:00Z"));
  }

  @Test
  void holidayDipIsReported() {
    Instant start = Instant.parse("2023-11-01T00:00:00Z");
    List<Sample> samples = daily(start, 92, i -> {
      LocalDate date = LocalDate.of(2023, 11, 1).plusDays(i);
      MonthDay day = MonthDay.from(date);
      boolean christmas = day.getMonthValue() == 12
          && day.getDayOfMonth() >= 24 && day.getDayOfMonth() <= 26;
      return christmas ? 40d : 100d;
    });
    SeasonalityDetector detector = detector(List.of(new Holiday("Christmas", 12, 25)));

    List<SeasonalPattern> patterns = detector.detect(samples, Period.DAILY);

    assertThat(patterns).hasSize(1);
    SeasonalPattern holiday = patterns.get(0);
    assertThat(holiday.periodicity()).isEqualTo(Periodicity.HOLIDAY);
    assertThat(holiday.strength()).isCloseTo(0.6, within(1e-9));
    assertThat(holiday.reliability()).isEqualTo(1d);
    assertThat(holiday.nextPeak()).isEqualTo(Instant.parse("2024-12-25T00:00:00Z"));
    assertThat(holiday.nextTrough()).isNull();
    assertThat(holiday.detectedPatterns()).singleElement()
        .satisfies(p -> assertThat(p.name()).isEqualTo("Christmas"));
  }

  @Test
  void holidaySeasonalityIsSkippedForCoarsePeriods() {
    List<Sample> samples = daily(MONDAY, 30, i -> 100d);
    SeasonalityDetector detector = detector(List.of(new Holiday("New Year", 1, 1)));

    assertThat(detector.holidayPattern(samples, Period.WEEKLY)).isEmpty();
  }

  @Test
  void holidayPeriodicityCannotBeMeasuredAsCycle() {
    assertThatThrownBy(() -> detector(List.of())
        .measure(daily(MONDAY, 10, i -> i), Periodicity.HOLIDAY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nextBucketStartRollsOverWhenBucketHasPassed() {
    ZonedDateTime now = NOW.atZone(ZoneOffset.UTC);

    assertThat(SeasonalityDetector.nextBucketStart(Periodicity.HOURLY, 10, now))
        .isEqualTo(ZonedDateTime.parse("2024-03-21T10:00:00Z"));
    assertThat(SeasonalityDetector.nextBucketStart(Periodicity.WEEKLY, 2, now))
        .isEqualTo(ZonedDateTime.parse("2024-03-27T00:00:00Z"));
    assertThat(SeasonalityDetector.nextBucketStart(Periodicity.MONTHLY, 2, now))
        .isEqualTo(ZonedDateTime.parse("2025-03-01T00:00:00Z"));
  }
}
