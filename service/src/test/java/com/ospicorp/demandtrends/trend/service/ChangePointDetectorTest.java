package com.ospicorp.demandtrends.trend.service;

import static com.ospicorp.demandtrends.support.SampleSeries.MONDAY;
import static com.ospicorp.demandtrends.support.SampleSeries.daily;
import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.ChangePoint;
import com.ospicorp.demandtrends.trend.model.Holiday;
import com.ospicorp.demandtrends.trend.model.Sample;
import com.ospicorp.demandtrends.trend.model.enums.CauseType;
import com.ospicorp.demandtrends.trend.model.enums.ChangeDirection;
import com.ospicorp.demandtrends.trend.model.enums.Significance;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChangePointDetectorTest {

  private static ChangePointDetector detector(List<Holiday> holidays) {
    TrendAnalysisProperties properties = new TrendAnalysisProperties();
    properties.getSeasonality().setHolidays(holidays);
    return new ChangePointDetector(properties,
        new HolidayProbableCauseLookup(new HolidayCalendar(properties)));
  }

  @Test
  void singleStepYieldsOneChangePoint() {
    List<Sample> samples = daily(MONDAY, 100, i -> i < 50 ? 10d : 50d);

    List<ChangePoint> changePoints = detector(List.of()).detect(samples);

    assertThat(changePoints).hasSize(1);
    ChangePoint cp = changePoints.get(0);
    assertThat(cp.timestamp()).isEqualTo(samples.get(50).timestamp());
    assertThat(cp.direction()).isEqualTo(ChangeDirection.INCREASE);
    assertThat(cp.magnitude()).isEqualTo(40d);
    assertThat(cp.confidence()).isEqualTo(1d);
    assertThat(cp.significance()).isEqualTo(Significance.MEDIUM);
    assertThat(cp.requiresAction()).isFalse();
    assertThat(cp.probableCauses()).isEmpty();
  }

  @Test
  void largeDropIsHighSignificanceAndActionable() {
    List<Sample> samples = daily(MONDAY, 100, i -> i < 50 ? 100d : 20d);

    List<ChangePoint> changePoints = detector(List.of()).detect(samples);

    assertThat(changePoints).singleElement().satisfies(cp -> {
      assertThat(cp.direction()).isEqualTo(ChangeDirection.DECREASE);
      assertThat(cp.magnitude()).isEqualTo(80d);
      assertThat(cp.significance()).isEqualTo(Significance.HIGH);
      assertThat(cp.requiresAction()).isTrue();
    });
  }

  @Test
  void separatedShiftsAreReportedIndividually() {
    List<Sample> samples = daily(MONDAY, 120, i -> i < 40 ? 10d : i < 80 ? 50d : 20d);

    List<ChangePoint> changePoints = detector(List.of()).detect(samples);

    assertThat(changePoints).extracting(ChangePoint::timestamp)
        .containsExactly(samples.get(40).timestamp(), samples.get(80).timestamp());
    assertThat(changePoints).extracting(ChangePoint::direction)
        .containsExactly(ChangeDirection.INCREASE, ChangeDirection.DECREASE);
  }

  @Test
  void constantSeriesHasNoChangePoints() {
    assertThat(detector(List.of()).detect(daily(MONDAY, 60, i -> 7d))).isEmpty();
  }

  @Test
  void alternatingNoiseIsNotAChange() {
    assertThat(detector(List.of()).detect(daily(MONDAY, 100, i -> 10d + i % 2))).isEmpty();
  }

  @Test
  void shiftNextToHolidayCarriesSeasonalCause() {
    // index 50 lands on 2023-12-25
    Instant start = Instant.parse("2023-11-05T00:00:00Z");
    List<Sample> samples = daily(start, 100, i -> i < 50 ? 10d : 50d);

    List<ChangePoint> changePoints = detector(List.of(new Holiday("Christmas", 12, 25)))
        .detect(samples);

    assertThat(changePoints).singleElement().satisfies(cp -> {
      assertThat(cp.timestamp()).isEqualTo(Instant.parse("2023-12-25T00:00:00Z"));
      assertThat(cp.probableCauses()).singleElement().satisfies(cause -> {
        assertThat(cause.type()).isEqualTo(CauseType.SEASONAL_EFFECT);
        assertThat(cause.likelihood()).isEqualTo(0.7);
        assertThat(cause.description()).contains("Christmas");
      });
    });
  }

  @Test
  void windowScalesWithSeriesLength() {
    ChangePointDetector detector = detector(List.of());

    assertThat(detector.windowSize(3)).isEqualTo(1);
    assertThat(detector.windowSize(20)).isEqualTo(4);
    assertThat(detector.windowSize(200)).isEqualTo(10);
  }
}
