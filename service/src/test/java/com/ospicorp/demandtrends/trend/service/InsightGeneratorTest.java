package com.ospicorp.demandtrends.trend.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.ChangePoint;
import com.ospicorp.demandtrends.trend.model.OutlierPoint;
import com.ospicorp.demandtrends.trend.model.SeasonalPattern;
import com.ospicorp.demandtrends.trend.model.TrendComponent;
import com.ospicorp.demandtrends.trend.model.TrendInsight;
import com.ospicorp.demandtrends.trend.model.TrendRecommendation;
import com.ospicorp.demandtrends.trend.model.enums.ChangeDirection;
import com.ospicorp.demandtrends.trend.model.enums.ComponentKind;
import com.ospicorp.demandtrends.trend.model.enums.InsightType;
import com.ospicorp.demandtrends.trend.model.enums.InvestigationPriority;
import com.ospicorp.demandtrends.trend.model.enums.OutlierKind;
import com.ospicorp.demandtrends.trend.model.enums.Periodicity;
import com.ospicorp.demandtrends.trend.model.enums.RecommendationPriority;
import com.ospicorp.demandtrends.trend.model.enums.RecommendationType;
import com.ospicorp.demandtrends.trend.model.enums.Significance;
import com.ospicorp.demandtrends.trend.model.enums.TrendDirection;
import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class InsightGeneratorTest {

  private static final String METRIC = "ticket_arrivals";
  private final InsightGenerator generator = new InsightGenerator(new TrendAnalysisProperties());

  private static ChangePoint changeOn(String date, double confidence) {
    return new ChangePoint(Instant.parse(date + "T00:00:00Z"), 20d, ChangeDirection.INCREASE,
        confidence, Significance.MEDIUM, false, List.of());
  }

  @Test
  void strongLinearComponentIsPatternDiscovery() {
    List<TrendInsight> insights = generator.insights(METRIC,
        List.of(TrendComponent.of(ComponentKind.LINEAR, 0.85, null, "line"),
            TrendComponent.of(ComponentKind.NOISE, 0.15, null, "noise")),
        List.of(), List.of(), List.of());

    assertThat(insights).singleElement().satisfies(insight -> {
      assertThat(insight.type()).isEqualTo(InsightType.PATTERN_DISCOVERY);
      assertThat(insight.title()).isEqualTo("Strong linear trend detected");
      assertThat(insight.significance()).isEqualTo(Significance.HIGH);
    });
  }

  @Test
  void dominantNoiseIsNotReportedAsTrend() {
    List<TrendInsight> insights = generator.insights(METRIC,
        List.of(TrendComponent.of(ComponentKind.NOISE, 1d, null, "noise")),
        List.of(), List.of(), List.of());

    assertThat(insights).isEmpty();
  }

  @Test
  void onlyFirstConfidentChangePointsAreReported() {
    List<ChangePoint> changePoints = List.of(
        changeOn("2024-01-10", 0.9), changeOn("2024-02-10", 0.5),
        changeOn("2024-03-10", 0.95), changeOn("2024-04-10", 0.99));

    List<TrendInsight> insights = generator.insights(METRIC, List.of(), changePoints, List.of(),
        List.of());

    assertThat(insights).extracting(TrendInsight::title).containsExactly(
        "Significant change detected on 2024-01-10",
        "Significant change detected on 2024-03-10");
  }

  @Test
  void strongSeasonalPatternAndCriticalOutliers() {
    SeasonalPattern weekly = new SeasonalPattern(Periodicity.WEEKLY, 0.45, 0, 10d, 7, 0.9, null,
        null, List.of());
    SeasonalPattern hourly = new SeasonalPattern(Periodicity.HOURLY, 0.2, 0, 10d, 24, 0.9, null,
        null, List.of());
    List<OutlierPoint> outliers = IntStream.range(0, 3)
        .mapToObj(i -> new OutlierPoint(Instant.parse("2024-01-01T00:00:00Z").plusSeconds(i),
            200d, 100d, i == 0 ? 4d : 9d, OutlierKind.SPIKE,
            i == 0 ? InvestigationPriority.MEDIUM : InvestigationPriority.CRITICAL))
        .toList();

    List<TrendInsight> insights = generator.insights(METRIC, List.of(), List.of(),
        List.of(weekly, hourly), outliers);

    assertThat(insights).extracting(TrendInsight::title).containsExactly(
        "Weekly seasonal pattern identified", "2 critical outliers detected");
    assertThat(insights.get(1).type()).isEqualTo(InsightType.ANOMALY_DETECTION);
    assertThat(insights.get(1).significance()).isEqualTo(Significance.CRITICAL);
  }

  @Test
  void steepDeclineIsUrgent() {
    List<TrendRecommendation> recommendations = generator.recommendations(METRIC,
        TrendDirection.DECREASING, 0.85, List.of());

    assertThat(recommendations).extracting(TrendRecommendation::priority)
        .containsExactly(RecommendationPriority.URGENT, RecommendationPriority.MEDIUM);
    assertThat(recommendations).extracting(TrendRecommendation::type)
        .containsExactly(RecommendationType.TAKE_ACTION, RecommendationType.MONITOR);
  }

  @Test
  void moderateDeclineIsHighPriority() {
    List<TrendRecommendation> recommendations = generator.recommendations(METRIC,
        TrendDirection.DECREASING, 0.7, List.of());

    assertThat(recommendations.get(0).priority()).isEqualTo(RecommendationPriority.HIGH);
  }

  @Test
  void insightsDriveFollowUpRecommendations() {
    List<TrendInsight> insights = generator.insights(METRIC, List.of(),
        List.of(changeOn("2024-01-10", 0.9)),
        List.of(new SeasonalPattern(Periodicity.WEEKLY, 0.6, 0, 10d, 7, 0.9, null, null,
            List.of())),
        List.of());

    List<TrendRecommendation> recommendations = generator.recommendations(METRIC,
        TrendDirection.SEASONAL, 0.2, insights);

    assertThat(recommendations).extracting(TrendRecommendation::type)
        .containsExactly(RecommendationType.TAKE_ACTION, RecommendationType.INVESTIGATE);
    assertThat(recommendations.get(1).priority()).isEqualTo(RecommendationPriority.HIGH);
  }

  @Test
  void weakStableTrendNeedsNothing() {
    assertThat(generator.recommendations(METRIC, TrendDirection.STABLE, 0.1, List.of())).isEmpty();
  }
}
