package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.ChangePoint;
import com.ospicorp.demandtrends.trend.model.ComparisonResult.KeyDifference;
import com.ospicorp.demandtrends.trend.model.ComparisonResult.StatisticalTest;
import com.ospicorp.demandtrends.trend.model.OutlierPoint;
import com.ospicorp.demandtrends.trend.model.SeasonalPattern;
import com.ospicorp.demandtrends.trend.model.TrendComponent;
import com.ospicorp.demandtrends.trend.model.TrendInsight;
import com.ospicorp.demandtrends.trend.model.TrendRecommendation;
import com.ospicorp.demandtrends.trend.model.enums.ComparisonType;
import com.ospicorp.demandtrends.trend.model.enums.ComponentKind;
import com.ospicorp.demandtrends.trend.model.enums.DifferenceType;
import com.ospicorp.demandtrends.trend.model.enums.InsightType;
import com.ospicorp.demandtrends.trend.model.enums.InvestigationPriority;
import com.ospicorp.demandtrends.trend.model.enums.RecommendationPriority;
import com.ospicorp.demandtrends.trend.model.enums.RecommendationType;
import com.ospicorp.demandtrends.trend.model.enums.Significance;
import com.ospicorp.demandtrends.trend.model.enums.TrendDirection;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class InsightGenerator {
  private static final String SEASONAL_TITLE_SUFFIX = " seasonal pattern identified";
  private static final int MAX_CHANGE_POINT_INSIGHTS = 3;

  private final ZoneId zone;

  public InsightGenerator(TrendAnalysisProperties properties) {
    this.zone = properties.getZone();
  }

  public List<TrendInsight> insights(String metricName, List<TrendComponent> components,
      List<ChangePoint> changePoints, List<SeasonalPattern> patterns, List<OutlierPoint> outliers) {
    List<TrendInsight> insights = new ArrayList<>();

    Optional<TrendComponent> strongest = components.stream()
        .filter(c -> c.kind() != ComponentKind.NOISE)
        .max(Comparator.comparingDouble(TrendComponent::strength));
    strongest.filter(c -> c.strength() > 0.7).ifPresent(c -> {
      String kind = c.kind().name().toLowerCase(Locale.ROOT);
      insights.add(new TrendInsight(InsightType.PATTERN_DISCOVERY,
          "Strong " + kind + " trend detected",
          String.format(Locale.ROOT, "%s shows a strong %s pattern explaining %.1f%% of variance",
              metricName, kind, c.contributionPct()),
          c.strength() > 0.8 ? Significance.HIGH : Significance.MEDIUM,
          c.strength(), 0.8));
    });

    DateTimeFormatter dates = DateTimeFormatter.ISO_LOCAL_DATE.withZone(zone);
    changePoints.stream()
        .limit(MAX_CHANGE_POINT_INSIGHTS)
        .filter(cp -> cp.confidence() > 0.7)
        .forEach(cp -> insights.add(new TrendInsight(InsightType.PERFORMANCE_CHANGE,
            "Significant change detected on " + dates.format(cp.timestamp()),
            String.format(Locale.ROOT, "%s experienced a %s of %.2f on %s", metricName,
                cp.direction().name().toLowerCase(Locale.ROOT), cp.magnitude(),
                dates.format(cp.timestamp())),
            cp.significance(), cp.confidence(), cp.requiresAction() ? 0.9 : 0.6)));

    for (SeasonalPattern pattern : patterns) {
      if (pattern.strength() <= 0.3) continue;
      String name = pattern.periodicity().name().toLowerCase(Locale.ROOT);
      insights.add(new TrendInsight(InsightType.PATTERN_DISCOVERY,
          Character.toUpperCase(name.charAt(0)) + name.substring(1) + SEASONAL_TITLE_SUFFIX,
          String.format(Locale.ROOT, "%s shows predictable %s variations with %.1f%% strength",
              metricName, name, pattern.strength() * 100d),
          pattern.strength() > 0.5 ? Significance.HIGH : Significance.MEDIUM,
          pattern.reliability(), 0.7));
    }

    long critical = outliers.stream()
        .filter(o -> o.priority() == InvestigationPriority.CRITICAL)
        .count();
    if (critical > 0) {
      insights.add(new TrendInsight(InsightType.ANOMALY_DETECTION,
          critical + " critical outliers detected",
          String.format(Locale.ROOT, "%s has %d data points requiring immediate investigation",
              metricName, critical),
          Significance.CRITICAL, 0.85, 0.95));
    }
    return insights;
  }

  public List<TrendRecommendation> recommendations(String metricName, TrendDirection direction,
      double trendStrength, List<TrendInsight> insights) {
    List<TrendRecommendation> recommendations = new ArrayList<>();

    if (direction == TrendDirection.DECREASING && trendStrength > 0.6) {
      recommendations.add(new TrendRecommendation(RecommendationType.TAKE_ACTION,
          trendStrength > 0.8 ? RecommendationPriority.URGENT : RecommendationPriority.HIGH,
          "Address declining trend in " + metricName,
          metricName + " shows a strong declining trend that requires immediate attention",
          "Declining trends in " + metricName
              + " can lead to reduced performance and customer satisfaction",
          "2-4 weeks", "Operations Team"));
    }

    boolean seasonal = insights.stream()
        .anyMatch(i -> i.type() == InsightType.PATTERN_DISCOVERY
            && i.title().endsWith(SEASONAL_TITLE_SUFFIX));
    if (seasonal) {
      recommendations.add(new TrendRecommendation(RecommendationType.TAKE_ACTION,
          RecommendationPriority.MEDIUM,
          "Leverage seasonal patterns for resource planning",
          "Implement capacity planning based on identified seasonal patterns",
          "Predictable seasonal variations can be used to optimize resource allocation",
          "4-6 weeks", "Operations & Planning"));
    }

    if (insights.stream().anyMatch(i -> i.type() == InsightType.PERFORMANCE_CHANGE)) {
      recommendations.add(new TrendRecommendation(RecommendationType.INVESTIGATE,
          RecommendationPriority.HIGH,
          "Investigate detected performance changes",
          "Conduct thorough investigation of significant change points",
          "Understanding change points helps identify root causes and prevent recurrence",
          "1-2 weeks", "Analytics & Operations"));
    }

    if (trendStrength > 0.4) {
      recommendations.add(new TrendRecommendation(RecommendationType.MONITOR,
          RecommendationPriority.MEDIUM,
          "Implement enhanced monitoring for " + metricName,
          "Set up automated monitoring and alerting for trend changes",
          "Proactive monitoring enables early detection of trend changes",
          "1-2 weeks", "Technical Operations"));
    }
    return recommendations;
  }

  /**
   * One finding per key difference, plus one listing the entities whose level shift tested
   * significant.
   */
  public List<TrendInsight> comparisonInsights(List<KeyDifference> differences,
      List<StatisticalTest> tests) {
    List<TrendInsight> insights = new ArrayList<>();
    for (KeyDifference d : differences) {
      String entities = String.join(", ", d.entitiesAffected());
      switch (d.type()) {
        case SIGNIFICANT_INCREASE, SIGNIFICANT_DECREASE -> {
          String verb = d.type() == DifferenceType.SIGNIFICANT_INCREASE ? "rose" : "fell";
          insights.add(new TrendInsight(InsightType.PERFORMANCE_CHANGE,
              d.metricName() + " " + verb + " for " + entities,
              String.format(Locale.ROOT,
                  "%s %s by up to %.1f%% between the earlier and later halves for %s",
                  d.metricName(), verb, d.magnitude(), entities),
              changeSignificance(d.magnitude()), d.confidence(),
              d.type() == DifferenceType.SIGNIFICANT_DECREASE ? 0.8 : 0.7));
        }
        case STRUCTURAL_CHANGE -> insights.add(new TrendInsight(InsightType.PATTERN_DISCOVERY,
            "Entities follow different trends in " + d.metricName(),
            String.format(Locale.ROOT, "%s moves in different directions across %s",
                d.metricName(), entities),
            Significance.MEDIUM, d.confidence(), 0.6));
        case VOLATILITY_CHANGE -> insights.add(new TrendInsight(InsightType.ANOMALY_DETECTION,
            "Volatility shifted in " + d.metricName(),
            String.format(Locale.ROOT, "%s volatility changed by up to %.1f%% for %s",
                d.metricName(), d.magnitude(), entities),
            d.magnitude() > 50d ? Significance.HIGH : Significance.MEDIUM, d.confidence(), 0.5));
      }
    }

    List<StatisticalTest> shifted = tests.stream()
        .filter(t -> t.pValue() < EntityComparator.SIGNIFICANCE_LEVEL)
        .toList();
    if (!shifted.isEmpty()) {
      double worstP = shifted.stream().mapToDouble(StatisticalTest::pValue).max().orElse(0d);
      insights.add(new TrendInsight(InsightType.PERFORMANCE_CHANGE,
          shifted.size() + " significant level shifts",
          "Welch tests found a level shift for " + String.join(", ", shifted.stream()
              .map(t -> t.entityId() + "/" + t.metricName())
              .toList()),
          Significance.MEDIUM, 1d - worstP, 0.6));
    }
    return insights;
  }

  public List<TrendRecommendation> comparisonRecommendations(ComparisonType comparisonType,
      List<KeyDifference> differences) {
    List<TrendRecommendation> recommendations = new ArrayList<>();
    String found = "Found in a " + comparisonType.name().toLowerCase(Locale.ROOT).replace('_', ' ');

    List<KeyDifference> decreases = ofType(differences, DifferenceType.SIGNIFICANT_DECREASE);
    if (!decreases.isEmpty()) {
      recommendations.add(new TrendRecommendation(RecommendationType.INVESTIGATE,
          RecommendationPriority.HIGH,
          "Investigate declines in " + String.join(", ", metricsOf(decreases)),
          "Review what changed for " + String.join(", ", entitiesOf(decreases)),
          found + "; an entity falling behind its peers often points to a local change",
          "1-2 weeks", "Analytics & Operations"));
    }

    List<KeyDifference> increases = ofType(differences, DifferenceType.SIGNIFICANT_INCREASE);
    if (!increases.isEmpty()) {
      boolean steep = increases.stream().anyMatch(d -> d.magnitude() > 25d);
      recommendations.add(new TrendRecommendation(RecommendationType.TAKE_ACTION,
          steep ? RecommendationPriority.HIGH : RecommendationPriority.MEDIUM,
          "Review capacity for rising " + String.join(", ", metricsOf(increases)),
          "Check staffing for " + String.join(", ", entitiesOf(increases))
              + " against the increased load",
          found + "; sustained growth outpaces capacity planned on the earlier level",
          "2-4 weeks", "Operations & Planning"));
    }

    List<KeyDifference> structural = ofType(differences, DifferenceType.STRUCTURAL_CHANGE);
    if (!structural.isEmpty()) {
      recommendations.add(new TrendRecommendation(RecommendationType.INVESTIGATE,
          RecommendationPriority.MEDIUM,
          "Compare practices across entities",
          "Entities diverge in trend direction for " + String.join(", ", metricsOf(structural)),
          found + "; diverging entities show which practices move the metric",
          "4-6 weeks", "Operations Team"));
    }

    List<KeyDifference> volatility = ofType(differences, DifferenceType.VOLATILITY_CHANGE);
    if (!volatility.isEmpty()) {
      recommendations.add(new TrendRecommendation(RecommendationType.MONITOR,
          RecommendationPriority.MEDIUM,
          "Monitor volatility of " + String.join(", ", metricsOf(volatility)),
          "Set up alerting for " + String.join(", ", entitiesOf(volatility)),
          found + "; volatile demand makes forecasts and staffing less reliable",
          "1-2 weeks", "Technical Operations"));
    }
    return recommendations;
  }

  private static Significance changeSignificance(double magnitudePct) {
    if (magnitudePct > 50d) return Significance.HIGH;
    if (magnitudePct > 25d) return Significance.MEDIUM;
    return Significance.LOW;
  }

  private static List<KeyDifference> ofType(List<KeyDifference> differences,
      DifferenceType type) {
    return differences.stream().filter(d -> d.type() == type).toList();
  }

  private static Set<String> metricsOf(List<KeyDifference> differences) {
    Set<String> metrics = new LinkedHashSet<>();
    differences.forEach(d -> metrics.add(d.metricName()));
    return metrics;
  }

  private static Set<String> entitiesOf(List<KeyDifference> differences) {
    Set<String> entities = new LinkedHashSet<>();
    differences.forEach(d -> entities.addAll(d.entitiesAffected()));
    return entities;
  }
}
