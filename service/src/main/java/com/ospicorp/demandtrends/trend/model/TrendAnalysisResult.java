package com.ospicorp.demandtrends.trend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.demandtrends.trend.model.enums.AnalysisDepth;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import com.ospicorp.demandtrends.trend.model.enums.TrendDirection;
import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendAnalysisResult(
    @JsonProperty("analysis_id") String analysisId,
    @JsonProperty("entity_type") String entityType,
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("metric_name") String metricName,
    Period period,
    AnalysisDepth depth,
    @JsonProperty("analysis_window") TimeWindow analysisWindow,
    @JsonProperty("trend_direction") TrendDirection trendDirection,
    @JsonProperty("trend_strength") double trendStrength,
    @JsonProperty("statistical_significance") double statisticalSignificance,
    @JsonProperty("confidence_level") double confidenceLevel,
    List<TrendComponent> components,
    @JsonProperty("change_points") List<ChangePoint> changePoints,
    @JsonProperty("seasonal_patterns") List<SeasonalPattern> seasonalPatterns,
    List<OutlierPoint> outliers,
    List<ForecastPoint> forecast,
    List<TrendInsight> insights,
    List<TrendRecommendation> recommendations,
    SeriesSummary summary,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("expires_at") Instant expiresAt
) {

  public TrendAnalysisResult {
    components = List.copyOf(components);
    changePoints = List.copyOf(changePoints);
    seasonalPatterns = List.copyOf(seasonalPatterns);
    outliers = List.copyOf(outliers);
    forecast = List.copyOf(forecast);
    insights = List.copyOf(insights);
    recommendations = List.copyOf(recommendations);
  }

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
