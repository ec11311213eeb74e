package com.ospicorp.demandtrends.config;

import com.ospicorp.demandtrends.trend.model.ExternalFactor;
import com.ospicorp.demandtrends.trend.model.Holiday;
import com.ospicorp.demandtrends.trend.model.enums.AnalysisDepth;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "trends")
public class TrendAnalysisProperties {

  private ZoneId zone = ZoneOffset.UTC;
  private final Analysis analysis = new Analysis();
  private final Decomposition decomposition = new Decomposition();
  private final Seasonality seasonality = new Seasonality();
  private final ChangePoints changePoints = new ChangePoints();
  private final Outliers outliers = new Outliers();
  private final Forecast forecast = new Forecast();
  private final Capacity capacity = new Capacity();
  private final Bulk bulk = new Bulk();
  private final History history = new History();

  public ZoneId getZone() {
    return zone;
  }

  public void setZone(ZoneId zone) {
    this.zone = zone;
  }

  public Analysis getAnalysis() {
    return analysis;
  }

  public Decomposition getDecomposition() {
    return decomposition;
  }

  public Seasonality getSeasonality() {
    return seasonality;
  }

  public ChangePoints getChangePoints() {
    return changePoints;
  }

  public Outliers getOutliers() {
    return outliers;
  }

  public Forecast getForecast() {
    return forecast;
  }

  public Capacity getCapacity() {
    return capacity;
  }

  public Bulk getBulk() {
    return bulk;
  }

  public History getHistory() {
    return history;
  }

  public static class Analysis {
    private Map<Period, Integer> minDataPoints = new EnumMap<>(Map.of(
        Period.HOURLY, 48,
        Period.DAILY, 30,
        Period.WEEKLY, 12,
        Period.MONTHLY, 6,
        Period.QUARTERLY, 4));
    private Map<Period, Duration> cacheExpiry = new EnumMap<>(Map.of(
        Period.HOURLY, Duration.ofHours(1),
        Period.DAILY, Duration.ofHours(6),
        Period.WEEKLY, Duration.ofHours(24),
        Period.MONTHLY, Duration.ofHours(72),
        Period.QUARTERLY, Duration.ofHours(168)));
    // Lookback in periods for basic / advanced / comprehensive analyses.
    private Map<Period, List<Integer>> windowPeriods = new EnumMap<>(Map.of(
        Period.HOURLY, List.of(168, 336, 720),
        Period.DAILY, List.of(30, 90, 365),
        Period.WEEKLY, List.of(12, 26, 104),
        Period.MONTHLY, List.of(6, 12, 36),
        Period.QUARTERLY, List.of(4, 8, 16)));
    private int forecastHorizon = 14;

    public int minDataPointsFor(Period period) {
      return minDataPoints.getOrDefault(period, 10);
    }

    public Duration cacheExpiryFor(Period period) {
      return cacheExpiry.getOrDefault(period, Duration.ofHours(24));
    }

    public int windowPeriodsFor(Period period, AnalysisDepth depth) {
      List<Integer> byDepth = windowPeriods.get(period);
      if (byDepth == null || byDepth.size() <= depth.ordinal()) {
        throw new IllegalStateException("No analysis window configured for " + period + "/" + depth);
      }
      return byDepth.get(depth.ordinal());
    }

    public Map<Period, Integer> getMinDataPoints() {
      return minDataPoints;
    }

    public void setMinDataPoints(Map<Period, Integer> minDataPoints) {
      this.minDataPoints = minDataPoints;
    }

    public Map<Period, Duration> getCacheExpiry() {
      return cacheExpiry;
    }

    public void setCacheExpiry(Map<Period, Duration> cacheExpiry) {
      this.cacheExpiry = cacheExpiry;
    }

    public Map<Period, List<Integer>> getWindowPeriods() {
      return windowPeriods;
    }

    public void setWindowPeriods(Map<Period, List<Integer>> windowPeriods) {
      this.windowPeriods = windowPeriods;
    }

    public int getForecastHorizon() {
      return forecastHorizon;
    }

    public void setForecastHorizon(int forecastHorizon) {
      this.forecastHorizon = forecastHorizon;
    }
  }

  public static class Decomposition {
    private double linearMinRSquared = 0.1;
    private double seasonalMinStrength = 0.1;
    private double cyclicalMinStrength = 0.05;
    // 0 picks a window from the series length
    private int cyclicalWindow = 0;

    public double getLinearMinRSquared() {
      return linearMinRSquared;
    }

    public void setLinearMinRSquared(double linearMinRSquared) {
      this.linearMinRSquared = linearMinRSquared;
    }

    public double getSeasonalMinStrength() {
      return seasonalMinStrength;
    }

    public void setSeasonalMinStrength(double seasonalMinStrength) {
      this.seasonalMinStrength = seasonalMinStrength;
    }

    public double getCyclicalMinStrength() {
      return cyclicalMinStrength;
    }

    public void setCyclicalMinStrength(double cyclicalMinStrength) {
      this.cyclicalMinStrength = cyclicalMinStrength;
    }

    public int getCyclicalWindow() {
      return cyclicalWindow;
    }

    public void setCyclicalWindow(int cyclicalWindow) {
      this.cyclicalWindow = cyclicalWindow;
    }
  }

  public static class Seasonality {
    private double minStrength = 0.1;
    private int holidayWindowDays = 1;
    private List<Holiday> holidays = new ArrayList<>();

    public double getMinStrength() {
      return minStrength;
    }

    public void setMinStrength(double minStrength) {
      this.minStrength = minStrength;
    }

    public int getHolidayWindowDays() {
      return holidayWindowDays;
    }

    public void setHolidayWindowDays(int holidayWindowDays) {
      this.holidayWindowDays = holidayWindowDays;
    }

    public List<Holiday> getHolidays() {
      return holidays;
    }

    public void setHolidays(List<Holiday> holidays) {
      this.holidays = holidays;
    }
  }

  public static class ChangePoints {
    private int maxWindow = 10;
    private double thresholdMultiplier = 1.5;
    private double highSignificanceMagnitude = 50d;
    private double actionMultiplier = 1.5;

    public int getMaxWindow() {
      return maxWindow;
    }

    public void setMaxWindow(int maxWindow) {
      this.maxWindow = maxWindow;
    }

    public double getThresholdMultiplier() {
      return thresholdMultiplier;
    }

    public void setThresholdMultiplier(double thresholdMultiplier) {
      this.thresholdMultiplier = thresholdMultiplier;
    }

    public double getHighSignificanceMagnitude() {
      return highSignificanceMagnitude;
    }

    public void setHighSignificanceMagnitude(double highSignificanceMagnitude) {
      this.highSignificanceMagnitude = highSignificanceMagnitude;
    }

    public double getActionMultiplier() {
      return actionMultiplier;
    }

    public void setActionMultiplier(double actionMultiplier) {
      this.actionMultiplier = actionMultiplier;
    }
  }

  public static class Outliers {
    private int windowSize = 15;
    private double minScale = 1e-9;
    // fraction of the mean absolute level
    private double relativeScaleFloor = 0.01;
    private double lowScore = 3.0;
    private double mediumScore = 4.0;
    private double highScore = 5.0;
    private double criticalScore = 7.0;

    public int getWindowSize() {
      return windowSize;
    }

    public void setWindowSize(int windowSize) {
      this.windowSize = windowSize;
    }

    public double getMinScale() {
      return minScale;
    }

    public void setMinScale(double minScale) {
      this.minScale = minScale;
    }

    public double getRelativeScaleFloor() {
      return relativeScaleFloor;
    }

    public void setRelativeScaleFloor(double relativeScaleFloor) {
      this.relativeScaleFloor = relativeScaleFloor;
    }

    public double getLowScore() {
      return lowScore;
    }

    public void setLowScore(double lowScore) {
      this.lowScore = lowScore;
    }

    public double getMediumScore() {
      return mediumScore;
    }

    public void setMediumScore(double mediumScore) {
      this.mediumScore = mediumScore;
    }

    public double getHighScore() {
      return highScore;
    }

    public void setHighScore(double highScore) {
      this.highScore = highScore;
    }

    public double getCriticalScore() {
      return criticalScore;
    }

    public void setCriticalScore(double criticalScore) {
      this.criticalScore = criticalScore;
    }
  }

  public static class Forecast {
    private double baseConfidence = 0.9;
    private double confidenceDecay = 0.05;
    private double minConfidence = 0.5;
    private double volatilityPenaltyWeight = 0.3;
    private double baseMarginRatio = 0.1;
    private double marginVolatilityWeight = 0.3;
    private boolean clampNonNegative = true;
    private boolean calendarFactorsEnabled = false;
    private List<ExternalFactor> externalFactors = new ArrayList<>();
    private List<Double> intervalLevels = new ArrayList<>(List.of(0.8, 0.9, 0.95));

    public double getBaseConfidence() {
      return baseConfidence;
    }

    public void setBaseConfidence(double baseConfidence) {
      this.baseConfidence = baseConfidence;
    }

    public double getConfidenceDecay() {
      return confidenceDecay;
    }

    public void setConfidenceDecay(double confidenceDecay) {
      this.confidenceDecay = confidenceDecay;
    }

    public double getMinConfidence() {
      return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
      this.minConfidence = minConfidence;
    }

    public double getVolatilityPenaltyWeight() {
      return volatilityPenaltyWeight;
    }

    public void setVolatilityPenaltyWeight(double volatilityPenaltyWeight) {
      this.volatilityPenaltyWeight = volatilityPenaltyWeight;
    }

    public double getBaseMarginRatio() {
      return baseMarginRatio;
    }

    public void setBaseMarginRatio(double baseMarginRatio) {
      this.baseMarginRatio = baseMarginRatio;
    }

    public double getMarginVolatilityWeight() {
      return marginVolatilityWeight;
    }

    public void setMarginVolatilityWeight(double marginVolatilityWeight) {
      this.marginVolatilityWeight = marginVolatilityWeight;
    }

    public boolean isClampNonNegative() {
      return clampNonNegative;
    }

    public void setClampNonNegative(boolean clampNonNegative) {
      this.clampNonNegative = clampNonNegative;
    }

    public boolean isCalendarFactorsEnabled() {
      return calendarFactorsEnabled;
    }

    public void setCalendarFactorsEnabled(boolean calendarFactorsEnabled) {
      this.calendarFactorsEnabled = calendarFactorsEnabled;
    }

    public List<ExternalFactor> getExternalFactors() {
      return externalFactors;
    }

    public void setExternalFactors(List<ExternalFactor> externalFactors) {
      this.externalFactors = externalFactors;
    }

    public List<Double> getIntervalLevels() {
      return intervalLevels;
    }

    public void setIntervalLevels(List<Double> intervalLevels) {
      this.intervalLevels = intervalLevels;
    }
  }

  public static class Capacity {
    private String workloadMetric = "ticket_arrivals";
    private double averageHandleTimeMinutes = 15d;
    private double targetAnswerTimeMinutes = 3d;
    private double costPerAgentHour = 50d;
    private int defaultCurrentAgents = 10;
    private Map<String, Integer> currentAgents = new HashMap<>();
    private int maxHorizonDays = 31;

    public String getWorkloadMetric() {
      return workloadMetric;
    }

    public void setWorkloadMetric(String workloadMetric) {
      this.workloadMetric = workloadMetric;
    }

    public double getAverageHandleTimeMinutes() {
      return averageHandleTimeMinutes;
    }

    public void setAverageHandleTimeMinutes(double averageHandleTimeMinutes) {
      this.averageHandleTimeMinutes = averageHandleTimeMinutes;
    }

    public double getTargetAnswerTimeMinutes() {
      return targetAnswerTimeMinutes;
    }

    public void setTargetAnswerTimeMinutes(double targetAnswerTimeMinutes) {
      this.targetAnswerTimeMinutes = targetAnswerTimeMinutes;
    }

    public double getCostPerAgentHour() {
      return costPerAgentHour;
    }

    public void setCostPerAgentHour(double costPerAgentHour) {
      this.costPerAgentHour = costPerAgentHour;
    }

    public int getDefaultCurrentAgents() {
      return defaultCurrentAgents;
    }

    public void setDefaultCurrentAgents(int defaultCurrentAgents) {
      this.defaultCurrentAgents = defaultCurrentAgents;
    }

    public Map<String, Integer> getCurrentAgents() {
      return currentAgents;
    }

    public void setCurrentAgents(Map<String, Integer> currentAgents) {
      this.currentAgents = currentAgents;
    }

    public int getMaxHorizonDays() {
      return maxHorizonDays;
    }

    public void setMaxHorizonDays(int maxHorizonDays) {
      this.maxHorizonDays = maxHorizonDays;
    }
  }

  public static class Bulk {
    private int batchSize = 5;
    private Duration throttle = Duration.ofMillis(100);

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public Duration getThrottle() {
      return throttle;
    }

    public void setThrottle(Duration throttle) {
      this.throttle = throttle;
    }
  }

  public static class History {
    private String baseUrl = "http://history:8080";
    private Duration connectTimeout = Duration.ofSeconds(2);
    private Duration readTimeout = Duration.ofSeconds(5);

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
      return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
    }
  }
}
