package com.ospicorp.demandtrends.support;

import com.ospicorp.demandtrends.trend.model.SeriesSummary;
import com.ospicorp.demandtrends.trend.model.SeriesSummary.HalfStats;
import com.ospicorp.demandtrends.trend.model.TimeWindow;
import com.ospicorp.demandtrends.trend.model.TrendAnalysisResult;
import com.ospicorp.demandtrends.trend.model.enums.AnalysisDepth;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import com.ospicorp.demandtrends.trend.model.enums.TrendDirection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Minimal analysis results for tests that only look at a few fields. */
public final class TrendResults {

  private TrendResults() {
  }

  public static TrendAnalysisResult expiringAt(String entityId, Instant createdAt,
      Duration ttl) {
    return result("queue", entityId, "ticket_arrivals", TrendDirection.STABLE,
        new SeriesSummary(10, 100d, 0d, 100d, 100d, 100d, new HalfStats(5, 100d, 0d),
            new HalfStats(5, 100d, 0d)), createdAt, createdAt.plus(ttl));
  }

  public static TrendAnalysisResult withHalves(String entityId, String metricName,
      TrendDirection direction, HalfStats earlier, HalfStats later) {
    Instant now = Instant.parse("2024-03-01T00:00:00Z");
    int count = earlier.count() + later.count();
    double mean = (earlier.mean() * earlier.count() + later.mean() * later.count()) / count;
    return result("queue", entityId, metricName, direction,
        new SeriesSummary(count, mean, 0d, 0d, 0d, later.mean(), earlier, later), now,
        now.plus(Duration.ofHours(6)));
  }

  private static TrendAnalysisResult result(String entityType, String entityId,
      String metricName, TrendDirection direction, SeriesSummary summary, Instant createdAt,
      Instant expiresAt) {
    TimeWindow window = TimeWindow.ending(createdAt, Period.DAILY, 30).withObserved(30);
    return new TrendAnalysisResult("analysis-" + entityId, entityType, entityId, metricName,
        Period.DAILY, AnalysisDepth.ADVANCED, window, direction, 0.5, 0.5, 0.5, List.of(),
        List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), summary, createdAt,
        expiresAt);
  }
}
