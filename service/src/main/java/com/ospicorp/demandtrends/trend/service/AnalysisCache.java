package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.trend.model.AnalysisKey;
import com.ospicorp.demandtrends.trend.model.TrendAnalysisResult;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Last write wins; an entry is served only while the clock is before its expiry. */
@Component
public class AnalysisCache {

  private final Map<AnalysisKey, TrendAnalysisResult> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public AnalysisCache(Clock clock) {
    this.clock = clock;
  }

  public Optional<TrendAnalysisResult> get(AnalysisKey key) {
    TrendAnalysisResult cached = entries.get(key);
    if (cached == null) {
      return Optional.empty();
    }
    if (cached.isExpiredAt(clock.instant())) {
      entries.remove(key, cached);
      return Optional.empty();
    }
    return Optional.of(cached);
  }

  public void put(AnalysisKey key, TrendAnalysisResult result) {
    entries.put(key, result);
  }

  public void invalidate(AnalysisKey key) {
    entries.remove(key);
  }

  public int size() {
    return entries.size();
  }
}
