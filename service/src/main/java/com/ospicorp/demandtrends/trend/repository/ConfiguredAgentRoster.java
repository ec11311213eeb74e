package com.ospicorp.demandtrends.trend.repository;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.EntityRef;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Agent counts from {@code trends.capacity.current-agents}, keyed by {@code type/id} or by
 * {@code type}; unknown entities get the configured default.
 */
@Component
public class ConfiguredAgentRoster implements AgentRoster {

  private final Map<String, Integer> counts;
  private final int defaultCount;

  public ConfiguredAgentRoster(TrendAnalysisProperties properties) {
    this.counts = Map.copyOf(properties.getCapacity().getCurrentAgents());
    this.defaultCount = properties.getCapacity().getDefaultCurrentAgents();
  }

  @Override
  public int currentAgentCount(EntityRef entity) {
    Integer exact = counts.get(entity.toString());
    if (exact != null) {
      return exact;
    }
    return counts.getOrDefault(entity.entityType(), defaultCount);
  }
}
