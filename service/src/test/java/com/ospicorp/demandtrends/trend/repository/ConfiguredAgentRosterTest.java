package com.ospicorp.demandtrends.trend.repository;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.EntityRef;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfiguredAgentRosterTest {

  @Test
  void exactEntityThenTypeThenDefault() {
    TrendAnalysisProperties properties = new TrendAnalysisProperties();
    properties.getCapacity().setCurrentAgents(Map.of("queue/q1", 25, "queue", 12));
    properties.getCapacity().setDefaultCurrentAgents(4);
    ConfiguredAgentRoster roster = new ConfiguredAgentRoster(properties);

    assertEquals(25, roster.currentAgentCount(new EntityRef("queue", "q1")));
    assertEquals(12, roster.currentAgentCount(new EntityRef("queue", "q2")));
    assertEquals(12, roster.currentAgentCount(EntityRef.of("queue")));
    assertEquals(4, roster.currentAgentCount(new EntityRef("team", "t1")));
  }
}
