package com.ospicorp.demandtrends.trend.repository;

import com.ospicorp.demandtrends.trend.model.EntityRef;

public interface AgentRoster {

  int currentAgentCount(EntityRef entity);
}
