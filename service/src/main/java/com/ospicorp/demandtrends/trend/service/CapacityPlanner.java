package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.CapacityRecommendation;
import com.ospicorp.demandtrends.trend.model.ForecastPoint;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Service;

/**
 * Erlang-C staffing. Blocking probabilities come from the Erlang-B recursion
 * {@code B(n) = A*B(n-1) / (n + A*B(n-1))}, which stays within [0, 1] for any offered load.
 */
@Service
public class CapacityPlanner {
  private static final double MAX_OFFERED_LOAD = 1_000_000d;

  private final TrendAnalysisProperties.Capacity settings;

  public CapacityPlanner(TrendAnalysisProperties properties) {
    this.settings = properties.getCapacity();
  }

  public record StaffingResult(int agents, double serviceLevel, boolean capped) {}

  public List<CapacityRecommendation> plan(List<ForecastPoint> forecast, Period period,
      int currentAgents, double targetServiceLevel) {
    requireTarget(targetServiceLevel);
    List<CapacityRecommendation> recommendations = new ArrayList<>(forecast.size());
    for (ForecastPoint point : forecast) {
      double workload = Math.max(0d, point.pointEstimate());
      double offeredLoad = offeredLoad(workload, period);
      StaffingResult staffing = requiredAgents(offeredLoad, targetServiceLevel);
      double costDelta = (staffing.agents() - currentAgents) * settings.getCostPerAgentHour();
      recommendations.add(new CapacityRecommendation(point.timestamp(), staffing.agents(),
          workload, offeredLoad, targetServiceLevel, staffing.serviceLevel(), costDelta,
          point.confidence(), staffing.capped(), reason(staffing, offeredLoad,
              targetServiceLevel, currentAgents)));
    }
    return recommendations;
  }

  public double offeredLoad(double arrivalsPerPeriod, Period period) {
    return arrivalsPerPeriod / period.lengthMinutes() * settings.getAverageHandleTimeMinutes();
  }

  /** Smallest agent count meeting {@code target}, searched up to {@code max(ceil(3A), ceil(A)+1)}. */
  public StaffingResult requiredAgents(double offeredLoad, double target) {
    requireTarget(target);
    if (!Double.isFinite(offeredLoad) || offeredLoad < 0d || offeredLoad > MAX_OFFERED_LOAD) {
      throw new IllegalArgumentException(
          "offered load must be within [0, " + (long) MAX_OFFERED_LOAD + "] erlangs");
    }
    if (offeredLoad == 0d) {
      return new StaffingResult(0, 1d, false);
    }
    int start = (int) Math.ceil(offeredLoad);
    int cap = Math.max((int) Math.ceil(3d * offeredLoad), start + 1);

    double blocking = 1d;
    for (int n = 1; n < start; n++) {
      blocking = erlangBStep(offeredLoad, blocking, n);
    }
    double level = 0d;
    for (int agents = start; agents <= cap; agents++) {
      blocking = erlangBStep(offeredLoad, blocking, agents);
      level = serviceLevel(offeredLoad, agents, blocking);
      if (level >= target) {
        return new StaffingResult(agents, level, false);
      }
    }
    return new StaffingResult(cap, level, true);
  }

  public double serviceLevel(double offeredLoad, int agents) {
    double blocking = 1d;
    for (int n = 1; n <= agents; n++) {
      blocking = erlangBStep(offeredLoad, blocking, n);
    }
    return serviceLevel(offeredLoad, agents, blocking);
  }

  static double erlangBStep(double offeredLoad, double previous, int n) {
    double numerator = offeredLoad * previous;
    return numerator / (n + numerator);
  }

  /** Probability of waiting; 1 when the agents cannot keep up with the load. */
  static double erlangC(double offeredLoad, int agents, double blocking) {
    if (agents <= offeredLoad) return 1d;
    return Statistics.clampUnit(
        agents * blocking / (agents - offeredLoad * (1d - blocking)));
  }

  private double serviceLevel(double offeredLoad, int agents, double blocking) {
    double waitProbability = erlangC(offeredLoad, agents, blocking);
    double decay = Math.exp(-(agents - offeredLoad) * settings.getTargetAnswerTimeMinutes()
        / settings.getAverageHandleTimeMinutes());
    return Statistics.clampUnit(1d - waitProbability * decay);
  }

  private static void requireTarget(double target) {
    if (!(target > 0d && target <= 1d)) {
      throw new IllegalArgumentException("target service level must be within (0, 1]");
    }
  }

  private static String reason(StaffingResult staffing, double offeredLoad, double target,
      int currentAgents) {
    if (staffing.capped()) {
      return String.format(Locale.ROOT,
          "Target %.0f%% not reachable within %d agents for %.2f erlangs", target * 100d,
          staffing.agents(), offeredLoad);
    }
    int delta = staffing.agents() - currentAgents;
    if (delta == 0) {
      return String.format(Locale.ROOT, "Current staffing meets %.0f%% target", target * 100d);
    }
    return String.format(Locale.ROOT, "%s %d agent(s) to meet %.0f%% target for %.2f erlangs",
        delta > 0 ? "Add" : "Release", Math.abs(delta), target * 100d, offeredLoad);
  }
}
