package com.ospicorp.demandtrends.trend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.CapacityRecommendation;
import com.ospicorp.demandtrends.trend.model.ForecastPoint;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import com.ospicorp.demandtrends.trend.service.CapacityPlanner.StaffingResult;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CapacityPlannerTest {

  private final CapacityPlanner planner = new CapacityPlanner(new TrendAnalysisProperties());

  private static ForecastPoint hourlyPoint(int k, double estimate) {
    return new ForecastPoint(Instant.parse("2024-03-01T00:00:00Z").plusSeconds(3600L * k), k,
        estimate, estimate, estimate, 0.8, estimate, 0d, 0d, List.of(), Map.of());
  }

  @Test
  void fiveErlangsAtEightyPercentNeedEightAgents() {
    StaffingResult result = planner.requiredAgents(5d, 0.8);

    assertThat(result.agents()).isEqualTo(8);
    assertThat(result.serviceLevel()).isCloseTo(0.9082, within(1e-4));
    assertThat(result.capped()).isFalse();
    assertThat(planner.serviceLevel(5d, 7)).isLessThan(0.8);
  }

  @ParameterizedTest
  @CsvSource({"0.5,6", "0.6,7", "0.7,7", "0.8,8", "0.9,8", "0.95,9", "0.99,11"})
  void agentsGrowWithTarget(double target, int expected) {
    assertThat(planner.requiredAgents(5d, target).agents()).isEqualTo(expected);
  }

  @Test
  void zeroLoadNeedsNobody() {
    StaffingResult result = planner.requiredAgents(0d, 0.8);

    assertThat(result.agents()).isZero();
    assertThat(result.serviceLevel()).isEqualTo(1d);
  }

  @Test
  void unreachableTargetIsCapped() {
    StaffingResult result = planner.requiredAgents(1d, 0.999999);

    assertThat(result.capped()).isTrue();
    assertThat(result.agents()).isEqualTo(3);
    assertThat(result.serviceLevel()).isCloseTo(0.939, within(1e-3));
  }

  @Test
  void largeLoadsStayFinite() {
    StaffingResult result = planner.requiredAgents(5000d, 0.9);

    assertThat(result.agents()).isEqualTo(5011);
    assertThat(result.serviceLevel()).isBetween(0.9, 1d);
  }

  @Test
  void rejectsInvalidInputs() {
    assertThatThrownBy(() -> planner.requiredAgents(5d, 0d))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> planner.requiredAgents(5d, 1.5))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> planner.requiredAgents(-1d, 0.8))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> planner.requiredAgents(Double.NaN, 0.8))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void erlangBlockingStaysWithinUnitInterval() {
    double blocking = 1d;
    for (int n = 1; n <= 50; n++) {
      blocking = CapacityPlanner.erlangBStep(40d, blocking, n);
      assertThat(blocking).isBetween(0d, 1d);
    }
    assertThat(CapacityPlanner.erlangC(40d, 40, blocking)).isEqualTo(1d);
  }

  @Test
  void offeredLoadUsesHandleTime() {
    assertThat(planner.offeredLoad(60d, Period.HOURLY)).isCloseTo(15d, within(1e-9));
    assertThat(planner.offeredLoad(96d, Period.DAILY)).isCloseTo(1d, within(1e-9));
  }

  @Test
  void planPricesDifferenceToCurrentStaff() {
    List<CapacityRecommendation> plan = planner.plan(
        List.of(hourlyPoint(1, 60d), hourlyPoint(2, 0d)), Period.HOURLY, 10, 0.8);

    CapacityRecommendation busy = plan.get(0);
    assertThat(busy.recommendedAgents()).isEqualTo(18);
    assertThat(busy.offeredLoad()).isCloseTo(15d, within(1e-9));
    assertThat(busy.costDelta()).isCloseTo(400d, within(1e-9));
    assertThat(busy.confidence()).isEqualTo(0.8);
    assertThat(busy.reason()).startsWith("Add 8 agent(s)");

    CapacityRecommendation idle = plan.get(1);
    assertThat(idle.recommendedAgents()).isZero();
    assertThat(idle.costDelta()).isCloseTo(-500d, within(1e-9));
    assertThat(idle.reason()).startsWith("Release 10 agent(s)");
  }

  @Test
  void planReportsCurrentStaffingWhenSufficient() {
    List<CapacityRecommendation> plan = planner.plan(List.of(hourlyPoint(1, 20d)),
        Period.HOURLY, 8, 0.8);

    assertThat(plan.get(0).recommendedAgents()).isEqualTo(8);
    assertThat(plan.get(0).reason()).isEqualTo("Current staffing meets 80% target");
  }
}
