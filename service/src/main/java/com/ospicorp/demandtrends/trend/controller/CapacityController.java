package com.ospicorp.demandtrends.trend.controller;

import com.ospicorp.demandtrends.trend.model.CapacityRecommendation;
import com.ospicorp.demandtrends.trend.service.TrendAnalysisOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/capacity")
@Validated
@Tag(name = "Capacity")
public class CapacityController {

  private final TrendAnalysisOrchestrator orchestrator;

  public CapacityController(TrendAnalysisOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping("/{entityType}/plan")
  @Operation(summary = "Plan staffing",
      description = "Hourly Erlang-C agent recommendations over the forecast horizon.")
  public List<CapacityRecommendation> plan(
      @PathVariable @Pattern(regexp = TrendController.IDENTIFIER_REGEX)
      @Parameter(description = "Entity type", example = "queue") String entityType,
      @RequestParam(name = "entity_id", required = false)
      @Parameter(description = "Entity identifier") String entityId,
      @RequestParam(name = "horizon_days", defaultValue = "7")
      @Parameter(description = "Days to plan", example = "7") int horizonDays,
      @RequestParam(name = "target_service_level", defaultValue = "0.8")
      @Parameter(description = "Share of contacts answered within the target time",
          example = "0.8") double targetServiceLevel) {
    TrendController.validateEntityId(entityId);
    if (horizonDays < 1) {
      throw TrendController.invalidParameter("horizon_days",
          "Invalid horizon_days. Must be at least 1.", 2004);
    }
    if (!(targetServiceLevel > 0d && targetServiceLevel <= 1d)) {
      throw TrendController.invalidParameter("target_service_level",
          "Invalid target_service_level. Supported range: (0, 1].", 2005);
    }
    return orchestrator.planCapacity(entityType, entityId, horizonDays, targetServiceLevel);
  }
}
