package com.ospicorp.demandtrends.trend.controller;

import com.ospicorp.demandtrends.trend.model.AnalysisRequest;
import com.ospicorp.demandtrends.trend.model.AnomalyPoint;
import com.ospicorp.demandtrends.trend.model.CompareRequest;
import com.ospicorp.demandtrends.trend.model.ComparisonResult;
import com.ospicorp.demandtrends.trend.model.TrendAnalysisResult;
import com.ospicorp.demandtrends.trend.model.enums.AnalysisDepth;
import com.ospicorp.demandtrends.trend.model.enums.AnomalyWindow;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import com.ospicorp.demandtrends.trend.service.TrendAnalysisOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import java.util.Locale;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/trends")
@Validated
@Tag(name = "Trends")
public class TrendController {
  static final String IDENTIFIER_REGEX = "^[A-Za-z0-9_.-]{1,64}$";
  private static final int MAX_BULK_REQUESTS = 100;

  private final TrendAnalysisOrchestrator orchestrator;

  public TrendController(TrendAnalysisOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping("/{entityType}/{metric}")
  @Operation(summary = "Analyze a metric",
      description = "Decompose, detect seasonality, change points and outliers, and forecast one metric.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Trend analysis",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = TrendAnalysisResult.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "Not enough history for the period",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "502", description = "History store unavailable",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public TrendAnalysisResult analyze(
      @PathVariable @Pattern(regexp = IDENTIFIER_REGEX)
      @Parameter(description = "Entity type", example = "queue") String entityType,
      @PathVariable @Pattern(regexp = IDENTIFIER_REGEX)
      @Parameter(description = "Metric name", example = "ticket_arrivals") String metric,
      @RequestParam(name = "entity_id", required = false)
      @Parameter(description = "Entity identifier; omit for the aggregate") String entityId,
      @RequestParam(defaultValue = "daily")
      @Parameter(description = "Sampling period", example = "daily") String period,
      @RequestParam(defaultValue = "advanced")
      @Parameter(description = "Analysis depth", example = "advanced") String depth) {
    validateEntityId(entityId);
    return orchestrator.analyze(new AnalysisRequest(entityType, entityId, metric,
        parsePeriod(period), parseDepth(depth)));
  }

  @GetMapping("/{entityType}/{metric}/anomalies")
  @Operation(summary = "Detect anomalies",
      description = "Checks the recent window against a forecast fitted on the history before it.")
  public List<AnomalyPoint> anomalies(
      @PathVariable @Pattern(regexp = IDENTIFIER_REGEX) String entityType,
      @PathVariable @Pattern(regexp = IDENTIFIER_REGEX) String metric,
      @RequestParam(name = "entity_id", required = false) String entityId,
      @RequestParam(defaultValue = "last_24h")
      @Parameter(description = "Recent window", example = "last_24h") String window) {
    validateEntityId(entityId);
    return orchestrator.detectAnomalies(entityType, entityId, metric, parseWindow(window));
  }

  @PostMapping("/bulk")
  @Operation(summary = "Analyze several metrics",
      description = "Runs analyses in throttled batches; failed requests are left out of the response.")
  public List<TrendAnalysisResult> bulk(@RequestBody List<AnalysisRequest> requests) {
    if (requests == null || requests.isEmpty() || requests.size() > MAX_BULK_REQUESTS) {
      throw invalidParameter("requests",
          "Bulk requests must contain 1-" + MAX_BULK_REQUESTS + " entries.", 2003);
    }
    for (AnalysisRequest request : requests) {
      if (request == null) {
        throw invalidParameter("requests", "Bulk requests must not contain null entries.", 2003);
      }
      validateEntityId(request.entityId());
    }
    return orchestrator.analyzeBulk(requests);
  }

  @PostMapping("/compare")
  @Operation(summary = "Compare entities",
      description = "Compares the earlier and later halves of each entity's window per metric.")
  public ComparisonResult compare(@RequestBody CompareRequest request) {
    request.entityIds().forEach(TrendController::validateEntityId);
    return orchestrator.compareEntities(request);
  }

  static Period parsePeriod(String value) {
    try {
      return Period.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("period",
          "Invalid period. Supported values: hourly,daily,weekly,monthly,quarterly.", 2001);
    }
  }

  static AnalysisDepth parseDepth(String value) {
    try {
      return AnalysisDepth.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("depth",
          "Invalid depth. Supported values: basic,advanced,comprehensive.", 2002);
    }
  }

  static AnomalyWindow parseWindow(String value) {
    try {
      return AnomalyWindow.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("window",
          "Invalid window. Supported values: last_24h,last_week,last_month.", 2007);
    }
  }

  static void validateEntityId(String entityId) {
    if (entityId != null && !entityId.matches(IDENTIFIER_REGEX)) {
      throw invalidParameter("entity_id",
          "Invalid entity_id. Use 1-64 characters from [A-Za-z0-9_.-].", 2006);
    }
  }

  static InvalidParameterException invalidParameter(String parameter, String message,
      int errorCode) {
    return new InvalidParameterException(parameter, errorCode, message);
  }
}
