package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.config.TrendAnalysisProperties;
import com.ospicorp.demandtrends.trend.model.AnalysisRequest;
import com.ospicorp.demandtrends.trend.model.AnomalyPoint;
import com.ospicorp.demandtrends.trend.model.CapacityRecommendation;
import com.ospicorp.demandtrends.trend.model.ChangePoint;
import com.ospicorp.demandtrends.trend.model.CompareRequest;
import com.ospicorp.demandtrends.trend.model.ComparisonResult;
import com.ospicorp.demandtrends.trend.model.ForecastPoint;
import com.ospicorp.demandtrends.trend.model.OutlierPoint;
import com.ospicorp.demandtrends.trend.model.Sample;
import com.ospicorp.demandtrends.trend.model.SeasonalPattern;
import com.ospicorp.demandtrends.trend.model.SeriesSummary;
import com.ospicorp.demandtrends.trend.model.SeriesSummary.HalfStats;
import com.ospicorp.demandtrends.trend.model.TimeWindow;
import com.ospicorp.demandtrends.trend.model.TrendAnalysisResult;
import com.ospicorp.demandtrends.trend.model.TrendComponent;
import com.ospicorp.demandtrends.trend.model.TrendInsight;
import com.ospicorp.demandtrends.trend.model.TrendRecommendation;
import com.ospicorp.demandtrends.trend.model.enums.AnalysisDepth;
import com.ospicorp.demandtrends.trend.model.enums.AnalysisStage;
import com.ospicorp.demandtrends.trend.model.enums.AnomalyWindow;
import com.ospicorp.demandtrends.trend.model.enums.ComponentKind;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import com.ospicorp.demandtrends.trend.model.enums.TrendDirection;
import com.ospicorp.demandtrends.trend.repository.AgentRoster;
import com.ospicorp.demandtrends.trend.repository.TimeSeriesRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the analysis pipeline (fetch, decompose, change points, seasonality, outliers, forecast)
 * for one metric and caches the assembled result until its period-specific expiry.
 */
@Service
public class TrendAnalysisOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(TrendAnalysisOrchestrator.class);

  private final TimeSeriesRepository repository;
  private final AgentRoster agentRoster;
  private final TrendDecomposer decomposer;
  private final ChangePointDetector changePointDetector;
  private final SeasonalityDetector seasonalityDetector;
  private final OutlierScanner outlierScanner;
  private final Forecaster forecaster;
  private final AnomalyDetector anomalyDetector;
  private final CapacityPlanner capacityPlanner;
  private final InsightGenerator insightGenerator;
  private final EntityComparator entityComparator;
  private final AnalysisCache cache;
  private final TrendAnalysisProperties properties;
  private final Clock clock;
  private final Executor bulkExecutor;

  public TrendAnalysisOrchestrator(TimeSeriesRepository repository, AgentRoster agentRoster,
      TrendDecomposer decomposer, ChangePointDetector changePointDetector,
      SeasonalityDetector seasonalityDetector, OutlierScanner outlierScanner,
      Forecaster forecaster, AnomalyDetector anomalyDetector, CapacityPlanner capacityPlanner,
      InsightGenerator insightGenerator, EntityComparator entityComparator, AnalysisCache cache, TrendAnalysisProperties properties,
      Clock clock, @Qualifier("bulkAnalysisExecutor") Executor bulkExecutor) {
    this.repository = repository;
    this.agentRoster = agentRoster;
    this.decomposer = decomposer;
    this.changePointDetector = changePointDetector;
    this.seasonalityDetector = seasonalityDetector;
    this.outlierScanner = outlierScanner;
    this.forecaster = forecaster;
    this.anomalyDetector = anomalyDetector;
    this.capacityPlanner = capacityPlanner;
    this.insightGenerator = insightGenerator;
    this.entityComparator = entityComparator;
    this.cache = cache;
    this.properties = properties;
    this.clock = clock;
    this.bulkExecutor = bulkExecutor;
  }

  public TrendAnalysisResult analyze(String entityType, String entityId, String metricName,
      Period period, AnalysisDepth depth) {
    return analyze(new AnalysisRequest(entityType, entityId, metricName, period, depth));
  }

  public TrendAnalysisResult analyze(AnalysisRequest request) {
    Optional<TrendAnalysisResult> cached = cache.get(request.key());
    if (cached.isPresent()) {
      log.debug("Serving cached analysis {} for {}", cached.get().analysisId(), request.key());
      return cached.get();
    }
    TrendAnalysisResult result = runPipeline(request, clock.instant(),
        properties.getAnalysis().getForecastHorizon());
    cache.put(request.key(), result);
    log.debug("Analysis {} {} -> {}", request.key(), AnalysisStage.ASSEMBLING, AnalysisStage.CACHED);
    return result;
  }

  /**
   * Analyses requests in batches; each batch runs in parallel and batches are separated by the
   * configured throttle. Failed requests are logged and left out of the result.
   */
  public List<TrendAnalysisResult> analyzeBulk(List<AnalysisRequest> requests) {
    int batchSize = Math.max(1, properties.getBulk().getBatchSize());
    long throttleMillis = properties.getBulk().getThrottle().toMillis();
    List<TrendAnalysisResult> results = new ArrayList<>(requests.size());

    for (int from = 0; from < requests.size(); from += batchSize) {
      List<AnalysisRequest> batch = requests.subList(from, Math.min(from + batchSize,
          requests.size()));
      List<CompletableFuture<Optional<TrendAnalysisResult>>> futures = batch.stream()
          .map(request -> CompletableFuture.supplyAsync(() -> analyzeQuietly(request),
              bulkExecutor))
          .toList();
      for (CompletableFuture<Optional<TrendAnalysisResult>> future : futures) {
        future.join().ifPresent(results::add);
      }

      boolean more = from + batchSize < requests.size();
      if (more && throttleMillis > 0) {
        try {
          Thread.sleep(throttleMillis);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          log.warn("Bulk analysis interrupted after {} of {} requests", from + batch.size(),
              requests.size());
          break;
        }
      }
    }
    log.info("Bulk analysis completed {} of {} requests", results.size(), requests.size());
    return results;
  }

  public ComparisonResult compareEntities(CompareRequest request) {
    Map<String, Map<String, TrendAnalysisResult>> analyses = new LinkedHashMap<>();
    List<String> failures = new ArrayList<>();
    for (String entityId : request.entityIds()) {
      for (String metric : request.metricNames()) {
        try {
          TrendAnalysisResult result = analyze(new AnalysisRequest(request.entityType(), entityId,
              metric, request.period(), AnalysisDepth.ADVANCED));
          analyses.computeIfAbsent(entityId, id -> new LinkedHashMap<>()).put(metric, result);
        } catch (RuntimeException ex) {
          log.warn("Comparison skipped {}/{} {}: {}", request.entityType(), entityId, metric,
              ex.getMessage());
          failures.add(entityId + "/" + metric + ": " + ex.getMessage());
        }
      }
    }
    return entityComparator.compare(request, analyses, failures);
  }

  /**
   * Staffing per forecast hour from a fresh hourly analysis of the workload metric. The result
   * bypasses the cache because its forecast horizon depends on {@code horizonDays}.
   */
  public List<CapacityRecommendation> planCapacity(String entityType, String entityId,
      int horizonDays, double targetServiceLevel) {
    int maxDays = properties.getCapacity().getMaxHorizonDays();
    if (horizonDays < 1 || horizonDays > maxDays) {
      throw new IllegalArgumentException("horizon_days must be within 1-" + maxDays);
    }
    if (!(targetServiceLevel > 0d && targetServiceLevel <= 1d)) {
      throw new IllegalArgumentException("target_service_level must be within (0, 1]");
    }
    AnalysisRequest request = new AnalysisRequest(entityType, entityId,
        properties.getCapacity().getWorkloadMetric(), Period.HOURLY, AnalysisDepth.ADVANCED);
    TrendAnalysisResult analysis = runPipeline(request, clock.instant(), horizonDays * 24);
    int currentAgents = agentRoster.currentAgentCount(request.entity());
    List<CapacityRecommendation> plan = capacityPlanner.plan(analysis.forecast(), Period.HOURLY,
        currentAgents, targetServiceLevel);
    log.info("Capacity plan for {}: {} hours, current agents {}, peak recommendation {}",
        request.entity(), plan.size(), currentAgents,
        plan.stream().mapToInt(CapacityRecommendation::recommendedAgents).max().orElse(0));
    return plan;
  }

  /**
   * Fits the pipeline on the history that ends where {@code window} begins, then checks the
   * samples inside the window against the forecast made for them. Not cached.
   */
  public List<AnomalyPoint> detectAnomalies(String entityType, String entityId,
      String metricName, AnomalyWindow window) {
    Period period = window.period();
    Instant now = clock.instant();
    Instant cutoff = now.minus(period.length().multipliedBy(window.periods()));
    AnalysisRequest request = new AnalysisRequest(entityType, entityId, metricName, period,
        AnalysisDepth.ADVANCED);
    TrendAnalysisResult baseline = runPipeline(request, cutoff, window.periods());

    List<Sample> recent = Sample.requireStrictlyAscending(repository.fetchHistory(entityType,
        entityId, metricName, TimeWindow.ending(now, period, window.periods())));
    List<AnomalyPoint> anomalies = anomalyDetector.detect(recent, baseline.forecast(), period);
    log.info("Anomaly check {} over {}: {} of {} samples outside the forecast band",
        request.key(), window, anomalies.size(), recent.size());
    return anomalies;
  }

  private Optional<TrendAnalysisResult> analyzeQuietly(AnalysisRequest request) {
    if (request == null) {
      log.warn("Bulk analysis skipped a null request");
      return Optional.empty();
    }
    try {
      return Optional.of(analyze(request));
    } catch (RuntimeException ex) {
      log.warn("Bulk analysis skipped {}: {}", request.key(), ex.getMessage());
      return Optional.empty();
    }
  }

  private TrendAnalysisResult runPipeline(AnalysisRequest request, Instant end, int horizon) {
    AnalysisStage stage = advance(request, AnalysisStage.IDLE, AnalysisStage.FETCHING);
    try {
      Instant now = clock.instant();
      Period period = request.period();
      TimeWindow window = TimeWindow.ending(end, period,
          properties.getAnalysis().windowPeriodsFor(period, request.depth()));
      List<Sample> samples = Sample.requireStrictlyAscending(repository.fetchHistory(
          request.entityType(), request.entityId(), request.metricName(), window));
      window = window.withObserved(samples.size());

      stage = advance(request, stage, AnalysisStage.DECOMPOSING);
      TrendDecomposition decomposition = decomposer.decompose(samples, period);

      stage = advance(request, stage, AnalysisStage.DETECTING_CHANGES);
      List<ChangePoint> changePoints = changePointDetector.detect(samples);

      stage = advance(request, stage, AnalysisStage.DETECTING_SEASONALITY);
      List<SeasonalPattern> patterns = seasonalityDetector.detect(samples, period);

      stage = advance(request, stage, AnalysisStage.SCANNING_OUTLIERS);
      List<OutlierPoint> outliers = outlierScanner.scan(samples, decomposition);

      stage = advance(request, stage, AnalysisStage.FORECASTING);
      List<ForecastPoint> forecast = forecaster.forecast(decomposition, patterns, period, horizon,
          samples.get(samples.size() - 1).timestamp());

      stage = advance(request, stage, AnalysisStage.ASSEMBLING);
      return assemble(request, now, window, samples, decomposition, changePoints, patterns,
          outliers, forecast);
    } catch (TrendAnalysisException ex) {
      advance(request, stage, AnalysisStage.FAILED);
      log.error("Analysis {} failed in stage {}: {}", request.key(), ex.stage(), ex.getMessage());
      throw ex;
    } catch (RuntimeException ex) {
      advance(request, stage, AnalysisStage.FAILED);
      log.error("Analysis {} failed in stage {}", request.key(), stage, ex);
      throw new TrendAnalysisException(stage, "Analysis of " + request.key().metricName()
          + " failed in stage " + stage + ": " + ex.getMessage(), ex);
    }
  }

  private TrendAnalysisResult assemble(AnalysisRequest request, Instant now, TimeWindow window,
      List<Sample> samples, TrendDecomposition decomposition, List<ChangePoint> changePoints,
      List<SeasonalPattern> patterns, List<OutlierPoint> outliers, List<ForecastPoint> forecast) {
    List<TrendComponent> components = decomposition.components();
    int n = samples.size();

    double strength = Statistics.mean(components.stream()
        .filter(c -> c.kind() != ComponentKind.NOISE)
        .map(TrendComponent::strength)
        .toList());
    double significance = decomposition.component(ComponentKind.LINEAR)
        .map(c -> Math.min(0.99, c.rSquared() * Math.sqrt(n / 30d)))
        .orElse(0.5);
    double meanRSquared = Statistics.mean(components.stream()
        .map(TrendComponent::rSquared)
        .toList());
    double confidence = Math.min(0.95, meanRSquared + Math.min(0.2, n / 100d))
        * window.completenessRatio();
    TrendDirection direction = direction(decomposition, patterns);

    List<TrendInsight> insights = insightGenerator.insights(request.metricName(), components,
        changePoints, patterns, outliers);
    List<TrendRecommendation> recommendations = insightGenerator.recommendations(
        request.metricName(), direction, strength, insights);

    return new TrendAnalysisResult(UUID.randomUUID().toString(), request.entityType(),
        request.entityId(), request.metricName(), request.period(), request.depth(), window,
        direction, strength, significance, Statistics.clampUnit(confidence), components,
        changePoints, patterns, outliers, forecast, insights, recommendations,
        summarize(samples), now,
        now.plus(properties.getAnalysis().cacheExpiryFor(request.period())));
  }

  static TrendDirection direction(TrendDecomposition decomposition,
      List<SeasonalPattern> patterns) {
    boolean seasonal = !patterns.isEmpty();
    TrendDirection flat = seasonal ? TrendDirection.SEASONAL : TrendDirection.STABLE;
    if (decomposition.component(ComponentKind.LINEAR).isEmpty()) {
      return flat;
    }
    double growth = decomposition.growthRatePerPeriod();
    if (Math.abs(growth) < 0.01 * Math.abs(decomposition.mean())) {
      return flat;
    }
    double seasonalStrength = decomposition.component(ComponentKind.SEASONAL)
        .map(TrendComponent::strength)
        .orElse(0d);
    if (seasonal && seasonalStrength > 0.3) {
      return growth > 0 ? TrendDirection.TRENDING_UP_WITH_SEASONALITY
          : TrendDirection.TRENDING_DOWN_WITH_SEASONALITY;
    }
    if (decomposition.volatility() > 0.5) {
      return TrendDirection.VOLATILE;
    }
    return growth > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
  }

  static SeriesSummary summarize(List<Sample> samples) {
    double[] values = samples.stream().mapToDouble(Sample::value).toArray();
    int n = values.length;
    int mid = n / 2;
    double min = n == 0 ? 0d : Double.MAX_VALUE;
    double max = n == 0 ? 0d : -Double.MAX_VALUE;
    for (double v : values) {
      min = Math.min(min, v);
      max = Math.max(max, v);
    }
    return new SeriesSummary(n, Statistics.mean(values), Statistics.stdDev(values), min, max,
        n == 0 ? 0d : values[n - 1],
        new HalfStats(mid, Statistics.mean(values, 0, mid),
            Statistics.sampleVariance(values, 0, mid)),
        new HalfStats(n - mid, Statistics.mean(values, mid, n),
            Statistics.sampleVariance(values, mid, n)));
  }

  private AnalysisStage advance(AnalysisRequest request, AnalysisStage from, AnalysisStage to) {
    log.debug("Analysis {} {} -> {}", request.key(), from, to);
    return to;
  }
}
