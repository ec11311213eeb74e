package com.ospicorp.demandtrends.trend.service;

import com.ospicorp.demandtrends.trend.model.AnomalyPoint;
import com.ospicorp.demandtrends.trend.model.ForecastPoint;
import com.ospicorp.demandtrends.trend.model.ProbableCause;
import com.ospicorp.demandtrends.trend.model.Sample;
import com.ospicorp.demandtrends.trend.model.enums.CauseType;
import com.ospicorp.demandtrends.trend.model.enums.ChangeDirection;
import com.ospicorp.demandtrends.trend.model.enums.OutlierKind;
import com.ospicorp.demandtrends.trend.model.enums.Period;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Compares observed samples with the forecast made for their timestamps. A sample is anomalous
 * when its distance from the point estimate exceeds the forecast's upper margin.
 */
@Service
public class AnomalyDetector {
  private static final double FALLBACK_LIKELIHOOD = 0.5;

  private final ProbableCauseLookup causeLookup;

  public AnomalyDetector(ProbableCauseLookup causeLookup) {
    this.causeLookup = causeLookup;
  }

  public List<AnomalyPoint> detect(List<Sample> actuals, List<ForecastPoint> forecast,
      Period period) {
    List<AnomalyPoint> anomalies = new ArrayList<>();
    if (forecast.isEmpty()) return anomalies;

    long step = period.length().toMillis();
    Instant origin = forecast.get(0).timestamp().minus(period.length());
    for (Sample actual : actuals) {
      long ahead = Math.round(
          Duration.between(origin, actual.timestamp()).toMillis() / (double) step);
      if (ahead < 1 || ahead > forecast.size()) {
        continue;
      }
      ForecastPoint predicted = forecast.get((int) ahead - 1);
      double deviation = Math.abs(actual.value() - predicted.pointEstimate());
      double threshold = predicted.upperBound() - predicted.pointEstimate();
      if (deviation <= threshold || deviation <= Statistics.EPSILON) {
        continue;
      }
      OutlierKind kind = actual.value() > predicted.pointEstimate()
          ? OutlierKind.SPIKE
          : OutlierKind.DROP;
      anomalies.add(new AnomalyPoint(actual.timestamp(), actual.value(),
          predicted.pointEstimate(), deviation / Math.max(threshold, Statistics.EPSILON), kind,
          predicted.confidence(), causesFor(actual.timestamp(), kind)));
    }
    return anomalies;
  }

  private List<ProbableCause> causesFor(Instant timestamp, OutlierKind kind) {
    List<ProbableCause> causes = causeLookup.causesFor(timestamp,
        kind == OutlierKind.SPIKE ? ChangeDirection.INCREASE : ChangeDirection.DECREASE);
    if (!causes.isEmpty()) {
      return causes;
    }
    return kind == OutlierKind.SPIKE
        ? List.of(new ProbableCause(CauseType.EXTERNAL_EVENT,
            "Demand above the forecast band; check for incidents or unplanned events",
            FALLBACK_LIKELIHOOD))
        : List.of(new ProbableCause(CauseType.SYSTEM_CHANGE,
            "Demand below the forecast band; check intake channels for outages",
            FALLBACK_LIKELIHOOD));
  }
}
