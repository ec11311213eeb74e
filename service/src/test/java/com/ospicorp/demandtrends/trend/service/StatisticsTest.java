package com.ospicorp.demandtrends.trend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class StatisticsTest {

  @Test
  void populationStdDev() {
    double[] values = {2, 4, 4, 4, 5, 5, 7, 9};
    assertThat(Statistics.mean(values)).isEqualTo(5d);
    assertThat(Statistics.stdDev(values)).isEqualTo(2d);
  }

  @Test
  void emptyInputsYieldZero() {
    assertThat(Statistics.mean(new double[0])).isZero();
    assertThat(Statistics.mean(List.of())).isZero();
    assertThat(Statistics.stdDev(new double[] {3})).isZero();
    assertThat(Statistics.sampleVariance(new double[] {3}, 0, 1)).isZero();
    assertThat(Statistics.median(new double[0], 0, 0)).isZero();
  }

  @Test
  void medianAndMad() {
    double[] odd = {9, 1, 4, 2, 6, 2, 1};
    assertThat(Statistics.median(odd, 0, odd.length)).isEqualTo(2d);
    assertThat(Statistics.mad(odd, 0, odd.length)).isEqualTo(1d);
    assertThat(Statistics.median(new double[] {1, 2, 3, 10}, 0, 4)).isEqualTo(2.5);
  }

  @Test
  void sampleVarianceUsesBesselCorrection() {
    assertThat(Statistics.sampleVariance(new double[] {1, 2, 3, 4}, 0, 4))
        .isCloseTo(1.6667, within(1e-4));
  }

  @Test
  void coefficientOfVariationGuardsZeroMean() {
    assertThat(Statistics.coefficientOfVariation(new double[] {-1, 1})).isZero();
    assertThat(Statistics.coefficientOfVariation(new double[] {90, 110})).isCloseTo(0.1,
        within(1e-12));
  }

  @Test
  void normalCdf() {
    assertThat(Statistics.normalCdf(0)).isCloseTo(0.5, within(1e-7));
    assertThat(Statistics.normalCdf(1.96)).isCloseTo(0.975, within(1e-4));
    assertThat(Statistics.normalCdf(-1.96)).isCloseTo(0.025, within(1e-4));
  }

  @Test
  void clampUnit() {
    assertThat(Statistics.clampUnit(-0.2)).isZero();
    assertThat(Statistics.clampUnit(1.3)).isEqualTo(1d);
    assertThat(Statistics.clampUnit(Double.NaN)).isZero();
  }
}
