/*
 * どこで: 実験のモデル
 * 何を: 実験バリアント 1 つ分の集計済み結果カウンタ
 * なぜ: 比率は常にカウンタから導出し、ずれが生じないようにするため
 */
package com.example.delivery.model;

import java.util.UUID;

public record VariantOutcomeAggregate(
    UUID experimentId,
    ExperimentVariant variant,
    long sent,
    long delivered,
    long opened,
    long clicked,
    long responded,
    long converted,
    long bounced) {

  public VariantOutcomeAggregate {
    if (sent < 0 || delivered < 0 || opened < 0 || clicked < 0 || responded < 0
        || converted < 0 || bounced < 0) {
      throw new IllegalArgumentException("outcome counters must be non-negative");
    }
  }

  public static VariantOutcomeAggregate empty(UUID experimentId, ExperimentVariant variant) {
    return new VariantOutcomeAggregate(experimentId, variant, 0, 0, 0, 0, 0, 0, 0);
  }

  /** 送信数に対する指標の比率。未送信なら 0。 */
  public double rate(OutcomeMetric metric) {
    if (sent == 0) {
      return 0.0d;
    }
    return (double) metric.numerator(this) / sent;
  }

  public double openRate() {
    return rate(OutcomeMetric.OPEN_RATE);
  }

  public double clickRate() {
    return rate(OutcomeMetric.CLICK_RATE);
  }

  public double conversionRate() {
    return rate(OutcomeMetric.CONVERSION_RATE);
  }
}
