/*
 * どこで: 実験のモデル
 * 何を: 実験の判定に使える比率指標
 * なぜ: 指標ごとに分子のカウンタが決まり、分母は常に送信数のため
 */
package com.example.delivery.model;

import java.util.function.ToLongFunction;

public enum OutcomeMetric {
  DELIVERY_RATE(VariantOutcomeAggregate::delivered),
  OPEN_RATE(VariantOutcomeAggregate::opened),
  CLICK_RATE(VariantOutcomeAggregate::clicked),
  RESPONSE_RATE(VariantOutcomeAggregate::responded),
  CONVERSION_RATE(VariantOutcomeAggregate::converted),
  BOUNCE_RATE(VariantOutcomeAggregate::bounced);

  private final ToLongFunction<VariantOutcomeAggregate> numerator;

  OutcomeMetric(ToLongFunction<VariantOutcomeAggregate> numerator) {
    this.numerator = numerator;
  }

  public long numerator(VariantOutcomeAggregate aggregate) {
    return numerator.applyAsLong(aggregate);
  }
}
