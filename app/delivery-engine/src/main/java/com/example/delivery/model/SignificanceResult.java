/*
 * どこで: 実験のモデル
 * 何を: 1 つの指標で 2 つのバリアントを比較した結果
 * なぜ: 差が有意で両サンプルが十分大きい場合を除き winner は null のため
 */
package com.example.delivery.model;

public record SignificanceResult(
    boolean significant,
    ExperimentVariant winner,
    double pValue,
    double zScore,
    int confidenceLevel,
    double improvement) {

  public static SignificanceResult insufficientEvidence() {
    return new SignificanceResult(false, null, 1.0d, 0.0d, 0, 0.0d);
  }
}
