/*
 * どこで: 実験の有意差判定
 * 何を: 2 つのバリアント間でプール二標本比率 z 検定を行う
 * なぜ: p < alpha かつ両サンプルが最小サイズ以上のときだけ勝者を決めるため
 */
package com.example.delivery.experiment;

import com.example.delivery.config.ExperimentProperties;
import com.example.delivery.model.ExperimentVariant;
import com.example.delivery.model.OutcomeMetric;
import com.example.delivery.model.SignificanceResult;
import com.example.delivery.model.VariantOutcomeAggregate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SignificanceEngine {

  private final ExperimentProperties properties;

  /** 純粋関数: 結果は 2 つの集計値、指標、閾値だけで決まる。 */
  public SignificanceResult evaluate(
      VariantOutcomeAggregate variantA, VariantOutcomeAggregate variantB, OutcomeMetric metric) {
    final long nA = variantA.sent();
    final long nB = variantB.sent();
    if (nA == 0 || nB == 0) {
      return SignificanceResult.insufficientEvidence();
    }
    final double rateA = variantA.rate(metric);
    final double rateB = variantB.rate(metric);
    // 重複イベントで分子が送信数を超えた集計は比率として扱えない
    if (!isProportion(rateA) || !isProportion(rateB)) {
      return SignificanceResult.insufficientEvidence();
    }
    final double pooled = (rateA * nA + rateB * nB) / (nA + nB);
    final double se = Math.sqrt(pooled * (1.0d - pooled) * (1.0d / nA + 1.0d / nB));
    if (se == 0.0d || !Double.isFinite(se)) {
      return SignificanceResult.insufficientEvidence();
    }
    final double z = Math.abs(rateA - rateB) / se;
    final double pValue = StandardNormal.twoTailedPValue(z);
    final int confidenceLevel = (int) Math.round((1.0d - pValue) * 100.0d);
    final boolean enoughSamples = Math.min(nA, nB) >= properties.minSampleSize();
    final boolean significant = enoughSamples && pValue < properties.significanceLevel() && rateA != rateB;
    if (!significant) {
      return new SignificanceResult(false, null, pValue, z, confidenceLevel, 0.0d);
    }
    final ExperimentVariant winner = rateB > rateA ? ExperimentVariant.B : ExperimentVariant.A;
    final double winnerRate = Math.max(rateA, rateB);
    final double loserRate = Math.min(rateA, rateB);
    final double improvement = loserRate == 0.0d ? 0.0d : (winnerRate - loserRate) / loserRate * 100.0d;
    return new SignificanceResult(true, winner, pValue, z, confidenceLevel, improvement);
  }

  private static boolean isProportion(double rate) {
    return rate >= 0.0d && rate <= 1.0d;
  }
}
