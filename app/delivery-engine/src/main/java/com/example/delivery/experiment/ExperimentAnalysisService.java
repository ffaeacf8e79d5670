/*
 * どこで: 実験の有意差判定
 * 何を: 進行中の実験をすべて評価し、有意な勝者が出たものを完了させる
 * なぜ: 勝者の通知も通常の通知と同じ配信キューで届けるため
 */
package com.example.delivery.experiment;

import com.example.delivery.model.DeliveryMethod;
import com.example.delivery.model.DeliveryPriority;
import com.example.delivery.model.Experiment;
import com.example.delivery.model.ExperimentVariant;
import com.example.delivery.model.NotificationType;
import com.example.delivery.model.SignificanceResult;
import com.example.delivery.model.VariantOutcomeAggregate;
import com.example.delivery.repository.ExperimentRepository;
import com.example.delivery.repository.VariantOutcomeRepository;
import com.example.delivery.service.DeliveryEngineMetrics;
import com.example.delivery.service.DeliveryQueue;
import com.example.delivery.service.NewDelivery;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExperimentAnalysisService {

  private static final Logger logger = LoggerFactory.getLogger(ExperimentAnalysisService.class);

  private final ExperimentRepository experimentRepository;
  private final VariantOutcomeRepository variantOutcomeRepository;
  private final SignificanceEngine significanceEngine;
  private final DeliveryQueue deliveryQueue;
  private final DeliveryEngineMetrics metrics;

  /** 役割: この呼び出しで勝者付きで完了した実験の件数を返す。 */
  public int analyzeActive(Instant now) {
    final List<Experiment> active = experimentRepository.findActiveWithoutWinner();
    int winners = 0;
    for (Experiment experiment : active) {
      try {
        if (analyze(experiment, now)) {
          winners++;
        }
      } catch (RuntimeException ex) {
        logger.error("experiment analysis failed experimentId={}", experiment.experimentId(), ex);
      }
    }
    logger.info("experiment analysis finished analyzed={} winners={}", active.size(), winners);
    return winners;
  }

  private boolean analyze(Experiment experiment, Instant now) {
    final VariantOutcomeAggregate a =
        variantOutcomeRepository.find(experiment.experimentId(), ExperimentVariant.A);
    final VariantOutcomeAggregate b =
        variantOutcomeRepository.find(experiment.experimentId(), ExperimentVariant.B);
    final SignificanceResult result = significanceEngine.evaluate(a, b, experiment.primaryMetric());
    if (!result.significant()) {
      return false;
    }
    // 条件付き更新: 勝者を最初に確定した分析だけが実験を完了させる
    if (!experimentRepository.markCompleted(experiment.experimentId(), result.winner(), now)) {
      return false;
    }
    metrics.recordExperimentWinner();
    logger.info(
        "experiment winner determined experimentId={} winner={} pValue={} confidence={}",
        experiment.experimentId(),
        result.winner(),
        result.pValue(),
        result.confidenceLevel());
    final VariantOutcomeAggregate winner = result.winner() == ExperimentVariant.A ? a : b;
    deliveryQueue.enqueue(winnerNotification(experiment, result, winner, now));
    return true;
  }

  private NewDelivery winnerNotification(
      Experiment experiment, SignificanceResult result, VariantOutcomeAggregate winner, Instant now) {
    final String metricName = experiment.primaryMetric().name().toLowerCase(Locale.ROOT).replace('_', ' ');
    final String message =
        String.format(
            Locale.ROOT,
            "Variant %s is the winner with %d%% confidence! %s: %.1f%%, improvement: %.1f%%",
            result.winner(),
            result.confidenceLevel(),
            metricName,
            winner.rate(experiment.primaryMetric()) * 100.0d,
            result.improvement());
    return new NewDelivery(
        experiment.ownerId(),
        NotificationType.AB_TEST_RESULT,
        "A/B Test Winner Determined: " + experiment.name(),
        message,
        "/ab-test-dashboard?experimentId=" + experiment.experimentId(),
        DeliveryPriority.HIGH,
        DeliveryMethod.PUSH_EMAIL,
        now,
        false,
        null,
        null,
        null,
        null,
        null);
  }
}
