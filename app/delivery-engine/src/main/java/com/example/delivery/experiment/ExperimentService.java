/*
 * どこで: 実験の有意差判定
 * 何を: 実験を登録し、要求に応じてその場で評価する
 * なぜ: 自動分析の tick を待たずに現在の判定を参照できるようにするため
 */
package com.example.delivery.experiment;

import com.example.delivery.model.Experiment;
import com.example.delivery.model.ExperimentStatus;
import com.example.delivery.model.ExperimentVariant;
import com.example.delivery.model.OutcomeMetric;
import com.example.delivery.model.SignificanceResult;
import com.example.delivery.repository.ExperimentRepository;
import com.example.delivery.repository.VariantOutcomeRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExperimentService {

  private static final Logger logger = LoggerFactory.getLogger(ExperimentService.class);

  private final ExperimentRepository experimentRepository;
  private final VariantOutcomeRepository variantOutcomeRepository;
  private final SignificanceEngine significanceEngine;
  private final Clock clock;

  public Experiment create(String name, String ownerId, OutcomeMetric primaryMetric) {
    if (name == null || name.isBlank() || ownerId == null || ownerId.isBlank()) {
      throw new IllegalArgumentException("experiment name and owner are required");
    }
    final Experiment experiment =
        new Experiment(
            UUID.randomUUID(),
            name,
            ownerId,
            primaryMetric == null ? OutcomeMetric.OPEN_RATE : primaryMetric,
            ExperimentStatus.ACTIVE,
            null,
            null,
            Instant.now(clock));
    experimentRepository.insert(experiment);
    logger.info(
        "experiment created experimentId={} metric={}",
        experiment.experimentId(),
        experiment.primaryMetric());
    return experiment;
  }

  public Experiment get(UUID experimentId) {
    return experimentRepository
        .findById(experimentId)
        .orElseThrow(() -> new ExperimentNotFoundException(experimentId));
  }

  public SignificanceResult evaluate(UUID experimentId) {
    final Experiment experiment = get(experimentId);
    return significanceEngine.evaluate(
        variantOutcomeRepository.find(experimentId, ExperimentVariant.A),
        variantOutcomeRepository.find(experimentId, ExperimentVariant.B),
        experiment.primaryMetric());
  }
}
