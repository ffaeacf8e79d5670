/*
 * どこで: 実験の有意差判定
 * 何を: 開封/クリック/応答/コンバージョンのイベントをバリアントに記録する
 * なぜ: 送信/到達/バウンスは配信結果から、エンゲージメントは後からトラッキング経由で届くため
 */
package com.example.delivery.experiment;

import com.example.delivery.model.EngagementEvent;
import com.example.delivery.model.ExperimentVariant;
import com.example.delivery.model.VariantOutcomeAggregate;
import com.example.delivery.repository.VariantOutcomeRepository;
import com.example.delivery.repository.VariantOutcomeRepository.OutcomeCounterDelta;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class VariantOutcomeService {

  private final VariantOutcomeRepository variantOutcomeRepository;
  private final Clock clock;

  public void recordEngagement(UUID experimentId, ExperimentVariant variant, EngagementEvent event) {
    final OutcomeCounterDelta delta =
        switch (event) {
          case OPENED -> OutcomeCounterDelta.openedOnly();
          case CLICKED -> OutcomeCounterDelta.clickedOnly();
          case RESPONDED -> OutcomeCounterDelta.respondedOnly();
          case CONVERTED -> OutcomeCounterDelta.convertedOnly();
        };
    variantOutcomeRepository.increment(experimentId, variant, delta, Instant.now(clock));
  }

  public VariantOutcomeAggregate aggregate(UUID experimentId, ExperimentVariant variant) {
    return variantOutcomeRepository.find(experimentId, variant);
  }
}
