/*
 * どこで: Delivery Engine のサービス層
 * 何を: リトライと終端状態を持つ通知配信の永続的な優先度付きキュー
 * なぜ: 配信の状態を変えるのは取得と結果記録だけにするため
 */
package com.example.delivery.service;

import com.example.delivery.config.DeliveryQueueProperties;
import com.example.delivery.config.RunExecutorProperties;
import com.example.delivery.model.DeliveryChannel;
import com.example.delivery.model.DeliveryOutcome;
import com.example.delivery.model.DeliveryQueueStats;
import com.example.delivery.model.DeliveryStatsFilter;
import com.example.delivery.model.DeliveryStatus;
import com.example.delivery.model.OutcomeTransition;
import com.example.delivery.model.QueuedDelivery;
import com.example.delivery.repository.DeliveryQueueRepository;
import com.example.delivery.repository.VariantOutcomeRepository;
import com.example.delivery.repository.VariantOutcomeRepository.OutcomeCounterDelta;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class DeliveryQueue {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryQueue.class);

  private final DeliveryQueueRepository deliveryQueueRepository;
  private final VariantOutcomeRepository variantOutcomeRepository;
  private final OptimalSendHourLookup optimalSendHourLookup;
  private final DeliveryQueueProperties properties;
  private final RunExecutorProperties executorProperties;
  private final PlatformTransactionManager transactionManager;
  private final Clock clock;

  public UUID enqueue(NewDelivery request) {
    final Instant now = Instant.now(clock);
    final Instant requested = request.scheduledFor() == null ? now : request.scheduledFor();
    final Instant scheduledFor =
        request.optimalSendTime() ? applyOptimalSendTime(request, requested) : requested;
    final QueuedDelivery delivery =
        new QueuedDelivery(
            UUID.randomUUID(),
            request.recipientId(),
            request.notificationType(),
            request.title(),
            request.message(),
            request.actionUrl(),
            request.priority(),
            request.deliveryMethod(),
            scheduledFor,
            request.optimalSendTime(),
            DeliveryStatus.QUEUED,
            0,
            null,
            null,
            null,
            Set.of(),
            request.experimentId(),
            request.variant(),
            request.campaignId(),
            request.userSegment(),
            request.metadataJson(),
            null,
            null,
            now,
            now);
    deliveryQueueRepository.insert(delivery);
    logger.info(
        "delivery enqueued deliveryId={} recipientId={} priority={} scheduledFor={}",
        delivery.deliveryId(),
        delivery.recipientId(),
        delivery.priority(),
        scheduledFor);
    return delivery.deliveryId();
  }

  /**
   * 役割: 時刻を受信者の過去の最適時刻へ移す。
   * 動作: 要求された暦日はデフォルトタイムゾーンで維持する。履歴がなければ要求された時刻のまま返す。
   */
  @VisibleForTesting
  Instant applyOptimalSendTime(NewDelivery request, Instant requested) {
    final Optional<LocalTime> bestTime =
        optimalSendHourLookup.bestTime(request.recipientId(), request.notificationType());
    if (bestTime.isEmpty()) {
      return requested;
    }
    final ZoneId zone = executorProperties.defaultTimezone();
    final ZonedDateTime local = requested.atZone(zone);
    return ZonedDateTime.of(local.toLocalDate(), bestTime.get(), zone).toInstant();
  }

  public QueuedDelivery get(UUID deliveryId) {
    return deliveryQueueRepository
        .findById(deliveryId)
        .orElseThrow(() -> new DeliveryNotFoundException(deliveryId));
  }

  /** now 時点で期限到来の QUEUED 配信。緊急かつ期限超過のものが先頭。 */
  public List<QueuedDelivery> dueDeliveries(Instant now, int limit) {
    return deliveryQueueRepository.findDue(now, limit);
  }

  /**
   * 役割: QUEUED かつ期限到来の配信をアトミックに取得する。
   * 動作: 並行する呼び出しのうち 1 つだけが true を得る。取得は 1 回の試行として数える。
   */
  public boolean markProcessing(UUID deliveryId, String lockedBy, Instant now) {
    final Instant leaseUntil = now.plus(properties.lease());
    return deliveryQueueRepository.markProcessing(deliveryId, now, leaseUntil, lockedBy) == 1;
  }

  public boolean recordChannelDelivered(
      UUID deliveryId, DeliveryChannel channel, String lockedBy, Instant now) {
    return deliveryQueueRepository.addDeliveredChannel(deliveryId, channel, lockedBy, now) == 1;
  }

  /**
   * 役割: PROCESSING から一度だけ抜ける。
   * 動作: このロックで PROCESSING でない配信は無視するため、実験カウンタが二重に加算されることはない。
   */
  public OutcomeTransition markOutcome(
      UUID deliveryId, DeliveryOutcome outcome, String error, String lockedBy, Instant now) {
    final QueuedDelivery delivery = get(deliveryId);
    if (delivery.status() != DeliveryStatus.PROCESSING || !lockedBy.equals(delivery.lockedBy())) {
      logger.warn(
          "delivery outcome ignored deliveryId={} status={} outcome={}",
          deliveryId,
          delivery.status(),
          outcome);
      return OutcomeTransition.IGNORED;
    }
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final OutcomeTransition transition =
        transactionTemplate.execute(status -> applyOutcome(delivery, outcome, error, lockedBy, now));
    if (transition == OutcomeTransition.IGNORED) {
      logger.warn("delivery outcome skipped because lock was lost deliveryId={}", deliveryId);
    }
    return transition;
  }

  private OutcomeTransition applyOutcome(
      QueuedDelivery delivery, DeliveryOutcome outcome, String error, String lockedBy, Instant now) {
    final UUID deliveryId = delivery.deliveryId();
    switch (outcome) {
      case SENT -> {
        if (deliveryQueueRepository.markSent(deliveryId, now, lockedBy) == 0) {
          return OutcomeTransition.IGNORED;
        }
        incrementVariant(delivery, OutcomeCounterDelta.sentAndDelivered(), now);
        return OutcomeTransition.SENT;
      }
      case BOUNCED -> {
        if (deliveryQueueRepository.markFailed(deliveryId, errorOrDefault(error, "bounced"), now, lockedBy)
            == 0) {
          return OutcomeTransition.IGNORED;
        }
        incrementVariant(delivery, OutcomeCounterDelta.sentAndBounced(), now);
        return OutcomeTransition.FAILED;
      }
      case PERMANENT_FAILURE -> {
        return deliveryQueueRepository.markFailed(deliveryId, error, now, lockedBy) == 0
            ? OutcomeTransition.IGNORED
            : OutcomeTransition.FAILED;
      }
      case RETRYABLE_FAILURE -> {
        if (delivery.attemptCount() >= properties.maxAttempts()) {
          return deliveryQueueRepository.markFailed(deliveryId, error, now, lockedBy) == 0
              ? OutcomeTransition.IGNORED
              : OutcomeTransition.FAILED;
        }
        final Instant nextAttemptAt = now.plus(computeBackoff(delivery.attemptCount()));
        return deliveryQueueRepository.markRequeued(deliveryId, nextAttemptAt, error, now, lockedBy) == 0
            ? OutcomeTransition.IGNORED
            : OutcomeTransition.REQUEUED;
      }
      default -> throw new IllegalArgumentException("unsupported outcome " + outcome);
    }
  }

  private void incrementVariant(QueuedDelivery delivery, OutcomeCounterDelta delta, Instant now) {
    if (delivery.hasExperimentBinding()) {
      variantOutcomeRepository.increment(delivery.experimentId(), delivery.variant(), delta, now);
    }
  }

  /** キャンセルできるのは QUEUED の配信だけ。取得済みや完了済みなら false を返す。 */
  public boolean cancel(UUID deliveryId) {
    final int updated = deliveryQueueRepository.cancel(deliveryId, Instant.now(clock));
    if (updated == 0) {
      final QueuedDelivery delivery = get(deliveryId);
      logger.info("delivery cancel rejected deliveryId={} status={}", deliveryId, delivery.status());
      return false;
    }
    logger.info("delivery cancelled deliveryId={}", deliveryId);
    return true;
  }

  public DeliveryQueueStats stats(DeliveryStatsFilter filter) {
    return deliveryQueueRepository.stats(filter == null ? DeliveryStatsFilter.all() : filter);
  }

  public int recoverExpiredLeases(Instant now) {
    final int recovered = deliveryQueueRepository.recoverExpiredLeases(now, properties.maxAttempts());
    if (recovered > 0) {
      logger.warn("delivery leases expired and were recovered count={}", recovered);
    }
    return recovered;
  }

  public int countDueBacklog(Instant now) {
    return deliveryQueueRepository.countDue(now);
  }

  /** base * exponentBase^attempt を backoffMax で頭打ちにし、ジッタ係数を掛ける。 */
  @VisibleForTesting
  Duration computeBackoff(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), attempt);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter = jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    return Duration.ofMillis((long) Math.ceil(capped * jitter));
  }

  private static String errorOrDefault(String error, String fallback) {
    return error == null || error.isBlank() ? fallback : error;
  }
}
