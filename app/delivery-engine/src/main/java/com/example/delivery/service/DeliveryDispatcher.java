/*
 * どこで: Delivery Engine のサービス層
 * 何を: 期限到来の配信を 1 件取得し、残りの全チャネルへ送信して結果を記録する
 * なぜ: 前回の試行で配信済みのチャネルへ二度送らないため
 */
package com.example.delivery.service;

import com.example.common.TraceIds;
import com.example.delivery.config.RunExecutorProperties;
import com.example.delivery.model.DeliveryChannel;
import com.example.delivery.model.DeliveryOutcome;
import com.example.delivery.model.OutcomeTransition;
import com.example.delivery.model.QueuedDelivery;
import com.example.delivery.transport.DeliveryTransport;
import com.example.delivery.transport.PermanentDeliveryException;
import com.example.delivery.transport.TransportPayload;
import com.example.delivery.transport.TransportResult;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeliveryDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryDispatcher.class);
  private static final String MDC_DELIVERY_ID = "delivery_id";

  private final DeliveryQueue deliveryQueue;
  private final DeliveryTransport transport;
  private final ChannelPacer channelPacer;
  private final DeliveryEngineMetrics metrics;
  private final RunExecutorProperties properties;
  private final String workerId = TraceIds.resolveWorkerId();

  public DispatchResult dispatch(UUID deliveryId, Instant now) {
    final String lockedBy = workerId + "/" + TraceIds.newTraceId();
    MDC.put(MDC_DELIVERY_ID, deliveryId.toString());
    try {
      if (!deliveryQueue.markProcessing(deliveryId, lockedBy, now)) {
        logger.debug("delivery already claimed deliveryId={}", deliveryId);
        metrics.recordDeliveryResult("contended");
        return DispatchResult.SKIPPED;
      }
      // 取得後に読み直し、配信済みチャネルを直近の試行に合わせる
      final QueuedDelivery delivery = deliveryQueue.get(deliveryId);
      final Attempt attempt = sendRemainingChannels(delivery, lockedBy, now);
      final OutcomeTransition transition =
          deliveryQueue.markOutcome(deliveryId, attempt.outcome(), attempt.error(), lockedBy, now);
      final DispatchResult result = toResult(transition);
      metrics.recordDeliveryResult(
          attempt.outcome() == DeliveryOutcome.BOUNCED && result == DispatchResult.FAILED
              ? "bounced"
              : result.name().toLowerCase(Locale.ROOT));
      logger.info(
          "delivery attempt finished deliveryId={} attempt={} outcome={} transition={}",
          deliveryId,
          delivery.attemptCount(),
          attempt.outcome(),
          transition);
      return result;
    } catch (RuntimeException ex) {
      // 状態は PROCESSING のまま。リース回収でキューへ戻る
      logger.error("delivery attempt aborted deliveryId={}", deliveryId, ex);
      metrics.recordDeliveryResult("error");
      return DispatchResult.SKIPPED;
    } finally {
      MDC.remove(MDC_DELIVERY_ID);
    }
  }

  private Attempt sendRemainingChannels(QueuedDelivery delivery, String lockedBy, Instant now) {
    final Set<DeliveryChannel> remaining = EnumSet.noneOf(DeliveryChannel.class);
    remaining.addAll(delivery.deliveryMethod().channels());
    remaining.removeAll(delivery.deliveredChannels());
    final TransportPayload payload = TransportPayload.from(delivery);
    for (DeliveryChannel channel : remaining) {
      channelPacer.acquire(channel);
      final TransportResult result;
      try {
        result = transport.deliver(delivery.recipientId(), channel, payload);
      } catch (PermanentDeliveryException ex) {
        logger.warn("delivery rejected permanently deliveryId={} channel={}", delivery.deliveryId(), channel, ex);
        return new Attempt(DeliveryOutcome.PERMANENT_FAILURE, describe(ex));
      } catch (RuntimeException ex) {
        logger.warn("delivery transport failed deliveryId={} channel={}", delivery.deliveryId(), channel, ex);
        return new Attempt(DeliveryOutcome.RETRYABLE_FAILURE, describe(ex));
      }
      switch (result) {
        case DELIVERED -> {
          if (!deliveryQueue.recordChannelDelivered(delivery.deliveryId(), channel, lockedBy, now)) {
            logger.warn(
                "delivered channel not recorded deliveryId={} channel={}", delivery.deliveryId(), channel);
          }
        }
        case BOUNCED -> {
          return new Attempt(DeliveryOutcome.BOUNCED, "bounced on channel " + channel);
        }
        case THROTTLED -> {
          return new Attempt(DeliveryOutcome.RETRYABLE_FAILURE, "throttled on channel " + channel);
        }
        default -> throw new IllegalStateException("unexpected transport result " + result);
      }
    }
    return new Attempt(DeliveryOutcome.SENT, null);
  }

  private String describe(RuntimeException ex) {
    return ErrorDetails.message(ex, properties.errorMessageMaxLength());
  }

  private static DispatchResult toResult(OutcomeTransition transition) {
    return switch (transition) {
      case SENT -> DispatchResult.SENT;
      case REQUEUED -> DispatchResult.REQUEUED;
      case FAILED -> DispatchResult.FAILED;
      case IGNORED -> DispatchResult.SKIPPED;
    };
  }

  private record Attempt(DeliveryOutcome outcome, String error) {}
}
