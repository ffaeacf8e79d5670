/*
 * どこで: 配信キューのモデル
 * 何を: delivery_queue テーブル 1 行のスナップショット
 * なぜ: 投入/期限到来の選択/ディスパッチ/統計で共有するため
 */
package com.example.delivery.model;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public record QueuedDelivery(
    UUID deliveryId,
    String recipientId,
    NotificationType notificationType,
    String title,
    String message,
    String actionUrl,
    DeliveryPriority priority,
    DeliveryMethod deliveryMethod,
    Instant scheduledFor,
    boolean optimalSendTime,
    DeliveryStatus status,
    int attemptCount,
    Instant lastAttemptAt,
    Instant nextAttemptAt,
    String lastError,
    Set<DeliveryChannel> deliveredChannels,
    UUID experimentId,
    ExperimentVariant variant,
    String campaignId,
    String userSegment,
    String metadataJson,
    String lockedBy,
    Instant leaseUntil,
    Instant createdAt,
    Instant updatedAt) {

  public QueuedDelivery {
    deliveredChannels = deliveredChannels == null ? Set.of() : Set.copyOf(deliveredChannels);
  }

  public boolean hasExperimentBinding() {
    return experimentId != null && variant != null;
  }
}
