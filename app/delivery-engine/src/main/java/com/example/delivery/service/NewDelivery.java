/*
 * どこで: 配信キュー
 * 何を: 通知配信 1 件を投入するための入力
 * なぜ: 状態/試行回数/リースのカラムは投入側ではなくキューが管理するため
 */
package com.example.delivery.service;

import com.example.delivery.model.DeliveryMethod;
import com.example.delivery.model.DeliveryPriority;
import com.example.delivery.model.ExperimentVariant;
import com.example.delivery.model.NotificationType;
import java.time.Instant;
import java.util.UUID;

public record NewDelivery(
    String recipientId,
    NotificationType notificationType,
    String title,
    String message,
    String actionUrl,
    DeliveryPriority priority,
    DeliveryMethod deliveryMethod,
    Instant scheduledFor,
    boolean optimalSendTime,
    UUID experimentId,
    ExperimentVariant variant,
    String campaignId,
    String userSegment,
    String metadataJson) {

  public NewDelivery {
    if (recipientId == null || recipientId.isBlank()) {
      throw new IllegalArgumentException("recipientId is required");
    }
    if (title == null || title.isBlank() || message == null || message.isBlank()) {
      throw new IllegalArgumentException("title and message are required");
    }
    if ((experimentId == null) != (variant == null)) {
      throw new IllegalArgumentException("experiment binding needs both experimentId and variant");
    }
    notificationType = notificationType == null ? NotificationType.GENERAL : notificationType;
    priority = priority == null ? DeliveryPriority.MEDIUM : priority;
    deliveryMethod = deliveryMethod == null ? DeliveryMethod.PUSH : deliveryMethod;
  }

  public static NewDelivery simple(
      String recipientId, NotificationType type, String title, String message, Instant scheduledFor) {
    return new NewDelivery(
        recipientId, type, title, message, null, null, null, scheduledFor, false, null, null, null,
        null, null);
  }

  public NewDelivery withPriority(DeliveryPriority newPriority) {
    return new NewDelivery(
        recipientId, notificationType, title, message, actionUrl, newPriority, deliveryMethod,
        scheduledFor, optimalSendTime, experimentId, variant, campaignId, userSegment, metadataJson);
  }

  public NewDelivery withExperiment(UUID newExperimentId, ExperimentVariant newVariant) {
    return new NewDelivery(
        recipientId, notificationType, title, message, actionUrl, priority, deliveryMethod,
        scheduledFor, optimalSendTime, newExperimentId, newVariant, campaignId, userSegment,
        metadataJson);
  }

  public NewDelivery withOptimalSendTime(boolean enabled) {
    return new NewDelivery(
        recipientId, notificationType, title, message, actionUrl, priority, deliveryMethod,
        scheduledFor, enabled, experimentId, variant, campaignId, userSegment, metadataJson);
  }

  public NewDelivery withDeliveryMethod(DeliveryMethod method) {
    return new NewDelivery(
        recipientId, notificationType, title, message, actionUrl, priority, method, scheduledFor,
        optimalSendTime, experimentId, variant, campaignId, userSegment, metadataJson);
  }
}
