package com.example.delivery.transport;

import com.example.delivery.model.NotificationType;
import com.example.delivery.model.QueuedDelivery;
import java.util.UUID;

public record TransportPayload(
    UUID deliveryId,
    NotificationType notificationType,
    String title,
    String message,
    String actionUrl,
    String metadataJson) {

  public static TransportPayload from(QueuedDelivery delivery) {
    return new TransportPayload(
        delivery.deliveryId(),
        delivery.notificationType(),
        delivery.title(),
        delivery.message(),
        delivery.actionUrl(),
        delivery.metadataJson());
  }
}
