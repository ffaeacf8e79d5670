/*
 * どこで: 配信トランスポート
 * 何を: 特定の受信者への配信を失敗させる CI/テスト専用トランスポート
 * なぜ: 本番経路に触れずにリトライ/バウンス/恒久的失敗をエンドツーエンドで再現するため
 */
package com.example.delivery.transport;

import com.example.delivery.model.DeliveryChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "delivery-engine.transport.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingDeliveryTransport implements DeliveryTransport {

  private final LocalDeliveryTransport delegate;

  @Value("${delivery-engine.transport.failure-injection.transient-prefix:}")
  private String transientPrefix;

  @Value("${delivery-engine.transport.failure-injection.bounce-prefix:}")
  private String bouncePrefix;

  @Value("${delivery-engine.transport.failure-injection.permanent-prefix:}")
  private String permanentPrefix;

  @Override
  public TransportResult deliver(String recipientId, DeliveryChannel channel, TransportPayload payload) {
    if (matches(recipientId, permanentPrefix)) {
      throw new PermanentDeliveryException(
          "delivery failure injection (permanent) matched recipientId=" + recipientId);
    }
    if (matches(recipientId, transientPrefix)) {
      throw new IllegalStateException(
          "delivery failure injection (transient) matched recipientId=" + recipientId);
    }
    if (matches(recipientId, bouncePrefix)) {
      return TransportResult.BOUNCED;
    }
    return delegate.deliver(recipientId, channel, payload);
  }

  private static boolean matches(String recipientId, String prefix) {
    if (prefix == null || prefix.isBlank()) {
      return false;
    }
    return recipientId.startsWith(prefix);
  }
}
