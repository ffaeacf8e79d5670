/*
 * どこで: 配信トランスポート
 * 何を: ログ出力で送信を模擬するトランスポート
 * なぜ: 外部のプッシュ/メール/SMS プロバイダなしでキューの状態遷移を動かすため
 */
package com.example.delivery.transport;

import com.example.delivery.model.DeliveryChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalDeliveryTransport implements DeliveryTransport {

  private static final Logger logger = LoggerFactory.getLogger(LocalDeliveryTransport.class);

  @Override
  public TransportResult deliver(String recipientId, DeliveryChannel channel, TransportPayload payload) {
    // 実送信はせずログのみ
    logger.info(
        "delivery simulated send deliveryId={} recipientId={} channel={} type={}",
        payload.deliveryId(),
        recipientId,
        channel,
        payload.notificationType());
    return TransportResult.DELIVERED;
  }
}
