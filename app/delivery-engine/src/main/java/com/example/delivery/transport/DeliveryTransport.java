package com.example.delivery.transport;

import com.example.delivery.model.DeliveryChannel;

/**
 * 役割: プッシュ/メール/SMS の外部送信。呼び出し側から見て 1 回の呼び出しはアトミック。
 *
 * <p>決して成功しない配信では {@link PermanentDeliveryException} を送出する。それ以外の実行時例外は一時的な失敗として扱う。
 */
public interface DeliveryTransport {

  TransportResult deliver(String recipientId, DeliveryChannel channel, TransportPayload payload);
}
