/*
 * どこで: 定期ジョブ実行のモデル
 * 何を: レンダリング済み成果物の受信者 1 人分のメール送信結果
 * なぜ: 1 件の不正アドレスで run 全体を失敗させずに記録するため
 */
package com.example.delivery.model;

import java.time.Instant;

public record RecipientDeliveryStatus(String recipient, Result status, String error, Instant sentAt) {

  public enum Result {
    SENT,
    FAILED
  }

  public static RecipientDeliveryStatus sent(String recipient, Instant sentAt) {
    return new RecipientDeliveryStatus(recipient, Result.SENT, null, sentAt);
  }

  public static RecipientDeliveryStatus failed(String recipient, String error, Instant sentAt) {
    return new RecipientDeliveryStatus(recipient, Result.FAILED, error, sentAt);
  }
}
