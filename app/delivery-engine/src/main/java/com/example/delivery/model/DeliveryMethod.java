/*
 * どこで: 配信キューのモデル
 * 何を: 1 件の配信で要求されるチャネルの組み合わせ
 * なぜ: 1 件の配信が複数トランスポートへ展開され、全チャネル成功時のみ SENT になるため
 */
package com.example.delivery.model;

import java.util.EnumSet;
import java.util.Set;

public enum DeliveryMethod {
  PUSH(EnumSet.of(DeliveryChannel.PUSH)),
  EMAIL(EnumSet.of(DeliveryChannel.EMAIL)),
  SMS(EnumSet.of(DeliveryChannel.SMS)),
  PUSH_EMAIL(EnumSet.of(DeliveryChannel.PUSH, DeliveryChannel.EMAIL)),
  PUSH_SMS(EnumSet.of(DeliveryChannel.PUSH, DeliveryChannel.SMS)),
  EMAIL_SMS(EnumSet.of(DeliveryChannel.EMAIL, DeliveryChannel.SMS)),
  ALL(EnumSet.allOf(DeliveryChannel.class));

  private final Set<DeliveryChannel> channels;

  DeliveryMethod(EnumSet<DeliveryChannel> channels) {
    this.channels = Set.copyOf(channels);
  }

  public Set<DeliveryChannel> channels() {
    return channels;
  }
}
