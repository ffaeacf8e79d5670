/*
 * どこで: 配信キューのモデル
 * 何を: キュー統計の任意フィルタ
 * なぜ: キャンペーン別/受信者別のダッシュボードはキューの部分集合を集計するため
 */
package com.example.delivery.model;

import java.time.Instant;

public record DeliveryStatsFilter(String recipientId, String campaignId, Instant from, Instant to) {

  public static DeliveryStatsFilter all() {
    return new DeliveryStatsFilter(null, null, null, null);
  }
}
