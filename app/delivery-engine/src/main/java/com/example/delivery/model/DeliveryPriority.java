/*
 * どこで: 配信キューのモデル
 * 何を: 並び順に使う数値ランク付きの配信優先度
 * なぜ: 列挙名でソートすると urgent が medium より下になるため
 */
package com.example.delivery.model;

public enum DeliveryPriority {
  LOW(1),
  MEDIUM(2),
  HIGH(3),
  URGENT(4);

  private final int rank;

  DeliveryPriority(int rank) {
    this.rank = rank;
  }

  public int rank() {
    return rank;
  }
}
