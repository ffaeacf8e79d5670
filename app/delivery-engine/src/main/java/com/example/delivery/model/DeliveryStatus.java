/*
 * どこで: 配信キューのモデル
 * 何を: キューに積まれた 1 件の配信のライフサイクル
 * なぜ: SENT/FAILED/CANCELLED は終端で、取得とキャンセルは QUEUED からのみ可能なため
 */
package com.example.delivery.model;

public enum DeliveryStatus {
  QUEUED,
  PROCESSING,
  SENT,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == SENT || this == FAILED || this == CANCELLED;
  }
}
