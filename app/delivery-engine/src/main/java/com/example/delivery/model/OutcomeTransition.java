/*
 * どこで: 配信キューのモデル
 * 何を: markOutcome が実際に適用した状態遷移
 * なぜ: 実際の遷移と終端済み配信への空振りを呼び出し側で区別するため
 */
package com.example.delivery.model;

public enum OutcomeTransition {
  SENT,
  REQUEUED,
  FAILED,
  IGNORED
}
