/*
 * どこで: 定期ジョブ実行のモデル
 * 何を: 実行レコード 1 件のライフサイクル
 * なぜ: PENDING -> PROCESSING -> COMPLETED|FAILED を条件付き更新で強制するため
 */
package com.example.delivery.model;

public enum RunStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED
}
