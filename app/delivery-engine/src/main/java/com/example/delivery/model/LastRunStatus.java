/*
 * どこで: 定期ジョブのモデル
 * 何を: 定期ジョブの直近実行の結果
 * なぜ: 実行履歴を走査せずにジョブの健全性を確認できるようにするため
 */
package com.example.delivery.model;

public enum LastRunStatus {
  SUCCESS,
  FAILED,
  NEVER_RUN
}
