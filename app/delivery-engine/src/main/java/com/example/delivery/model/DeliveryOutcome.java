/*
 * どこで: 配信キューのモデル
 * 何を: ディスパッチャが報告する 1 回の配信試行の結果
 * なぜ: リトライ可能な失敗とバウンス/恒久的拒否を区別するため
 */
package com.example.delivery.model;

public enum DeliveryOutcome {
  SENT,
  /** 一時的: トランスポートのタイムアウトやスロットリング。バックオフを経て再試行する。 */
  RETRYABLE_FAILURE,
  /** 終端: 宛先アドレスがトランスポートに拒否された。 */
  BOUNCED,
  /** 終端: 配信自体が不正で、再試行しても結果は変わらない。 */
  PERMANENT_FAILURE
}
