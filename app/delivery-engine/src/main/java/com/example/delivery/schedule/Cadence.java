/*
 * どこで: スケジュールのモデル
 * 何を: 定期ジョブが使える繰り返し種別を列挙する
 * なぜ: 永続化する cadence カラムと計算処理の分岐を一致させるため
 */
package com.example.delivery.schedule;

public enum Cadence {
  DAILY,
  WEEKLY,
  MONTHLY,
  QUARTERLY,
  CUSTOM
}
