/*
 * どこで: スケジュールのモデル
 * 何を: 有効な実行時刻を決して生成できない cadence を表す
 * なぜ: 不正な cadence は恒久的な失敗であり、再試行させないため
 */
package com.example.delivery.schedule;

public class InvalidCadenceException extends RuntimeException {

  public InvalidCadenceException(String message) {
    super(message);
  }

  public InvalidCadenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
