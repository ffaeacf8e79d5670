/*
 * どこで: 配信トランスポート
 * 何を: 再試行しても解決しないトランスポート側の拒否
 * なぜ: ディスパッチャがバックオフを飛ばして即座に配信を失敗させるため
 */
package com.example.delivery.transport;

public class PermanentDeliveryException extends RuntimeException {

  public PermanentDeliveryException(String message) {
    super(message);
  }

  public PermanentDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
