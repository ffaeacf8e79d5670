package com.example.delivery.transport;

public enum TransportResult {
  DELIVERED,
  /** 終端: 下流でアドレスが拒否された。 */
  BOUNCED,
  /** リトライ可能: 下流から送信速度を落とすよう求められた。 */
  THROTTLED
}
