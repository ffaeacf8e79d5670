package com.example.delivery.service;

public enum DispatchResult {
  SENT,
  REQUEUED,
  FAILED,
  /** 他ワーカーが取得済み、または結果を書く前にリースを失った。 */
  SKIPPED
}
