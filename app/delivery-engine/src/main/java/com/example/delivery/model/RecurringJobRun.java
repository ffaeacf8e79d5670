/*
 * どこで: 定期ジョブ実行のモデル
 * 何を: recurring_job_runs テーブル 1 行のスナップショット
 * なぜ: ジョブごとの実行履歴 (成果物、受信者、エラー) を残すため
 */
package com.example.delivery.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record RecurringJobRun(
    UUID runId,
    UUID jobId,
    RunStatus status,
    TriggerSource triggeredBy,
    String triggeredByUserId,
    Instant startedAt,
    Instant completedAt,
    Long processingTimeMillis,
    String artifactKey,
    String artifactLocation,
    Long artifactSize,
    Integer recordCount,
    int emailsSent,
    List<RecipientDeliveryStatus> recipientStatuses,
    String errorMessage,
    String stackTrace,
    Instant createdAt) {

  public RecurringJobRun {
    recipientStatuses = recipientStatuses == null ? List.of() : List.copyOf(recipientStatuses);
  }
}
