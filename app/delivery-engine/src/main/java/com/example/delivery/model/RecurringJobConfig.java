/*
 * どこで: 定期ジョブのモデル
 * 何を: recurring_jobs テーブル 1 行のスナップショット
 * なぜ: レジストリ/実行器/登録タスク表で共有するため
 */
package com.example.delivery.model;

import com.example.delivery.schedule.CadenceSpec;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record RecurringJobConfig(
    UUID jobId,
    String name,
    JobKind kind,
    CadenceSpec cadence,
    RenderSpec renderSpec,
    List<String> recipients,
    String emailSubject,
    boolean active,
    Instant lastRunAt,
    Instant nextRunAt,
    LastRunStatus lastRunStatus,
    String lastRunError,
    int runCount,
    int successCount,
    int failureCount,
    String lockedBy,
    Instant leaseUntil,
    String createdBy,
    Instant createdAt,
    Instant updatedAt) {

  public RecurringJobConfig {
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
  }
}
