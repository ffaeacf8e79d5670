/*
 * どこで: 定期ジョブのレジストリ
 * 何を: 定期ジョブ作成の入力
 * なぜ: スケジュール状態 (nextRunAt、カウンタ、リース) は呼び出し側ではなくレジストリが管理するため
 */
package com.example.delivery.service;

import com.example.delivery.model.JobKind;
import com.example.delivery.model.RenderSpec;
import com.example.delivery.schedule.CadenceSpec;
import java.util.List;

public record NewRecurringJob(
    String name,
    JobKind kind,
    CadenceSpec cadence,
    RenderSpec renderSpec,
    List<String> recipients,
    String emailSubject,
    String createdBy) {

  public NewRecurringJob {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("job name is required");
    }
    if (kind == null || cadence == null || renderSpec == null) {
      throw new IllegalArgumentException("kind, cadence and render spec are required");
    }
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
  }
}
