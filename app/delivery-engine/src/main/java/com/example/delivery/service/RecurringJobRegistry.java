/*
 * どこで: Delivery Engine のサービス層
 * 何を: 定期ジョブを作成し、期限到来のものを選び、実行結果を記録する
 * なぜ: nextRunAt はここでだけ、必ずスケジュール計算を通して書くため
 */
package com.example.delivery.service;

import com.example.delivery.model.LastRunStatus;
import com.example.delivery.model.RecurringJobConfig;
import com.example.delivery.repository.RecurringJobRepository;
import com.example.delivery.schedule.CadenceSpec;
import com.example.delivery.schedule.InvalidCadenceException;
import com.example.delivery.schedule.ScheduleCalculator;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RecurringJobRegistry {

  private static final Logger logger = LoggerFactory.getLogger(RecurringJobRegistry.class);

  private final RecurringJobRepository recurringJobRepository;
  private final ScheduleCalculator scheduleCalculator;
  private final RegisteredTasks registeredTasks;
  private final Clock clock;

  public RecurringJobConfig create(NewRecurringJob request) {
    final Instant now = Instant.now(clock);
    final Instant nextRunAt = scheduleCalculator.nextRun(request.cadence(), now);
    final RecurringJobConfig job =
        new RecurringJobConfig(
            UUID.randomUUID(),
            request.name(),
            request.kind(),
            request.cadence(),
            request.renderSpec(),
            request.recipients(),
            request.emailSubject(),
            true,
            null,
            nextRunAt,
            LastRunStatus.NEVER_RUN,
            null,
            0,
            0,
            0,
            null,
            null,
            request.createdBy(),
            now,
            now);
    recurringJobRepository.insert(job);
    registeredTasks.register(job);
    logger.info(
        "recurring job created jobId={} cadence={} nextRunAt={}",
        job.jobId(),
        job.cadence().cadence(),
        nextRunAt);
    return job;
  }

  public RecurringJobConfig get(UUID jobId) {
    return recurringJobRepository
        .findById(jobId)
        .orElseThrow(() -> new RecurringJobNotFoundException(jobId));
  }

  public List<RecurringJobConfig> list() {
    return recurringJobRepository.findAll();
  }

  /** nextRunAt が now 以前の有効なジョブ。早い順、同時刻はジョブ ID 順。 */
  public List<RecurringJobConfig> dueJobs(Instant now) {
    return recurringJobRepository.findDue(now);
  }

  /**
   * 役割: 実行を 1 回数え、nextRunAt を現在時刻から先へ進める。
   * 動作: 遅れて走ったジョブがすぐ再起動しないよう基準は now。次回時刻が出せない cadence ならジョブを停止する。
   */
  public RecurringJobConfig recordOutcome(UUID jobId, LastRunStatus status, String error) {
    final RecurringJobConfig job = get(jobId);
    final Instant now = Instant.now(clock);
    Instant nextRunAt;
    LastRunStatus recordedStatus = status;
    String recordedError = error;
    boolean deactivate = false;
    try {
      nextRunAt = scheduleCalculator.nextRun(job.cadence(), now);
    } catch (InvalidCadenceException ex) {
      logger.warn("recurring job deactivated, cadence has no next run jobId={}", jobId, ex);
      nextRunAt = job.nextRunAt();
      recordedStatus = LastRunStatus.FAILED;
      recordedError = ex.getMessage();
      deactivate = true;
    }
    if (recurringJobRepository.recordOutcome(jobId, recordedStatus, recordedError, now, nextRunAt) == 0) {
      throw new RecurringJobNotFoundException(jobId);
    }
    if (deactivate) {
      recurringJobRepository.updateActive(jobId, false, nextRunAt, now);
    }
    final RecurringJobConfig updated = get(jobId);
    registeredTasks.register(updated);
    return updated;
  }

  /** 停止してもジョブと履歴は残り、期限到来の選択から外れるだけ。 */
  public RecurringJobConfig setActive(UUID jobId, boolean active) {
    final RecurringJobConfig job = get(jobId);
    final Instant now = Instant.now(clock);
    final Instant nextRunAt = scheduleCalculator.nextRun(job.cadence(), now);
    recurringJobRepository.updateActive(jobId, active, nextRunAt, now);
    final RecurringJobConfig updated = get(jobId);
    registeredTasks.register(updated);
    logger.info("recurring job active changed jobId={} active={} nextRunAt={}", jobId, active, nextRunAt);
    return updated;
  }

  /** 実行中の run は開始時の cadence のまま。 */
  public RecurringJobConfig updateCadence(UUID jobId, CadenceSpec cadence) {
    get(jobId);
    final Instant now = Instant.now(clock);
    final Instant nextRunAt = scheduleCalculator.nextRun(cadence, now);
    recurringJobRepository.updateCadence(jobId, cadence, nextRunAt, now);
    final RecurringJobConfig updated = get(jobId);
    registeredTasks.register(updated);
    logger.info(
        "recurring job cadence changed jobId={} cadence={} nextRunAt={}",
        jobId,
        cadence.cadence(),
        nextRunAt);
    return updated;
  }
}
