/*
 * どこで: Delivery Engine のサービス層
 * 何を: リース下で定期ジョブを 1 回実行する (レンダリング、保存、メール、run 記録)
 * なぜ: 1 件の失敗ジョブが同じ tick の他ジョブに影響しないよう実行を分離するため
 */
package com.example.delivery.service;

import com.example.common.TraceIds;
import com.example.delivery.config.RunExecutorProperties;
import com.example.delivery.model.ExportFormat;
import com.example.delivery.model.LastRunStatus;
import com.example.delivery.model.RecipientDeliveryStatus;
import com.example.delivery.model.RecurringJobConfig;
import com.example.delivery.model.TriggerSource;
import com.example.delivery.repository.RecurringJobRepository;
import com.example.delivery.repository.RecurringJobRunRepository;
import com.example.delivery.repository.RecurringJobRunRepository.CompletedRun;
import com.example.delivery.transport.ArtifactStorage;
import com.example.delivery.transport.RenderValidationException;
import com.example.delivery.transport.RenderedArtifact;
import com.example.delivery.transport.ReportMail;
import com.example.delivery.transport.ReportMailer;
import com.example.delivery.transport.ReportRenderer;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class RecurringJobRunner {

  private static final Logger logger = LoggerFactory.getLogger(RecurringJobRunner.class);
  private static final String ARTIFACT_PREFIX = "scheduled-exports";
  private static final String MDC_JOB_ID = "job_id";
  private static final String MDC_RUN_ID = "run_id";
  private static final String STALE_RUN_MESSAGE = "processing lease expired";

  private final RecurringJobRegistry registry;
  private final RecurringJobRepository recurringJobRepository;
  private final RecurringJobRunRepository runRepository;
  private final ReportRenderer reportRenderer;
  private final ArtifactStorage artifactStorage;
  private final ReportMailer reportMailer;
  private final RunExecutorProperties properties;
  private final DeliveryEngineMetrics metrics;
  private final PlatformTransactionManager transactionManager;
  private final Clock clock;
  private final String workerId = TraceIds.resolveWorkerId();

  /**
   * 役割: リースを取れた場合にジョブを 1 回実行する。
   * 前提: スケジュール起動ではジョブが有効かつ {@code now} で期限到来していること。手動起動ではこの確認を省く。
   */
  public JobRunOutcome run(UUID jobId, TriggerSource trigger, String userId, Instant now) {
    final String lockedBy = workerId + "/" + TraceIds.newTraceId();
    final boolean requireDue = trigger == TriggerSource.SCHEDULE;
    final Instant leaseUntil = now.plus(properties.jobLease());
    if (!recurringJobRepository.tryAcquireLease(jobId, now, leaseUntil, lockedBy, requireDue)) {
      logger.info("recurring job skipped, lease held or not due jobId={} trigger={}", jobId, trigger);
      metrics.recordJobRun("skipped", null);
      return JobRunOutcome.SKIPPED;
    }
    MDC.put(MDC_JOB_ID, jobId.toString());
    try {
      recoverStaleRuns(jobId);
      return executeUnderLease(jobId, trigger, userId);
    } finally {
      releaseLease(jobId, lockedBy);
      MDC.remove(MDC_RUN_ID);
      MDC.remove(MDC_JOB_ID);
    }
  }

  /**
   * リースを取れた時点で残っている PROCESSING の run は、前の保持者がリース切れで手放したものなので FAILED
   * に落として実行回数に数える。
   */
  private void recoverStaleRuns(UUID jobId) {
    final Instant now = Instant.now(clock);
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Integer recovered =
        transactionTemplate.execute(
            status -> {
              final int count = runRepository.failProcessingRuns(jobId, now, STALE_RUN_MESSAGE);
              for (int i = 0; i < count; i++) {
                registry.recordOutcome(jobId, LastRunStatus.FAILED, STALE_RUN_MESSAGE);
              }
              return count;
            });
    if (recovered != null && recovered > 0) {
      logger.warn("recurring job stale runs failed jobId={} count={}", jobId, recovered);
      metrics.recordJobRun("failed", null);
    }
  }

  private JobRunOutcome executeUnderLease(UUID jobId, TriggerSource trigger, String userId) {
    final RecurringJobConfig job = registry.get(jobId);
    final UUID runId = UUID.randomUUID();
    final Instant startedAt = Instant.now(clock);
    try {
      // 一意制約違反は INSERT ごとロールバックし、履歴に空の run を残さない
      final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
      transactionTemplate.executeWithoutResult(
          status -> {
            runRepository.insertPending(runId, jobId, trigger, userId, startedAt);
            if (runRepository.markProcessing(runId, startedAt) == 0) {
              throw new IllegalStateException("run did not enter PROCESSING runId=" + runId);
            }
          });
    } catch (DuplicateKeyException ex) {
      // 部分ユニークインデックス: 同じジョブの別 run がまだ PROCESSING
      logger.warn("recurring job skipped, run already processing jobId={} runId={}", jobId, runId);
      metrics.recordJobRun("skipped", null);
      return JobRunOutcome.SKIPPED;
    }
    MDC.put(MDC_RUN_ID, runId.toString());
    logger.info("recurring job started jobId={} runId={} trigger={}", jobId, runId, trigger);
    try {
      final CompletedRun completed = produce(job, startedAt);
      final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
      transactionTemplate.executeWithoutResult(
          status -> {
            if (runRepository.markCompleted(runId, completed) == 0) {
              throw new IllegalStateException("run left PROCESSING unexpectedly runId=" + runId);
            }
            registry.recordOutcome(jobId, LastRunStatus.SUCCESS, null);
          });
      metrics.recordJobRun("success", Duration.ofMillis(completed.processingTimeMillis()));
      logger.info(
          "recurring job completed jobId={} runId={} records={} emailsSent={}/{}",
          jobId,
          runId,
          completed.recordCount(),
          completed.emailsSent(),
          completed.recipientStatuses().size());
      return JobRunOutcome.COMPLETED;
    } catch (RuntimeException ex) {
      recordFailure(jobId, runId, startedAt, ex);
      return JobRunOutcome.FAILED;
    }
  }

  private CompletedRun produce(RecurringJobConfig job, Instant startedAt) {
    final RenderedArtifact artifact = reportRenderer.render(job.renderSpec());
    final ExportFormat format = job.renderSpec().format();
    final String key = artifactKey(job, startedAt);
    final String location = artifactStorage.store(key, artifact.content(), format.contentType());
    final String fileName = key.substring(key.lastIndexOf('/') + 1);
    final List<RecipientDeliveryStatus> statuses = new ArrayList<>();
    int emailsSent = 0;
    for (String recipient : job.recipients()) {
      try {
        reportMailer.send(
            new ReportMail(recipient, subject(job), fileName, location, format.contentType()));
        statuses.add(RecipientDeliveryStatus.sent(recipient, Instant.now(clock)));
        emailsSent++;
      } catch (RuntimeException ex) {
        // 不正な受信者は記録するだけで run を失敗させない
        logger.warn("report mail failed jobId={} recipient={}", job.jobId(), recipient, ex);
        statuses.add(
            RecipientDeliveryStatus.failed(
                recipient,
                ErrorDetails.message(ex, properties.errorMessageMaxLength()),
                Instant.now(clock)));
      }
    }
    final Instant completedAt = Instant.now(clock);
    return new CompletedRun(
        completedAt,
        Duration.between(startedAt, completedAt).toMillis(),
        key,
        location,
        artifact.size(),
        artifact.recordCount(),
        emailsSent,
        statuses);
  }

  private void recordFailure(UUID jobId, UUID runId, Instant startedAt, RuntimeException ex) {
    final Instant completedAt = Instant.now(clock);
    final long elapsedMillis = Duration.between(startedAt, completedAt).toMillis();
    final String message = ErrorDetails.message(ex, properties.errorMessageMaxLength());
    final String stackTrace = ErrorDetails.stackTrace(ex, properties.stackTraceMaxLength());
    logger.error("recurring job failed jobId={} runId={}", jobId, runId, ex);
    metrics.recordJobRun("failed", Duration.ofMillis(elapsedMillis));
    try {
      final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
      transactionTemplate.executeWithoutResult(
          status -> {
            // 別ワーカーが stale として回収済みなら二重に数えない
            if (runRepository.markFailed(runId, completedAt, elapsedMillis, message, stackTrace) > 0) {
              registry.recordOutcome(jobId, LastRunStatus.FAILED, message);
            }
          });
      // InvalidCadenceException は recordOutcome 側で停止済み
      if (ex instanceof RenderValidationException) {
        registry.setActive(jobId, false);
        logger.warn("recurring job deactivated after permanent failure jobId={}", jobId);
      }
    } catch (RuntimeException recordEx) {
      // run は PROCESSING のまま残り、次にリースを取った tick で FAILED に回収される
      logger.error("recurring job failure could not be recorded jobId={} runId={}", jobId, runId, recordEx);
    }
  }

  private void releaseLease(UUID jobId, String lockedBy) {
    try {
      if (recurringJobRepository.releaseLease(jobId, lockedBy) == 0) {
        logger.warn("recurring job lease was already lost jobId={} lockedBy={}", jobId, lockedBy);
      }
    } catch (DataAccessException ex) {
      logger.warn("recurring job lease release failed, waiting for expiry jobId={}", jobId, ex);
    }
  }

  private static String subject(RecurringJobConfig job) {
    if (job.emailSubject() != null && !job.emailSubject().isBlank()) {
      return job.emailSubject();
    }
    return "Scheduled " + job.kind().name().toLowerCase(Locale.ROOT) + ": " + job.name();
  }

  /** scheduled-exports/{jobId}/{name}_{epochMillis}.{ext}。name は安全な文字列に置き換える。 */
  @VisibleForTesting
  static String artifactKey(RecurringJobConfig job, Instant startedAt) {
    final String slug = job.name().trim().replaceAll("[^A-Za-z0-9._-]+", "_");
    return ARTIFACT_PREFIX
        + "/"
        + job.jobId()
        + "/"
        + slug
        + "_"
        + startedAt.toEpochMilli()
        + "."
        + job.renderSpec().format().extension();
  }
}
