/*
 * どこで: Delivery Engine のサービス層
 * 何を: tick の単一入口として期限到来のジョブと配信をワーカープールで実行する
 * なぜ: 1 件の I/O が他を待たせず、どの処理も tick を中断させないため
 */
package com.example.delivery.service;

import com.example.delivery.config.DeliveryQueueProperties;
import com.example.delivery.config.ExperimentProperties;
import com.example.delivery.experiment.ExperimentAnalysisService;
import com.example.delivery.model.QueuedDelivery;
import com.example.delivery.model.RecurringJobConfig;
import com.example.delivery.model.TriggerSource;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class RunExecutor {

  private static final Logger logger = LoggerFactory.getLogger(RunExecutor.class);

  private final RecurringJobRegistry registry;
  private final RecurringJobRunner jobRunner;
  private final DeliveryQueue deliveryQueue;
  private final DeliveryDispatcher deliveryDispatcher;
  private final ExperimentAnalysisService experimentAnalysisService;
  private final DeliveryQueueProperties queueProperties;
  private final ExperimentProperties experimentProperties;
  private final DeliveryEngineMetrics metrics;
  private final Executor runExecutorPool;
  private final Clock clock;

  public RunExecutor(
      RecurringJobRegistry registry,
      RecurringJobRunner jobRunner,
      DeliveryQueue deliveryQueue,
      DeliveryDispatcher deliveryDispatcher,
      ExperimentAnalysisService experimentAnalysisService,
      DeliveryQueueProperties queueProperties,
      ExperimentProperties experimentProperties,
      DeliveryEngineMetrics metrics,
      @Qualifier("runExecutorPool") Executor runExecutorPool,
      Clock clock) {
    this.registry = registry;
    this.jobRunner = jobRunner;
    this.deliveryQueue = deliveryQueue;
    this.deliveryDispatcher = deliveryDispatcher;
    this.experimentAnalysisService = experimentAnalysisService;
    this.queueProperties = queueProperties;
    this.experimentProperties = experimentProperties;
    this.metrics = metrics;
    this.runExecutorPool = runExecutorPool;
    this.clock = clock;
  }

  /**
   * 役割: {@code now} で期限到来のジョブを各 1 回実行し、期限到来の配信を 1 バッチ処理する。
   * 動作: 両方を上限付きプールで並行実行し、すべて終わってから返る。
   */
  public TickReport tick(Instant now) {
    final List<CompletableFuture<JobRunOutcome>> jobs = submitDueJobs(now);
    final int recovered = recoverExpiredLeases(now);
    final List<CompletableFuture<DispatchResult>> deliveries = submitDueDeliveries(now);

    int jobsCompleted = 0;
    int jobsFailed = 0;
    int jobsSkipped = 0;
    for (CompletableFuture<JobRunOutcome> future : jobs) {
      switch (future.join()) {
        case COMPLETED -> jobsCompleted++;
        case FAILED -> jobsFailed++;
        case SKIPPED -> jobsSkipped++;
        default -> throw new IllegalStateException("unexpected job outcome");
      }
    }
    int sent = 0;
    int requeued = 0;
    int failed = 0;
    int skipped = 0;
    for (CompletableFuture<DispatchResult> future : deliveries) {
      switch (future.join()) {
        case SENT -> sent++;
        case REQUEUED -> requeued++;
        case FAILED -> failed++;
        case SKIPPED -> skipped++;
        default -> throw new IllegalStateException("unexpected dispatch result");
      }
    }
    final int winners = analyzeExperiments(now);
    updateBacklog(now);
    final TickReport report =
        new TickReport(
            jobsCompleted, jobsFailed, jobsSkipped, sent, requeued, failed, skipped, recovered, winners);
    logger.info("tick finished now={} report={}", now, report);
    return report;
  }

  /** スケジュールに関係なく今すぐ実行する。実行中の run との重複は引き続き拒否する。 */
  public JobRunOutcome triggerManually(UUID jobId, String userId) {
    registry.get(jobId);
    logger.info("recurring job manual trigger jobId={} userId={}", jobId, userId);
    return jobRunner.run(jobId, TriggerSource.MANUAL, userId, Instant.now(clock));
  }

  private List<CompletableFuture<JobRunOutcome>> submitDueJobs(Instant now) {
    final List<RecurringJobConfig> due;
    try {
      due = registry.dueJobs(now);
    } catch (RuntimeException ex) {
      logger.error("due job selection failed now={}", now, ex);
      return List.of();
    }
    return due.stream()
        .map(job -> CompletableFuture.supplyAsync(() -> runJob(job.jobId(), now), runExecutorPool))
        .toList();
  }

  private JobRunOutcome runJob(UUID jobId, Instant now) {
    try {
      return jobRunner.run(jobId, TriggerSource.SCHEDULE, null, now);
    } catch (RuntimeException ex) {
      logger.error("recurring job execution aborted jobId={}", jobId, ex);
      return JobRunOutcome.FAILED;
    }
  }

  private int recoverExpiredLeases(Instant now) {
    try {
      return deliveryQueue.recoverExpiredLeases(now);
    } catch (RuntimeException ex) {
      logger.error("delivery lease recovery failed now={}", now, ex);
      return 0;
    }
  }

  private List<CompletableFuture<DispatchResult>> submitDueDeliveries(Instant now) {
    final List<QueuedDelivery> due;
    try {
      due = deliveryQueue.dueDeliveries(now, queueProperties.batchSize());
    } catch (RuntimeException ex) {
      logger.error("due delivery selection failed now={}", now, ex);
      return List.of();
    }
    return due.stream()
        .map(
            delivery ->
                CompletableFuture.supplyAsync(
                    () -> deliveryDispatcher.dispatch(delivery.deliveryId(), now), runExecutorPool))
        .toList();
  }

  private int analyzeExperiments(Instant now) {
    if (!experimentProperties.autoAnalyzeEnabled()) {
      return 0;
    }
    try {
      return experimentAnalysisService.analyzeActive(now);
    } catch (RuntimeException ex) {
      logger.error("experiment auto-analysis failed now={}", now, ex);
      return 0;
    }
  }

  private void updateBacklog(Instant now) {
    try {
      metrics.updateBacklogCurrent(deliveryQueue.countDueBacklog(now));
    } catch (RuntimeException ex) {
      logger.warn("delivery backlog count failed now={}", now, ex);
    }
  }
}
