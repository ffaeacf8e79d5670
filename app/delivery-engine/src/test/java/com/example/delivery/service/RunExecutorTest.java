/*
 * どこで: RunExecutor の単体テスト
 * 何を: tick の展開、処理単位の分離、集計、手動起動を検証する
 * なぜ: 1 件のジョブや配信の失敗で tick の残りを中断させないため
 */
package com.example.delivery.service;

import static com.example.delivery.service.ServiceFixtures.QUEUE_PROPERTIES;
import static com.example.delivery.service.ServiceFixtures.delivery;
import static com.example.delivery.service.ServiceFixtures.weeklyJob;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.delivery.config.ExperimentProperties;
import com.example.delivery.experiment.ExperimentAnalysisService;
import com.example.delivery.model.DeliveryMethod;
import com.example.delivery.model.DeliveryStatus;
import com.example.delivery.model.QueuedDelivery;
import com.example.delivery.model.RecurringJobConfig;
import com.example.delivery.model.TriggerSource;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class RunExecutorTest {

  private static final Instant NOW = Instant.parse("2026-03-09T06:00:00Z");

  @Mock private RecurringJobRegistry registry;
  @Mock private RecurringJobRunner jobRunner;
  @Mock private DeliveryQueue deliveryQueue;
  @Mock private DeliveryDispatcher dispatcher;
  @Mock private ExperimentAnalysisService experimentAnalysisService;
  @Mock private DeliveryEngineMetrics metrics;

  @Test
  void tickRunsDueJobsAndDeliveriesAndIsolatesFailures() {
    final RecurringJobConfig ok = weeklyJob(UUID.randomUUID(), NOW, List.of());
    final RecurringJobConfig broken = weeklyJob(UUID.randomUUID(), NOW, List.of());
    final RecurringJobConfig failing = weeklyJob(UUID.randomUUID(), NOW, List.of());
    when(registry.dueJobs(NOW)).thenReturn(List.of(ok, broken, failing));
    when(jobRunner.run(ok.jobId(), TriggerSource.SCHEDULE, null, NOW)).thenReturn(JobRunOutcome.COMPLETED);
    when(jobRunner.run(broken.jobId(), TriggerSource.SCHEDULE, null, NOW))
        .thenThrow(new IllegalStateException("boom"));
    when(jobRunner.run(failing.jobId(), TriggerSource.SCHEDULE, null, NOW)).thenReturn(JobRunOutcome.FAILED);
    final QueuedDelivery first = queued();
    final QueuedDelivery second = queued();
    when(deliveryQueue.recoverExpiredLeases(NOW)).thenReturn(2);
    when(deliveryQueue.dueDeliveries(NOW, QUEUE_PROPERTIES.batchSize())).thenReturn(List.of(first, second));
    when(dispatcher.dispatch(first.deliveryId(), NOW)).thenReturn(DispatchResult.SENT);
    when(dispatcher.dispatch(second.deliveryId(), NOW)).thenReturn(DispatchResult.REQUEUED);
    when(experimentAnalysisService.analyzeActive(NOW)).thenReturn(1);
    when(deliveryQueue.countDueBacklog(NOW)).thenReturn(5);

    final TickReport report = executor(Runnable::run, true).tick(NOW);

    assertThat(report.jobsCompleted()).isEqualTo(1);
    assertThat(report.jobsFailed()).isEqualTo(2);
    assertThat(report.jobsSkipped()).isZero();
    assertThat(report.deliveriesSent()).isEqualTo(1);
    assertThat(report.deliveriesRequeued()).isEqualTo(1);
    assertThat(report.leasesRecovered()).isEqualTo(2);
    assertThat(report.winnersDeclared()).isEqualTo(1);
    verify(metrics).updateBacklogCurrent(5);
  }

  @Test
  void jobSelectionFailureStillProcessesDeliveries() {
    final QueuedDelivery due = queued();
    when(registry.dueJobs(NOW)).thenThrow(new IllegalStateException("db down"));
    when(deliveryQueue.dueDeliveries(NOW, QUEUE_PROPERTIES.batchSize())).thenReturn(List.of(due));
    when(dispatcher.dispatch(due.deliveryId(), NOW)).thenReturn(DispatchResult.FAILED);

    final TickReport report = executor(Runnable::run, false).tick(NOW);

    assertThat(report.jobsCompleted() + report.jobsFailed() + report.jobsSkipped()).isZero();
    assertThat(report.deliveriesFailed()).isEqualTo(1);
    verifyNoInteractions(jobRunner, experimentAnalysisService);
  }

  @Test
  void dueJobsRunInParallelOnThePool() throws Exception {
    final int jobs = 4;
    final CountDownLatch allStarted = new CountDownLatch(jobs);
    final List<RecurringJobConfig> due =
        List.of(
            weeklyJob(UUID.randomUUID(), NOW, List.of()),
            weeklyJob(UUID.randomUUID(), NOW, List.of()),
            weeklyJob(UUID.randomUUID(), NOW, List.of()),
            weeklyJob(UUID.randomUUID(), NOW, List.of()));
    when(registry.dueJobs(NOW)).thenReturn(due);
    when(jobRunner.run(any(UUID.class), eq(TriggerSource.SCHEDULE), isNull(), eq(NOW)))
        .thenAnswer(
            invocation -> {
              allStarted.countDown();
              // 全ジョブが同時に走っている場合だけ完了する
              return allStarted.await(5, TimeUnit.SECONDS) ? JobRunOutcome.COMPLETED : JobRunOutcome.FAILED;
            });
    final ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
    pool.setCorePoolSize(jobs);
    pool.setMaxPoolSize(jobs);
    pool.initialize();
    try {
      final TickReport report = executor(pool, false).tick(NOW);

      assertThat(report.jobsCompleted()).isEqualTo(jobs);
    } finally {
      pool.shutdown();
    }
  }

  @Test
  void manualTriggerOfUnknownJobThrows() {
    final UUID jobId = UUID.randomUUID();
    when(registry.get(jobId)).thenThrow(new RecurringJobNotFoundException(jobId));

    assertThatThrownBy(() -> executor(Runnable::run, true).triggerManually(jobId, "user-1"))
        .isInstanceOf(RecurringJobNotFoundException.class);
    verify(jobRunner, never()).run(any(), any(), any(), any());
  }

  @Test
  void manualTriggerRunsWithManualSource() {
    final UUID jobId = UUID.randomUUID();
    when(registry.get(jobId)).thenReturn(weeklyJob(jobId, NOW, List.of()));
    when(jobRunner.run(jobId, TriggerSource.MANUAL, "user-1", NOW)).thenReturn(JobRunOutcome.COMPLETED);

    assertThat(executor(Runnable::run, true).triggerManually(jobId, "user-1"))
        .isEqualTo(JobRunOutcome.COMPLETED);
  }

  private RunExecutor executor(Executor pool, boolean autoAnalyze) {
    return new RunExecutor(
        registry,
        jobRunner,
        deliveryQueue,
        dispatcher,
        experimentAnalysisService,
        QUEUE_PROPERTIES,
        new ExperimentProperties(30, 0.05d, autoAnalyze),
        metrics,
        pool,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static QueuedDelivery queued() {
    return delivery(
        UUID.randomUUID(), DeliveryStatus.QUEUED, 0, null, DeliveryMethod.PUSH, Set.of(), null, null);
  }
}
