/*
 * どこで: Delivery Engine のサービス層
 * 何を: ジョブ実行/配信/滞留/登録タスク/実験のメトリクスを記録する
 * なぜ: テーブルを読まずに Prometheus からスケジューリングとリトライの挙動を観測するため
 */
package com.example.delivery.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class DeliveryEngineMetrics {

  private static final String METRIC_JOB_RUN_TOTAL = "delivery_engine.job.run.total";
  private static final String METRIC_JOB_RUN_DURATION = "delivery_engine.job.run.duration";
  private static final String METRIC_DELIVERY_TOTAL = "delivery_engine.delivery.total";
  private static final String METRIC_BACKLOG_CURRENT = "delivery_engine.delivery.backlog.current";
  private static final String METRIC_REGISTERED_TASKS = "delivery_engine.registered.tasks";
  private static final String METRIC_EXPERIMENT_WINNER_TOTAL = "delivery_engine.experiment.winner.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final AtomicInteger registeredTasks = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> jobRunCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Timer jobRunDurationTimer;
  private final Counter experimentWinnerCounter;

  public DeliveryEngineMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Queued deliveries that are due now")
        .register(meterRegistry);
    Gauge.builder(METRIC_REGISTERED_TASKS, registeredTasks, AtomicInteger::get)
        .description("Active recurring jobs registered in this process")
        .register(meterRegistry);
    this.jobRunDurationTimer =
        Timer.builder(METRIC_JOB_RUN_DURATION)
            .description("Wall time of one recurring job execution")
            .register(meterRegistry);
    this.experimentWinnerCounter =
        Counter.builder(METRIC_EXPERIMENT_WINNER_TOTAL)
            .description("Experiments completed with a significant winner")
            .register(meterRegistry);
  }

  public void recordJobRun(String result, Duration duration) {
    counter(jobRunCounters, METRIC_JOB_RUN_TOTAL, "Recurring job run outcomes", result).increment();
    if (duration != null && !duration.isNegative()) {
      jobRunDurationTimer.record(duration);
    }
  }

  public void recordDeliveryResult(String result) {
    counter(deliveryCounters, METRIC_DELIVERY_TOTAL, "Delivery attempt outcomes", result).increment();
  }

  public void recordExperimentWinner() {
    experimentWinnerCounter.increment();
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  public void updateRegisteredTasks(int count) {
    registeredTasks.set(Math.max(count, 0));
  }

  private Counter counter(
      ConcurrentMap<String, Counter> counters, String name, String description, String result) {
    return counters.computeIfAbsent(
        result,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of("result", result))
                .register(meterRegistry));
  }
}
