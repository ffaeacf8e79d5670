/*
 * どこで: Delivery Engine のサービス層
 * 何を: ジョブ ID をキーにした有効な定期ジョブのプロセス内テーブル
 * なぜ: 起動時に DB から再構築し、再起動がメモリ上の状態に依存しないようにするため
 */
package com.example.delivery.service;

import com.example.delivery.model.RecurringJobConfig;
import com.example.delivery.repository.RecurringJobRepository;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RegisteredTasks {

  private static final Logger logger = LoggerFactory.getLogger(RegisteredTasks.class);

  private final RecurringJobRepository recurringJobRepository;
  private final DeliveryEngineMetrics metrics;
  private final ConcurrentMap<UUID, RegisteredTask> tasks = new ConcurrentHashMap<>();

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    rebuild();
  }

  /** テーブル全体を現在保存されている有効ジョブで置き換える。 */
  public synchronized int rebuild() {
    final List<RecurringJobConfig> active = recurringJobRepository.findAllActive();
    tasks.clear();
    active.forEach(this::register);
    metrics.updateRegisteredTasks(tasks.size());
    logger.info("registered tasks rebuilt count={}", tasks.size());
    return tasks.size();
  }

  /** 有効なジョブのエントリを追加/更新する。無効なジョブは取り除く。 */
  public void register(RecurringJobConfig job) {
    if (!job.active()) {
      unregister(job.jobId());
      return;
    }
    tasks.put(
        job.jobId(),
        new RegisteredTask(
            job.jobId(),
            job.name(),
            job.cadence().cadence(),
            job.cadence().timezone().getId(),
            job.nextRunAt()));
    metrics.updateRegisteredTasks(tasks.size());
  }

  public void unregister(UUID jobId) {
    if (tasks.remove(jobId) != null) {
      metrics.updateRegisteredTasks(tasks.size());
    }
  }

  public Optional<RegisteredTask> get(UUID jobId) {
    return Optional.ofNullable(tasks.get(jobId));
  }

  public List<RegisteredTask> snapshot() {
    return tasks.values().stream()
        .sorted(Comparator.comparing(RegisteredTask::nextRunAt).thenComparing(RegisteredTask::jobId))
        .toList();
  }

  public int size() {
    return tasks.size();
  }
}
