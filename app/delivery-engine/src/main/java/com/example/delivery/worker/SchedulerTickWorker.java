/*
 * どこで: Delivery Engine のワーカー
 * 何を: 固定間隔で RunExecutor の tick を起動する
 * なぜ: スケジュール済みジョブと配信バッチの起点を tick だけにするため
 */
package com.example.delivery.worker;

import com.example.delivery.service.RunExecutor;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "delivery-engine.executor.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SchedulerTickWorker {

  private final RunExecutor runExecutor;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${delivery-engine.executor.poll-interval}")
  public void run() {
    runExecutor.tick(Instant.now(clock));
  }
}
