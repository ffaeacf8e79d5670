/*
 * どこで: Delivery Engine の設定
 * 何を: RunExecutor が使う上限付きワーカープールを定義する
 * なぜ: 1 件の送信/レンダリング I/O が tick 全体を止めないようにするため
 */
package com.example.delivery.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

  @Bean(name = "runExecutorPool")
  public ThreadPoolTaskExecutor runExecutorPool(RunExecutorProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.concurrency());
    executor.setMaxPoolSize(properties.concurrency());
    // tick は一度に 1 バッチしか投入しないため、無制限キューでもそのバッチ分しか溜まらない
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("run-executor-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
