/*
 * どこで: Delivery Engine の設定バインド
 * 何を: RunExecutor の tick 間隔/リース/ワーカープール設定を保持する
 * なぜ: 運用パラメータを環境ごとに外出しするため
 */
package com.example.delivery.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "delivery-engine.executor")
public record RunExecutorProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @NotNull Duration jobLease,
    @Positive int concurrency,
    @Positive int errorMessageMaxLength,
    @Positive int stackTraceMaxLength,
    @NotNull ZoneId defaultTimezone) {}
