/*
 * どこで: Delivery Engine の設定バインド
 * 何を: 有意差判定の閾値と自動分析の有効/無効を保持する
 * なぜ: 最小サンプルサイズは導出値ではなく運用ポリシーとして決めるため
 */
package com.example.delivery.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "delivery-engine.experiment")
public record ExperimentProperties(
    @Positive int minSampleSize,
    @DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "1.0", inclusive = false)
        double significanceLevel,
    boolean autoAnalyzeEnabled) {}
