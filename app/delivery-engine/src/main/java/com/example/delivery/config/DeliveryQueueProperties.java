/*
 * どこで: Delivery Engine の設定バインド
 * 何を: 配信キューのバッチ/リトライ/バックオフ/リース/レート制限の設定を保持する
 * なぜ: リトライ方針をコード変更なしで環境ごとに調整するため
 */
package com.example.delivery.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "delivery-engine.queue")
public record DeliveryQueueProperties(
    @Positive int batchSize,
    @Positive int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    @Positive double backoffExponentBase,
    @Positive double backoffJitterMin,
    @Positive double backoffJitterMax,
    @NotNull Duration lease,
    @NotNull Duration channelSendInterval) {}
