/*
 * どこで: 実験のモデル
 * 何を: experiments テーブル 1 行のスナップショット
 * なぜ: 自動分析で主要指標/オーナー/現在の勝者状態を参照するため
 */
package com.example.delivery.model;

import java.time.Instant;
import java.util.UUID;

public record Experiment(
    UUID experimentId,
    String name,
    String ownerId,
    OutcomeMetric primaryMetric,
    ExperimentStatus status,
    ExperimentVariant winner,
    Instant winnerDeterminedAt,
    Instant createdAt) {}
