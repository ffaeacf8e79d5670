package com.example.delivery.service;

import com.example.delivery.schedule.Cadence;
import java.time.Instant;
import java.util.UUID;

/** このプロセスが把握している有効な定期ジョブ 1 件。 */
public record RegisteredTask(UUID jobId, String name, Cadence cadence, String timezone, Instant nextRunAt) {}
