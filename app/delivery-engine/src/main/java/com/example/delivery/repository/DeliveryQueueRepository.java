/*
 * どこで: Delivery Engine のデータアクセス
 * 何を: delivery_queue の行を読み取り、状態を遷移させる
 * なぜ: 取得と PROCESSING からの退出をすべて条件付き更新にし、並行ワーカーが衝突しないようにするため
 */
package com.example.delivery.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.delivery.model.DeliveryChannel;
import com.example.delivery.model.DeliveryMethod;
import com.example.delivery.model.DeliveryPriority;
import com.example.delivery.model.DeliveryQueueStats;
import com.example.delivery.model.DeliveryStatsFilter;
import com.example.delivery.model.DeliveryStatus;
import com.example.delivery.model.ExperimentVariant;
import com.example.delivery.model.NotificationType;
import com.example.delivery.model.QueuedDelivery;
import com.fasterxml.jackson.core.type.TypeReference;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryQueueRepository {

  private static final TypeReference<Set<DeliveryChannel>> CHANNEL_SET = new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT delivery_id, recipient_id, notification_type, title, message, action_url, priority,
             delivery_method, scheduled_for, optimal_send_time, status, attempt_count,
             last_attempt_at, next_attempt_at, last_error,
             delivered_channels::text AS delivered_channels_text, experiment_id, variant,
             campaign_id, user_segment, metadata::text AS metadata_text, locked_by, lease_until,
             created_at, updated_at
      FROM delivery_queue
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JsonColumnCodec jsonColumnCodec;

  public UUID insert(QueuedDelivery delivery) {
    final String sql =
        """
        INSERT INTO delivery_queue (
          delivery_id, recipient_id, notification_type, title, message, action_url, priority,
          priority_rank, delivery_method, scheduled_for, optimal_send_time, status, attempt_count,
          last_attempt_at, next_attempt_at, last_error, delivered_channels, experiment_id, variant,
          campaign_id, user_segment, metadata, locked_by, lease_until, created_at, updated_at
        ) VALUES (
          :deliveryId, :recipientId, :notificationType, :title, :message, :actionUrl, :priority,
          :priorityRank, :deliveryMethod, :scheduledFor, :optimalSendTime, :status, :attemptCount,
          :lastAttemptAt, :nextAttemptAt, :lastError, :deliveredChannels::jsonb, :experimentId,
          :variant, :campaignId, :userSegment, :metadata::jsonb, :lockedBy, :leaseUntil,
          :createdAt, :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deliveryId", delivery.deliveryId())
            .addValue("recipientId", delivery.recipientId())
            .addValue("notificationType", delivery.notificationType().name())
            .addValue("title", delivery.title())
            .addValue("message", delivery.message())
            .addValue("actionUrl", delivery.actionUrl())
            .addValue("priority", delivery.priority().name())
            .addValue("priorityRank", delivery.priority().rank())
            .addValue("deliveryMethod", delivery.deliveryMethod().name())
            .addValue("scheduledFor", toTimestamp(delivery.scheduledFor()))
            .addValue("optimalSendTime", delivery.optimalSendTime())
            .addValue("status", delivery.status().name())
            .addValue("attemptCount", delivery.attemptCount())
            .addValue("lastAttemptAt", toTimestamp(delivery.lastAttemptAt()))
            .addValue("nextAttemptAt", toTimestamp(delivery.nextAttemptAt()))
            .addValue("lastError", delivery.lastError())
            .addValue("deliveredChannels", jsonColumnCodec.write(delivery.deliveredChannels()))
            .addValue("experimentId", delivery.experimentId())
            .addValue("variant", delivery.variant() == null ? null : delivery.variant().name())
            .addValue("campaignId", delivery.campaignId())
            .addValue("userSegment", delivery.userSegment())
            .addValue("metadata", delivery.metadataJson())
            .addValue("lockedBy", delivery.lockedBy())
            .addValue("leaseUntil", toTimestamp(delivery.leaseUntil()))
            .addValue("createdAt", toTimestamp(delivery.createdAt()))
            .addValue("updatedAt", toTimestamp(delivery.updatedAt()));
    jdbcTemplate.update(sql, params);
    return delivery.deliveryId();
  }

  public Optional<QueuedDelivery> findById(UUID deliveryId) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("deliveryId", deliveryId);
    return jdbcTemplate
        .query(SELECT_COLUMNS + " WHERE delivery_id = :deliveryId", params, this::mapRow)
        .stream()
        .findFirst();
  }

  /** バックオフは next_attempt_at に持たせ、scheduled_for は投入時の値のまま残す。 */
  public List<QueuedDelivery> findDue(Instant now, int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
             WHERE status = 'QUEUED'
              AND COALESCE(next_attempt_at, scheduled_for) <= :now
            ORDER BY priority_rank DESC, scheduled_for ASC, delivery_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markProcessing(UUID deliveryId, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        UPDATE delivery_queue
        SET status = 'PROCESSING',
            attempt_count = attempt_count + 1,
            last_attempt_at = :now,
            locked_by = :lockedBy,
            lease_until = :leaseUntil,
            updated_at = :now
        WHERE delivery_id = :deliveryId
          AND status = 'QUEUED'
          AND COALESCE(next_attempt_at, scheduled_for) <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deliveryId", deliveryId)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int addDeliveredChannel(UUID deliveryId, DeliveryChannel channel, String lockedBy, Instant now) {
    final String sql =
        """
        UPDATE delivery_queue
        SET delivered_channels = delivered_channels || jsonb_build_array(CAST(:channel AS text)),
            updated_at = :now
        WHERE delivery_id = :deliveryId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
          AND NOT (delivered_channels @> jsonb_build_array(CAST(:channel AS text)))
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deliveryId", deliveryId)
            .addValue("channel", channel.name())
            .addValue("lockedBy", lockedBy)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markSent(UUID deliveryId, Instant now, String lockedBy) {
    final String sql =
        """
        UPDATE delivery_queue
        SET status = 'SENT',
            last_error = NULL,
            next_attempt_at = NULL,
            locked_by = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE delivery_id = :deliveryId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deliveryId", deliveryId)
            .addValue("now", toTimestamp(now))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markRequeued(
      UUID deliveryId, Instant nextAttemptAt, String error, Instant now, String lockedBy) {
    final String sql =
        """
        UPDATE delivery_queue
        SET status = 'QUEUED',
            next_attempt_at = :nextAttemptAt,
            last_error = :error,
            locked_by = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE delivery_id = :deliveryId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deliveryId", deliveryId)
            .addValue("nextAttemptAt", toTimestamp(nextAttemptAt))
            .addValue("error", error)
            .addValue("now", toTimestamp(now))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(UUID deliveryId, String error, Instant now, String lockedBy) {
    final String sql =
        """
        UPDATE delivery_queue
        SET status = 'FAILED',
            next_attempt_at = NULL,
            last_error = :error,
            locked_by = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE delivery_id = :deliveryId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deliveryId", deliveryId)
            .addValue("error", error)
            .addValue("now", toTimestamp(now))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int cancel(UUID deliveryId, Instant now) {
    final String sql =
        """
        UPDATE delivery_queue
        SET status = 'CANCELLED',
            updated_at = :now
        WHERE delivery_id = :deliveryId
          AND status = 'QUEUED'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deliveryId", deliveryId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * 役割: リースが切れた PROCESSING の行をキューへ戻す。
   * 動作: 試行回数を使い切った行は FAILED にする。配信済みとして記録されたチャネルは保持する。
   */
  public int recoverExpiredLeases(Instant now, int maxAttempts) {
    final String sql =
        """
        UPDATE delivery_queue
        SET status = CASE WHEN attempt_count >= :maxAttempts THEN 'FAILED' ELSE 'QUEUED' END,
            last_error = 'processing lease expired',
            next_attempt_at = NULL,
            locked_by = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE status = 'PROCESSING'
          AND lease_until <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("maxAttempts", maxAttempts);
    return jdbcTemplate.update(sql, params);
  }

  public int countDue(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM delivery_queue
        WHERE status = 'QUEUED'
          AND COALESCE(next_attempt_at, scheduled_for) <= :now
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public DeliveryQueueStats stats(DeliveryStatsFilter filter) {
    final StringBuilder sql =
        new StringBuilder("SELECT status, COUNT(*) AS cnt FROM delivery_queue WHERE 1 = 1");
    final MapSqlParameterSource params = new MapSqlParameterSource();
    if (filter.recipientId() != null) {
      sql.append(" AND recipient_id = :recipientId");
      params.addValue("recipientId", filter.recipientId());
    }
    if (filter.campaignId() != null) {
      sql.append(" AND campaign_id = :campaignId");
      params.addValue("campaignId", filter.campaignId());
    }
    if (filter.from() != null) {
      sql.append(" AND created_at >= :from");
      params.addValue("from", toTimestamp(filter.from()));
    }
    if (filter.to() != null) {
      sql.append(" AND created_at <= :to");
      params.addValue("to", toTimestamp(filter.to()));
    }
    sql.append(" GROUP BY status");
    final Map<DeliveryStatus, Long> counts = new EnumMap<>(DeliveryStatus.class);
    jdbcTemplate.query(
        sql.toString(),
        params,
        rs -> {
          counts.put(DeliveryStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
        });
    final long total = counts.values().stream().mapToLong(Long::longValue).sum();
    return new DeliveryQueueStats(
        total,
        counts.getOrDefault(DeliveryStatus.QUEUED, 0L),
        counts.getOrDefault(DeliveryStatus.PROCESSING, 0L),
        counts.getOrDefault(DeliveryStatus.SENT, 0L),
        counts.getOrDefault(DeliveryStatus.FAILED, 0L),
        counts.getOrDefault(DeliveryStatus.CANCELLED, 0L));
  }

  private QueuedDelivery mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String experimentId = rs.getString("experiment_id");
    final String variant = rs.getString("variant");
    return new QueuedDelivery(
        UUID.fromString(rs.getString("delivery_id")),
        rs.getString("recipient_id"),
        NotificationType.valueOf(rs.getString("notification_type")),
        rs.getString("title"),
        rs.getString("message"),
        rs.getString("action_url"),
        DeliveryPriority.valueOf(rs.getString("priority")),
        DeliveryMethod.valueOf(rs.getString("delivery_method")),
        toInstant(rs.getTimestamp("scheduled_for")),
        rs.getBoolean("optimal_send_time"),
        DeliveryStatus.valueOf(rs.getString("status")),
        rs.getInt("attempt_count"),
        toInstant(rs.getTimestamp("last_attempt_at")),
        toInstant(rs.getTimestamp("next_attempt_at")),
        rs.getString("last_error"),
        jsonColumnCodec.read(rs.getString("delivered_channels_text"), CHANNEL_SET),
        experimentId == null ? null : UUID.fromString(experimentId),
        variant == null ? null : ExperimentVariant.valueOf(variant),
        rs.getString("campaign_id"),
        rs.getString("user_segment"),
        rs.getString("metadata_text"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("lease_until")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
