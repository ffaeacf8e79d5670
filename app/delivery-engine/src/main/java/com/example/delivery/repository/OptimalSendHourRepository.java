/*
 * どこで: Delivery Engine のデータアクセス
 * 何を: 受信者と通知種別ごとの過去の最適送信時刻を参照する
 * なぜ: 投入時の最適送信時刻補正の元データとするため
 */
package com.example.delivery.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.delivery.model.NotificationType;
import com.example.delivery.service.OptimalSendHourLookup;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OptimalSendHourRepository implements OptimalSendHourLookup {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<LocalTime> bestTime(String recipientId, NotificationType type) {
    final String sql =
        """
        SELECT optimal_hour, optimal_minute
        FROM optimal_send_hours
        WHERE recipient_id = :recipientId
          AND notification_type = :type
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId).addValue("type", type.name());
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> LocalTime.of(rs.getInt("optimal_hour"), rs.getInt("optimal_minute")))
        .stream()
        .findFirst();
  }

  public void upsert(String recipientId, NotificationType type, LocalTime bestTime, Instant now) {
    final String sql =
        """
        INSERT INTO optimal_send_hours (recipient_id, notification_type, optimal_hour, optimal_minute, updated_at)
        VALUES (:recipientId, :type, :hour, :minute, :now)
        ON CONFLICT (recipient_id, notification_type) DO UPDATE
        SET optimal_hour = EXCLUDED.optimal_hour,
            optimal_minute = EXCLUDED.optimal_minute,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", recipientId)
            .addValue("type", type.name())
            .addValue("hour", bestTime.getHour())
            .addValue("minute", bestTime.getMinute())
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }
}
