/*
 * どこで: Delivery Engine のデータアクセス
 * 何を: recurring_job_runs と一方向の状態遷移を永続化する
 * なぜ: すべての遷移を直前の状態で条件付けし、run が後戻りしないようにするため
 */
package com.example.delivery.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.delivery.model.RecipientDeliveryStatus;
import com.example.delivery.model.RecurringJobRun;
import com.example.delivery.model.RunStatus;
import com.example.delivery.model.TriggerSource;
import com.fasterxml.jackson.core.type.TypeReference;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RecurringJobRunRepository {

  private static final TypeReference<List<RecipientDeliveryStatus>> RECIPIENT_STATUS_LIST =
      new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT run_id, job_id, status, triggered_by, triggered_by_user_id, started_at, completed_at,
             processing_time_ms, artifact_key, artifact_location, artifact_size, record_count,
             emails_sent, recipient_statuses::text AS recipient_statuses_text, error_message,
             stack_trace, created_at
      FROM recurring_job_runs
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JsonColumnCodec jsonColumnCodec;

  public UUID insertPending(UUID runId, UUID jobId, TriggerSource triggeredBy, String userId, Instant now) {
    final String sql =
        """
        INSERT INTO recurring_job_runs (
          run_id, job_id, status, triggered_by, triggered_by_user_id, created_at
        ) VALUES (
          :runId, :jobId, 'PENDING', :triggeredBy, :userId, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("jobId", jobId)
            .addValue("triggeredBy", triggeredBy.name())
            .addValue("userId", userId)
            .addValue("createdAt", toTimestamp(now));
    jdbcTemplate.update(sql, params);
    return runId;
  }

  public int markProcessing(UUID runId, Instant startedAt) {
    final String sql =
        """
        UPDATE recurring_job_runs
        SET status = 'PROCESSING',
            started_at = :startedAt
        WHERE run_id = :runId
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("startedAt", toTimestamp(startedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markCompleted(UUID runId, CompletedRun completed) {
    final String sql =
        """
        UPDATE recurring_job_runs
        SET status = 'COMPLETED',
            completed_at = :completedAt,
            processing_time_ms = :processingTimeMs,
            artifact_key = :artifactKey,
            artifact_location = :artifactLocation,
            artifact_size = :artifactSize,
            record_count = :recordCount,
            emails_sent = :emailsSent,
            recipient_statuses = :recipientStatuses::jsonb
        WHERE run_id = :runId
          AND status = 'PROCESSING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("completedAt", toTimestamp(completed.completedAt()))
            .addValue("processingTimeMs", completed.processingTimeMillis())
            .addValue("artifactKey", completed.artifactKey())
            .addValue("artifactLocation", completed.artifactLocation())
            .addValue("artifactSize", completed.artifactSize())
            .addValue("recordCount", completed.recordCount())
            .addValue("emailsSent", completed.emailsSent())
            .addValue("recipientStatuses", jsonColumnCodec.write(completed.recipientStatuses()));
    return jdbcTemplate.update(sql, params);
  }

  /** PROCESSING に入れなかった run は PENDING から直接 FAILED にする。 */
  public int markFailed(
      UUID runId, Instant completedAt, long processingTimeMillis, String errorMessage, String stackTrace) {
    final String sql =
        """
        UPDATE recurring_job_runs
        SET status = 'FAILED',
            completed_at = :completedAt,
            processing_time_ms = :processingTimeMs,
            error_message = :errorMessage,
            stack_trace = :stackTrace
        WHERE run_id = :runId
          AND status IN ('PENDING', 'PROCESSING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("processingTimeMs", processingTimeMillis)
            .addValue("errorMessage", errorMessage)
            .addValue("stackTrace", stackTrace);
    return jdbcTemplate.update(sql, params);
  }

  /** リースを失った保持者が残した PROCESSING の run をまとめて FAILED にする。 */
  public int failProcessingRuns(UUID jobId, Instant completedAt, String errorMessage) {
    final String sql =
        """
        UPDATE recurring_job_runs
        SET status = 'FAILED',
            completed_at = :completedAt,
            error_message = :errorMessage
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("errorMessage", errorMessage);
    return jdbcTemplate.update(sql, params);
  }

  public Optional<RecurringJobRun> findById(UUID runId) {
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("runId", runId);
    return jdbcTemplate.query(SELECT_COLUMNS + " WHERE run_id = :runId", params, this::mapRow).stream()
        .findFirst();
  }

  public List<RecurringJobRun> findByJobId(UUID jobId, int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
             WHERE job_id = :jobId
            ORDER BY created_at DESC, run_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countByJobIdAndStatus(UUID jobId, RunStatus status) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM recurring_job_runs
        WHERE job_id = :jobId
          AND status = :status
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("status", status.name());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private RecurringJobRun mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RecurringJobRun(
        UUID.fromString(rs.getString("run_id")),
        UUID.fromString(rs.getString("job_id")),
        RunStatus.valueOf(rs.getString("status")),
        TriggerSource.valueOf(rs.getString("triggered_by")),
        rs.getString("triggered_by_user_id"),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("completed_at")),
        rs.getObject("processing_time_ms", Long.class),
        rs.getString("artifact_key"),
        rs.getString("artifact_location"),
        rs.getObject("artifact_size", Long.class),
        rs.getObject("record_count", Integer.class),
        rs.getInt("emails_sent"),
        jsonColumnCodec.read(rs.getString("recipient_statuses_text"), RECIPIENT_STATUS_LIST),
        rs.getString("error_message"),
        rs.getString("stack_trace"),
        toInstant(rs.getTimestamp("created_at")));
  }

  /** run 完了時に書き込む結果カラム。 */
  public record CompletedRun(
      Instant completedAt,
      long processingTimeMillis,
      String artifactKey,
      String artifactLocation,
      long artifactSize,
      int recordCount,
      int emailsSent,
      List<RecipientDeliveryStatus> recipientStatuses) {

    public CompletedRun {
      recipientStatuses = recipientStatuses == null ? List.of() : List.copyOf(recipientStatuses);
    }
  }
}
