/*
 * どこで: Delivery Engine のデータアクセス
 * 何を: recurring_jobs の読み書きとジョブ単位の実行リースを扱う
 * なぜ: 期限到来の選択/リース取得/結果カウンタをそれぞれ単一の SQL で行うため
 */
package com.example.delivery.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.delivery.model.ExportFormat;
import com.example.delivery.model.FilterExpression;
import com.example.delivery.model.JobKind;
import com.example.delivery.model.LastRunStatus;
import com.example.delivery.model.RecurringJobConfig;
import com.example.delivery.model.RenderSpec;
import com.example.delivery.schedule.Cadence;
import com.example.delivery.schedule.CadenceSpec;
import com.fasterxml.jackson.core.type.TypeReference;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RecurringJobRepository {

  private static final TypeReference<List<FilterExpression>> FILTER_LIST = new TypeReference<>() {};
  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT job_id, name, kind, cadence, time_of_day, day_of_week, day_of_month, cron_expression,
             timezone, template_kind, export_format, render_filters::text AS render_filters_text,
             render_columns::text AS render_columns_text, recipients::text AS recipients_text,
             email_subject, active, last_run_at, next_run_at, last_run_status, last_run_error,
             run_count, success_count, failure_count, locked_by, lease_until, created_by,
             created_at, updated_at
      FROM recurring_jobs
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JsonColumnCodec jsonColumnCodec;

  public UUID insert(RecurringJobConfig job) {
    final String sql =
        """
        INSERT INTO recurring_jobs (
          job_id, name, kind, cadence, time_of_day, day_of_week, day_of_month, cron_expression,
          timezone, template_kind, export_format, render_filters, render_columns, recipients,
          email_subject, active, last_run_at, next_run_at, last_run_status, last_run_error,
          run_count, success_count, failure_count, locked_by, lease_until, created_by,
          created_at, updated_at
        ) VALUES (
          :jobId, :name, :kind, :cadence, :timeOfDay, :dayOfWeek, :dayOfMonth, :cronExpression,
          :timezone, :templateKind, :exportFormat, :renderFilters::jsonb, :renderColumns::jsonb,
          :recipients::jsonb, :emailSubject, :active, :lastRunAt, :nextRunAt, :lastRunStatus,
          :lastRunError, :runCount, :successCount, :failureCount, :lockedBy, :leaseUntil,
          :createdBy, :createdAt, :updatedAt
        )
        """;
    final CadenceSpec cadence = job.cadence();
    final RenderSpec render = job.renderSpec();
    final MapSqlParameterSource params =
        cadenceParams(cadence)
            .addValue("jobId", job.jobId())
            .addValue("name", job.name())
            .addValue("kind", job.kind().name())
            .addValue("templateKind", render.templateKind())
            .addValue("exportFormat", render.format().name())
            .addValue("renderFilters", jsonColumnCodec.write(render.filters()))
            .addValue("renderColumns", jsonColumnCodec.write(render.columns()))
            .addValue("recipients", jsonColumnCodec.write(job.recipients()))
            .addValue("emailSubject", job.emailSubject())
            .addValue("active", job.active())
            .addValue("lastRunAt", toTimestamp(job.lastRunAt()))
            .addValue("nextRunAt", toTimestamp(job.nextRunAt()))
            .addValue("lastRunStatus", job.lastRunStatus().name())
            .addValue("lastRunError", job.lastRunError())
            .addValue("runCount", job.runCount())
            .addValue("successCount", job.successCount())
            .addValue("failureCount", job.failureCount())
            .addValue("lockedBy", job.lockedBy())
            .addValue("leaseUntil", toTimestamp(job.leaseUntil()))
            .addValue("createdBy", job.createdBy())
            .addValue("createdAt", toTimestamp(job.createdAt()))
            .addValue("updatedAt", toTimestamp(job.updatedAt()));
    jdbcTemplate.update(sql, params);
    return job.jobId();
  }

  public Optional<RecurringJobConfig> findById(UUID jobId) {
    final String sql = SELECT_COLUMNS + " WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<RecurringJobConfig> findAll() {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " ORDER BY created_at, job_id", new MapSqlParameterSource(), this::mapRow);
  }

  public List<RecurringJobConfig> findAllActive() {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " WHERE active ORDER BY next_run_at, job_id",
        new MapSqlParameterSource(),
        this::mapRow);
  }

  public List<RecurringJobConfig> findDue(Instant now) {
    final String sql =
        SELECT_COLUMNS
            + """
             WHERE active
              AND next_run_at <= :now
            ORDER BY next_run_at, job_id
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * 役割: リースカラムに対する compare-and-set。
   * 動作: 他ワーカーの有効なリースがない場合だけ成功する。requireDue が true なら、ジョブが有効で期限到来していることも条件にする。
   */
  public boolean tryAcquireLease(
      UUID jobId, Instant now, Instant leaseUntil, String lockedBy, boolean requireDue) {
    final String sql =
        """
        UPDATE recurring_jobs
        SET locked_by = :lockedBy,
            lease_until = :leaseUntil
        WHERE job_id = :jobId
          AND (lease_until IS NULL OR lease_until <= :now)
          AND (:requireDue = FALSE OR (active AND next_run_at <= :now))
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("requireDue", requireDue);
    return jdbcTemplate.update(sql, params) == 1;
  }

  public int releaseLease(UUID jobId, String lockedBy) {
    final String sql =
        """
        UPDATE recurring_jobs
        SET locked_by = NULL,
            lease_until = NULL
        WHERE job_id = :jobId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** 実行回数と対応する結果カウンタを 1 文で加算する。 */
  public int recordOutcome(
      UUID jobId, LastRunStatus status, String error, Instant lastRunAt, Instant nextRunAt) {
    if (status == LastRunStatus.NEVER_RUN) {
      throw new IllegalArgumentException("outcome must be SUCCESS or FAILED");
    }
    final String sql =
        """
        UPDATE recurring_jobs
        SET run_count = run_count + 1,
            success_count = success_count + :successDelta,
            failure_count = failure_count + :failureDelta,
            last_run_at = :lastRunAt,
            next_run_at = :nextRunAt,
            last_run_status = :status,
            last_run_error = :error,
            updated_at = :lastRunAt
        WHERE job_id = :jobId
        """;
    final boolean success = status == LastRunStatus.SUCCESS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("successDelta", success ? 1 : 0)
            .addValue("failureDelta", success ? 0 : 1)
            .addValue("lastRunAt", toTimestamp(lastRunAt))
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("status", status.name())
            .addValue("error", success ? null : error);
    return jdbcTemplate.update(sql, params);
  }

  public int updateCadence(UUID jobId, CadenceSpec cadence, Instant nextRunAt, Instant updatedAt) {
    final String sql =
        """
        UPDATE recurring_jobs
        SET cadence = :cadence,
            time_of_day = :timeOfDay,
            day_of_week = :dayOfWeek,
            day_of_month = :dayOfMonth,
            cron_expression = :cronExpression,
            timezone = :timezone,
            next_run_at = :nextRunAt,
            updated_at = :updatedAt
        WHERE job_id = :jobId
        """;
    final MapSqlParameterSource params =
        cadenceParams(cadence)
            .addValue("jobId", jobId)
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int updateActive(UUID jobId, boolean active, Instant nextRunAt, Instant updatedAt) {
    final String sql =
        """
        UPDATE recurring_jobs
        SET active = :active,
            next_run_at = :nextRunAt,
            updated_at = :updatedAt
        WHERE job_id = :jobId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("active", active)
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  private MapSqlParameterSource cadenceParams(CadenceSpec cadence) {
    return new MapSqlParameterSource()
        .addValue("cadence", cadence.cadence().name())
        .addValue("timeOfDay", cadence.timeOfDay())
        .addValue("dayOfWeek", cadence.dayOfWeek() == null ? null : cadence.dayOfWeek().getValue())
        .addValue("dayOfMonth", cadence.dayOfMonth())
        .addValue("cronExpression", cadence.cronExpression())
        .addValue("timezone", cadence.timezone().getId());
  }

  private RecurringJobConfig mapRow(ResultSet rs, int rowNum) throws SQLException {
    final int dayOfWeek = rs.getInt("day_of_week");
    final DayOfWeek day = rs.wasNull() ? null : DayOfWeek.of(dayOfWeek);
    final int dayOfMonthValue = rs.getInt("day_of_month");
    final Integer dayOfMonth = rs.wasNull() ? null : dayOfMonthValue;
    final CadenceSpec cadence =
        new CadenceSpec(
            Cadence.valueOf(rs.getString("cadence")),
            rs.getObject("time_of_day", LocalTime.class),
            day,
            dayOfMonth,
            rs.getString("cron_expression"),
            ZoneId.of(rs.getString("timezone")));
    final RenderSpec renderSpec =
        new RenderSpec(
            rs.getString("template_kind"),
            jsonColumnCodec.read(rs.getString("render_filters_text"), FILTER_LIST),
            jsonColumnCodec.read(rs.getString("render_columns_text"), STRING_LIST),
            ExportFormat.valueOf(rs.getString("export_format")));
    return new RecurringJobConfig(
        UUID.fromString(rs.getString("job_id")),
        rs.getString("name"),
        JobKind.valueOf(rs.getString("kind")),
        cadence,
        renderSpec,
        jsonColumnCodec.read(rs.getString("recipients_text"), STRING_LIST),
        rs.getString("email_subject"),
        rs.getBoolean("active"),
        toInstant(rs.getTimestamp("last_run_at")),
        toInstant(rs.getTimestamp("next_run_at")),
        LastRunStatus.valueOf(rs.getString("last_run_status")),
        rs.getString("last_run_error"),
        rs.getInt("run_count"),
        rs.getInt("success_count"),
        rs.getInt("failure_count"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("lease_until")),
        rs.getString("created_by"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
