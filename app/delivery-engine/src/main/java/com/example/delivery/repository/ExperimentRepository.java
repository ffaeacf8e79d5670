/*
 * どこで: Delivery Engine のデータアクセス
 * 何を: 実験を永続化し、確定した勝者を記録する
 * なぜ: 勝者は条件付き更新で一度だけ書き込み、並行する分析の結果を一致させるため
 */
package com.example.delivery.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.delivery.model.Experiment;
import com.example.delivery.model.ExperimentStatus;
import com.example.delivery.model.ExperimentVariant;
import com.example.delivery.model.OutcomeMetric;
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
public class ExperimentRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT experiment_id, name, owner_id, primary_metric, status, winner, winner_determined_at, created_at
      FROM experiments
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(Experiment experiment) {
    final String sql =
        """
        INSERT INTO experiments (
          experiment_id, name, owner_id, primary_metric, status, winner, winner_determined_at, created_at
        ) VALUES (
          :experimentId, :name, :ownerId, :primaryMetric, :status, :winner, :winnerDeterminedAt, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("experimentId", experiment.experimentId())
            .addValue("name", experiment.name())
            .addValue("ownerId", experiment.ownerId())
            .addValue("primaryMetric", experiment.primaryMetric().name())
            .addValue("status", experiment.status().name())
            .addValue("winner", experiment.winner() == null ? null : experiment.winner().name())
            .addValue("winnerDeterminedAt", toTimestamp(experiment.winnerDeterminedAt()))
            .addValue("createdAt", toTimestamp(experiment.createdAt()));
    jdbcTemplate.update(sql, params);
    return experiment.experimentId();
  }

  public Optional<Experiment> findById(UUID experimentId) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("experimentId", experimentId);
    return jdbcTemplate
        .query(SELECT_COLUMNS + " WHERE experiment_id = :experimentId", params, this::mapRow)
        .stream()
        .findFirst();
  }

  public List<Experiment> findActiveWithoutWinner() {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " WHERE status = 'ACTIVE' AND winner IS NULL ORDER BY created_at, experiment_id",
        new MapSqlParameterSource(),
        this::mapRow);
  }

  public boolean markCompleted(UUID experimentId, ExperimentVariant winner, Instant determinedAt) {
    final String sql =
        """
        UPDATE experiments
        SET status = 'COMPLETED',
            winner = :winner,
            winner_determined_at = :determinedAt
        WHERE experiment_id = :experimentId
          AND status = 'ACTIVE'
          AND winner IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("experimentId", experimentId)
            .addValue("winner", winner.name())
            .addValue("determinedAt", toTimestamp(determinedAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  private Experiment mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String winner = rs.getString("winner");
    return new Experiment(
        UUID.fromString(rs.getString("experiment_id")),
        rs.getString("name"),
        rs.getString("owner_id"),
        OutcomeMetric.valueOf(rs.getString("primary_metric")),
        ExperimentStatus.valueOf(rs.getString("status")),
        winner == null ? null : ExperimentVariant.valueOf(winner),
        toInstant(rs.getTimestamp("winner_determined_at")),
        toInstant(rs.getTimestamp("created_at")));
  }
}
