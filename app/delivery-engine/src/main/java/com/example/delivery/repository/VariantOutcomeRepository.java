/*
 * どこで: Delivery Engine のデータアクセス
 * 何を: 実験のバリアントごとの結果カウンタ
 * なぜ: カウンタは加算の upsert でしか動かず、減ることがないため
 */
package com.example.delivery.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.delivery.model.ExperimentVariant;
import com.example.delivery.model.VariantOutcomeAggregate;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class VariantOutcomeRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void increment(
      UUID experimentId, ExperimentVariant variant, OutcomeCounterDelta delta, Instant now) {
    final String sql =
        """
        INSERT INTO variant_outcomes (
          experiment_id, variant, sent_count, delivered_count, opened_count, clicked_count,
          responded_count, converted_count, bounced_count, updated_at
        ) VALUES (
          :experimentId, :variant, :sent, :delivered, :opened, :clicked,
          :responded, :converted, :bounced, :now
        )
        ON CONFLICT (experiment_id, variant) DO UPDATE
        SET sent_count = variant_outcomes.sent_count + EXCLUDED.sent_count,
            delivered_count = variant_outcomes.delivered_count + EXCLUDED.delivered_count,
            opened_count = variant_outcomes.opened_count + EXCLUDED.opened_count,
            clicked_count = variant_outcomes.clicked_count + EXCLUDED.clicked_count,
            responded_count = variant_outcomes.responded_count + EXCLUDED.responded_count,
            converted_count = variant_outcomes.converted_count + EXCLUDED.converted_count,
            bounced_count = variant_outcomes.bounced_count + EXCLUDED.bounced_count,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("experimentId", experimentId)
            .addValue("variant", variant.name())
            .addValue("sent", delta.sent())
            .addValue("delivered", delta.delivered())
            .addValue("opened", delta.opened())
            .addValue("clicked", delta.clicked())
            .addValue("responded", delta.responded())
            .addValue("converted", delta.converted())
            .addValue("bounced", delta.bounced())
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  public VariantOutcomeAggregate find(UUID experimentId, ExperimentVariant variant) {
    final String sql =
        """
        SELECT sent_count, delivered_count, opened_count, clicked_count, responded_count,
               converted_count, bounced_count
        FROM variant_outcomes
        WHERE experiment_id = :experimentId
          AND variant = :variant
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("experimentId", experimentId)
            .addValue("variant", variant.name());
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new VariantOutcomeAggregate(
                    experimentId,
                    variant,
                    rs.getLong("sent_count"),
                    rs.getLong("delivered_count"),
                    rs.getLong("opened_count"),
                    rs.getLong("clicked_count"),
                    rs.getLong("responded_count"),
                    rs.getLong("converted_count"),
                    rs.getLong("bounced_count")))
        .stream()
        .findFirst()
        .orElseGet(() -> VariantOutcomeAggregate.empty(experimentId, variant));
  }

  /** バリアント 1 行に適用する非負の増分。 */
  public record OutcomeCounterDelta(
      long sent, long delivered, long opened, long clicked, long responded, long converted, long bounced) {

    public OutcomeCounterDelta {
      if (sent < 0 || delivered < 0 || opened < 0 || clicked < 0 || responded < 0
          || converted < 0 || bounced < 0) {
        throw new IllegalArgumentException("outcome counters only move forward");
      }
    }

    public static OutcomeCounterDelta sentAndDelivered() {
      return new OutcomeCounterDelta(1, 1, 0, 0, 0, 0, 0);
    }

    public static OutcomeCounterDelta sentAndBounced() {
      return new OutcomeCounterDelta(1, 0, 0, 0, 0, 0, 1);
    }

    public static OutcomeCounterDelta openedOnly() {
      return new OutcomeCounterDelta(0, 0, 1, 0, 0, 0, 0);
    }

    public static OutcomeCounterDelta clickedOnly() {
      return new OutcomeCounterDelta(0, 0, 0, 1, 0, 0, 0);
    }

    public static OutcomeCounterDelta respondedOnly() {
      return new OutcomeCounterDelta(0, 0, 0, 0, 1, 0, 0);
    }

    public static OutcomeCounterDelta convertedOnly() {
      return new OutcomeCounterDelta(0, 0, 0, 0, 0, 1, 0);
    }
  }
}
