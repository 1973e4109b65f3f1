/*
 * どこで: Entitlement データアクセス
 * 何を: 処理済み webhook イベント ID の台帳を管理する
 * なぜ: プロバイダの再送を副作用なしで受け流すため
 */
package com.dentfinder.entitlement.repository;

import static com.dentfinder.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class ProcessedWebhookEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void lockByEventId(long lockKey) {
    // 同一イベント ID の同時配送をトランザクション内で直列化する。
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public boolean exists(String eventId) {
    final String sql =
        "SELECT EXISTS (SELECT 1 FROM processed_webhook_events WHERE event_id = :eventId)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  /**
   * 台帳へ登録する。
   *
   * @return 新規登録なら true、既に登録済みなら false
   */
  public boolean insertIfAbsent(String eventId, String eventType, Instant processedAt) {
    final String sql =
        """
        INSERT INTO processed_webhook_events (event_id, event_type, processed_at)
        VALUES (:eventId, :eventType, :processedAt)
        ON CONFLICT (event_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("processedAt", toTimestamp(processedAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public int deleteProcessedBefore(Instant threshold) {
    final String sql =
        """
        DELETE FROM processed_webhook_events
        WHERE processed_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }
}
