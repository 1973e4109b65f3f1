/*
 * どこで: Entitlement データアクセス
 * 何を: CTA クリックイベントを保存する
 * なぜ: 店舗ごとの問い合わせ導線の計測に使うため
 */
package com.dentfinder.entitlement.repository;

import static com.dentfinder.common.JdbcTimestampUtils.toTimestamp;

import com.dentfinder.entitlement.model.CtaEventType;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CtaEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(long storeId, CtaEventType eventType, String sourcePage, Instant createdAt) {
    final String sql =
        """
        INSERT INTO cta_events (store_id, event_type, source_page, created_at)
        VALUES (:storeId, :eventType, :sourcePage, :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("storeId", storeId)
            .addValue("eventType", eventType.value())
            .addValue("sourcePage", sourcePage)
            .addValue("createdAt", toTimestamp(createdAt));
    jdbcTemplate.update(sql, params);
  }

  public long countByStore(long storeId) {
    final String sql = "SELECT COUNT(*) FROM cta_events WHERE store_id = :storeId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("storeId", storeId);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }
}
