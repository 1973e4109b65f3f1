/*
 * どこで: Entitlement データアクセス
 * 何を: レート制限カウンタを 1 文で加算し、加算後の値を返す
 * なぜ: 複数インスタンスから同時に叩かれても数え漏れなく上限判定するため
 */
package com.dentfinder.entitlement.repository;

import static com.dentfinder.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RateLimitCounterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long incrementAndGet(String counterKey, Instant windowStart, Instant expiresAt) {
    // 行ロック付きの upsert で、読み取りと加算の間に他リクエストが割り込まないようにする
    final String sql =
        """
        INSERT INTO rate_limit_counters (counter_key, window_start, event_count, expires_at)
        VALUES (:counterKey, :windowStart, 1, :expiresAt)
        ON CONFLICT (counter_key, window_start)
        DO UPDATE SET event_count = rate_limit_counters.event_count + 1
        RETURNING event_count
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("counterKey", counterKey)
            .addValue("windowStart", toTimestamp(windowStart))
            .addValue("expiresAt", toTimestamp(expiresAt));
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (count == null) {
      throw new IllegalStateException("rate limit counter returned no row: " + counterKey);
    }
    return count;
  }

  public int deleteExpired(Instant now) {
    final String sql =
        """
        DELETE FROM rate_limit_counters
        WHERE expires_at <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }
}
