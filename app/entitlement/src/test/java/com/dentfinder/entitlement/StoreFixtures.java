package com.dentfinder.entitlement;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** 統合テスト用の店舗行を作成する。店舗の登録はこのサービスの管轄外のため SQL で直接入れる。 */
public final class StoreFixtures {

  private StoreFixtures() {}

  public static long insertStore(NamedParameterJdbcTemplate jdbcTemplate, String name) {
    return jdbcTemplate.queryForObject(
        "INSERT INTO stores (name) VALUES (:name) RETURNING id",
        new MapSqlParameterSource().addValue("name", name),
        Long.class);
  }

  public static void cleanAll(NamedParameterJdbcTemplate jdbcTemplate) {
    final MapSqlParameterSource none = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM cta_events", none);
    jdbcTemplate.update("DELETE FROM rate_limit_counters", none);
    jdbcTemplate.update("DELETE FROM processed_webhook_events", none);
    jdbcTemplate.update("DELETE FROM subscriptions", none);
    jdbcTemplate.update("DELETE FROM stores", none);
  }
}
