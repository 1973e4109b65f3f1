/*
 * どこで: Entitlement データアクセス
 * 何を: stores のティア/掲載期間/掲載フラグを読み書きする
 * なぜ: webhook と運用操作で書き込む列を SQL 単位で分離するため
 */
package com.dentfinder.entitlement.repository;

import static com.dentfinder.common.JdbcTimestampUtils.toInstant;
import static com.dentfinder.common.JdbcTimestampUtils.toTimestamp;

import com.dentfinder.entitlement.model.FeaturedTier;
import com.dentfinder.entitlement.model.StoreEntitlementRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class StoreRepository implements TierGrantWriter, FeatureWindowWriter {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean existsById(long storeId) {
    final String sql = "SELECT EXISTS (SELECT 1 FROM stores WHERE id = :storeId)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("storeId", storeId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public Optional<StoreEntitlementRecord> findEntitlement(long storeId) {
    final String sql =
        """
        SELECT id, featured_tier, featured_until, is_featured
        FROM stores
        WHERE id = :storeId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("storeId", storeId);
    return jdbcTemplate.query(sql, params, this::mapEntitlement).stream().findFirst();
  }

  @Override
  public int grantTier(long storeId, FeaturedTier tier, Instant featuredUntil) {
    final String sql =
        """
        UPDATE stores
        SET featured_tier = :tier,
            featured_until = :featuredUntil,
            updated_at = now()
        WHERE id = :storeId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("storeId", storeId)
            .addValue("tier", tier.value())
            .addValue("featuredUntil", toTimestamp(featuredUntil));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int extendFeatureWindow(long storeId, Instant featuredUntil) {
    // tier は更新ハンドラから変更させないため、ここでは featured_until のみ更新する
    final String sql =
        """
        UPDATE stores
        SET featured_until = :featuredUntil,
            updated_at = now()
        WHERE id = :storeId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("storeId", storeId)
            .addValue("featuredUntil", toTimestamp(featuredUntil));
    return jdbcTemplate.update(sql, params);
  }

  /** 運用操作による手動設定。tier=null でティアなしに戻す。 */
  public int assignTier(long storeId, FeaturedTier tier, Instant featuredUntil) {
    final String sql =
        """
        UPDATE stores
        SET featured_tier = :tier,
            featured_until = :featuredUntil,
            updated_at = now()
        WHERE id = :storeId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("storeId", storeId)
            .addValue("tier", tier == null ? null : tier.value())
            .addValue("featuredUntil", toTimestamp(featuredUntil));
    return jdbcTemplate.update(sql, params);
  }

  public int setFeatured(long storeId, boolean featured) {
    final String sql =
        """
        UPDATE stores
        SET is_featured = :featured,
            updated_at = now()
        WHERE id = :storeId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("storeId", storeId).addValue("featured", featured);
    return jdbcTemplate.update(sql, params);
  }

  /**
   * 現在の期限と now の遅い方を起点に日数を加算する。
   *
   * @return 延長後の featured_until。店舗が存在しなければ empty
   */
  public Optional<Instant> extendFeaturedUntilByDays(long storeId, int days, Instant now) {
    final String sql =
        """
        UPDATE stores
        SET featured_until = GREATEST(COALESCE(featured_until, :now), :now)
                             + make_interval(days => :days),
            updated_at = now()
        WHERE id = :storeId
        RETURNING featured_until
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("storeId", storeId)
            .addValue("days", days)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> toInstant(rs.getTimestamp("featured_until")))
        .stream()
        .findFirst();
  }

  private StoreEntitlementRecord mapEntitlement(ResultSet rs, int rowNum) throws SQLException {
    return new StoreEntitlementRecord(
        rs.getLong("id"),
        FeaturedTier.fromValue(rs.getString("featured_tier")).orElse(null),
        toInstant(rs.getTimestamp("featured_until")),
        rs.getBoolean("is_featured"));
  }
}
