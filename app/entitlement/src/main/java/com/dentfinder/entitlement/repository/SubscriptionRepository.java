/*
 * どこで: Entitlement データアクセス
 * 何を: subscriptions の upsert/状態更新/一覧/集計を行う
 * なぜ: 順不同で届くイベントを subscription_id 単位で収束させるため
 */
package com.dentfinder.entitlement.repository;

import static com.dentfinder.common.JdbcTimestampUtils.toInstant;
import static com.dentfinder.common.JdbcTimestampUtils.toTimestamp;

import com.dentfinder.entitlement.model.FeaturedTier;
import com.dentfinder.entitlement.model.SubscriptionCounts;
import com.dentfinder.entitlement.model.SubscriptionRecord;
import com.dentfinder.entitlement.model.SubscriptionSnapshot;
import com.dentfinder.entitlement.model.SubscriptionStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SubscriptionRepository implements SubscriptionWriter {

  private static final String SELECT_COLUMNS =
      """
      SELECT subscription_id, customer_id, store_id, user_id, tier, status,
             current_period_end, created_at, updated_at
      FROM subscriptions
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public int upsert(SubscriptionSnapshot snapshot) {
    final String sql =
        """
        INSERT INTO subscriptions (
          subscription_id,
          customer_id,
          store_id,
          user_id,
          tier,
          status,
          current_period_end,
          created_at,
          updated_at
        ) VALUES (
          :subscriptionId,
          :customerId,
          :storeId,
          :userId,
          :tier,
          :status,
          :currentPeriodEnd,
          now(),
          now()
        )
        ON CONFLICT (subscription_id) DO UPDATE SET
          customer_id = COALESCE(EXCLUDED.customer_id, subscriptions.customer_id),
          store_id = EXCLUDED.store_id,
          user_id = EXCLUDED.user_id,
          tier = EXCLUDED.tier,
          status = EXCLUDED.status,
          current_period_end = COALESCE(EXCLUDED.current_period_end, subscriptions.current_period_end),
          updated_at = now()
        WHERE subscriptions.status <> 'canceled' OR EXCLUDED.status = 'canceled'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriptionId", snapshot.subscriptionId())
            .addValue("customerId", snapshot.customerId())
            .addValue("storeId", snapshot.storeId())
            .addValue("userId", snapshot.userId())
            .addValue("tier", snapshot.tier().value())
            .addValue("status", snapshot.status().value())
            .addValue("currentPeriodEnd", toTimestamp(snapshot.currentPeriodEnd()));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int updateStatus(String subscriptionId, SubscriptionStatus status) {
    final String sql =
        """
        UPDATE subscriptions
        SET status = :status,
            updated_at = now()
        WHERE subscription_id = :subscriptionId
          AND (status <> 'canceled' OR :status = 'canceled')
        """;
    // canceled は終端状態のため、遅れて届いた payment_failed 等で戻さない
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriptionId", subscriptionId)
            .addValue("status", status.value());
    return jdbcTemplate.update(sql, params);
  }

  public Optional<SubscriptionRecord> findById(String subscriptionId) {
    final String sql = SELECT_COLUMNS + "WHERE subscription_id = :subscriptionId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("subscriptionId", subscriptionId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 期限の近い順に返す。status が null なら全件。 */
  public List<SubscriptionRecord> findPage(SubscriptionStatus status, int limit, int offset) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE (CAST(:status AS TEXT) IS NULL OR status = :status)
            ORDER BY current_period_end ASC NULLS LAST, subscription_id ASC
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status == null ? null : status.value())
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public SubscriptionCounts countByStatus() {
    final String sql =
        """
        SELECT
          COUNT(*) FILTER (WHERE status = 'active') AS active_count,
          COUNT(*) FILTER (WHERE status = 'past_due') AS past_due_count,
          COUNT(*) FILTER (WHERE status = 'canceled') AS canceled_count,
          COUNT(*) AS total_count
        FROM subscriptions
        """;
    return jdbcTemplate.queryForObject(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new SubscriptionCounts(
                rs.getLong("active_count"),
                rs.getLong("past_due_count"),
                rs.getLong("canceled_count"),
                rs.getLong("total_count")));
  }

  private SubscriptionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SubscriptionRecord(
        rs.getString("subscription_id"),
        rs.getString("customer_id"),
        rs.getLong("store_id"),
        rs.getObject("user_id", UUID.class),
        FeaturedTier.fromValue(rs.getString("tier")).orElseThrow(),
        SubscriptionStatus.fromValue(rs.getString("status")).orElseThrow(),
        toInstant(rs.getTimestamp("current_period_end")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
