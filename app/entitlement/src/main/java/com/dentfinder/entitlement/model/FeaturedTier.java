/*
 * どこで: Entitlement ドメインモデル
 * 何を: 店舗の有料掲載ティアと掲載期間の長さを定義する
 * なぜ: ティアごとの期間計算を 1 か所に集約するため
 */
package com.dentfinder.entitlement.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;

/** ティアなし (none) は DB 上 NULL で表し、この enum には含めない。 */
public enum FeaturedTier {
  MONTHLY("monthly"),
  ANNUAL("annual");

  private final String value;

  FeaturedTier(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** 暦の月/年で加算する (30 日/365 日固定ではない)。UTC で計算する。 */
  public Instant featuredUntil(Instant grantedAt) {
    return switch (this) {
      case MONTHLY -> grantedAt.atZone(ZoneOffset.UTC).plusMonths(1).toInstant();
      case ANNUAL -> grantedAt.atZone(ZoneOffset.UTC).plusYears(1).toInstant();
    };
  }

  public static Optional<FeaturedTier> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(tier -> tier.value.equals(value)).findFirst();
  }
}
