/*
 * どこで: Entitlement ドメインモデル
 * 何を: 店舗のティア/掲載期間/掲載フラグを保持する
 * なぜ: 運用向け参照でティア系と掲載フラグを並べて返すため
 */
package com.dentfinder.entitlement.model;

import java.time.Instant;

public record StoreEntitlementRecord(
    long storeId, FeaturedTier tier, Instant featuredUntil, boolean featured) {

  // 期限切れは保存せず、参照時に計算する
  public boolean featuredActive(Instant now) {
    return featuredUntil != null && now.isBefore(featuredUntil);
  }
}
