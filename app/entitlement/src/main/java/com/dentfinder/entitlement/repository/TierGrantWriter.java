/*
 * どこで: Entitlement データアクセスの書き込み境界
 * 何を: 店舗ティアと掲載期間の初回付与だけを公開する
 * なぜ: 決済完了ハンドラがサブスクリプション側に触れられないようにするため
 */
package com.dentfinder.entitlement.repository;

import com.dentfinder.entitlement.model.FeaturedTier;
import java.time.Instant;

public interface TierGrantWriter {

  /**
   * 店舗のティアと掲載期限を設定する。is_featured には触れない。
   *
   * @return 更新件数。店舗が存在しなければ 0
   */
  int grantTier(long storeId, FeaturedTier tier, Instant featuredUntil);
}
