/*
 * どこで: Entitlement データアクセスの書き込み境界
 * 何を: 掲載期限の延長だけを公開する
 * なぜ: 更新ハンドラがティアを変更できないようにするため
 */
package com.dentfinder.entitlement.repository;

import java.time.Instant;

public interface FeatureWindowWriter {

  /** featured_until を指定時刻へ置き換える。tier と is_featured は変更しない。 */
  int extendFeatureWindow(long storeId, Instant featuredUntil);
}
