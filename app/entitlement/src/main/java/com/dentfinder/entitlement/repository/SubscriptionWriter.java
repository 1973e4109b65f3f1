/*
 * どこで: Entitlement データアクセスの書き込み境界
 * 何を: サブスクリプション行の upsert と状態更新だけを公開する
 * なぜ: サブスクリプション系ハンドラが店舗ティアに触れられないようにするため
 */
package com.dentfinder.entitlement.repository;

import com.dentfinder.entitlement.model.SubscriptionSnapshot;
import com.dentfinder.entitlement.model.SubscriptionStatus;

public interface SubscriptionWriter {

  /**
   * subscription_id 単位で登録/更新する。canceled 済みの行は canceled 以外で上書きしない。
   *
   * @return 反映件数。canceled のまま据え置いた場合は 0
   */
  int upsert(SubscriptionSnapshot snapshot);

  /** 行が存在しない場合と canceled 済みの場合は 0 を返す。 */
  int updateStatus(String subscriptionId, SubscriptionStatus status);
}
