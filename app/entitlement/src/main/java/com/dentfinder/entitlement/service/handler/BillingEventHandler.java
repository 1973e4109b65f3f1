/*
 * どこで: Entitlement webhook ハンドラ
 * 何を: イベント種別ごとのハンドラ契約を定義する
 * なぜ: ルータが種別 enum だけでハンドラを選べるようにするため
 */
package com.dentfinder.entitlement.service.handler;

import com.dentfinder.entitlement.model.BillingEvent;
import com.dentfinder.entitlement.model.BillingEventType;

public interface BillingEventHandler {

  BillingEventType type();

  /**
   * イベントを反映する。
   *
   * <p>入力不備は警告ログを出して戻る。例外はストレージ障害など再送で回復し得る失敗のみ。
   */
  void handle(BillingEvent event);
}
