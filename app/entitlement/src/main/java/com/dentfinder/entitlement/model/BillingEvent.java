/*
 * どこで: Entitlement ドメインモデル
 * 何を: 署名検証済みの webhook イベントを保持する
 * なぜ: 検証前のペイロードとハンドラが扱う入力を型で区別するため
 */
package com.dentfinder.entitlement.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * @param id プロバイダのイベント ID (evt_...)
 * @param type プロバイダのイベント種別文字列
 * @param dataObject data.object。存在しない場合は MissingNode
 */
public record BillingEvent(String id, String type, JsonNode dataObject) {

  public Optional<BillingEventType> eventType() {
    return BillingEventType.fromWireName(type);
  }
}
