/*
 * どこで: Entitlement ドメインモデル
 * 何を: webhook イベント 1 件の処理結果を表す
 * なぜ: 重複/未対応/処理済みをメトリクスとログで区別するため
 */
package com.dentfinder.entitlement.model;

public enum RouteOutcome {
  PROCESSED("processed"),
  DUPLICATE("duplicate"),
  IGNORED("ignored");

  private final String value;

  RouteOutcome(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
