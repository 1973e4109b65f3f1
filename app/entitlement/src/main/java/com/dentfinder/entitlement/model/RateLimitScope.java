/*
 * どこで: Entitlement ドメインモデル
 * 何を: CTA レート制限カウンタの単位を定義する
 * なぜ: 送信元単位と店舗単位の拒否をログ/メトリクスで区別するため
 */
package com.dentfinder.entitlement.model;

public enum RateLimitScope {
  ORIGIN("origin"),
  SUBJECT("subject");

  private final String value;

  RateLimitScope(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
