/*
 * どこで: Entitlement ドメインモデル
 * 何を: CTA クリックイベントの種別を定義する
 * なぜ: 公開エンドポイントで受け付ける種別を固定するため
 */
package com.dentfinder.entitlement.model;

import java.util.Arrays;
import java.util.Optional;

public enum CtaEventType {
  CALL("call"),
  DIRECTIONS("directions"),
  WEBSITE("website");

  private final String value;

  CtaEventType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Optional<CtaEventType> fromValue(String value) {
    return Arrays.stream(values()).filter(type -> type.value.equals(value)).findFirst();
  }
}
