/*
 * どこで: Entitlement ドメインモデル
 * 何を: サブスクリプションのライフサイクル状態と決済プロバイダ状態の対応を定義する
 * なぜ: プロバイダ固有の状態を 4 状態に正規化してから保存するため
 */
package com.dentfinder.entitlement.model;

import java.util.Arrays;
import java.util.Optional;

public enum SubscriptionStatus {
  ACTIVE("active"),
  PAST_DUE("past_due"),
  CANCELED("canceled"),
  INCOMPLETE("incomplete");

  private final String value;

  SubscriptionStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Optional<SubscriptionStatus> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(status -> status.value.equals(value)).findFirst();
  }

  /**
   * プロバイダの状態文字列を変換する。
   *
   * <p>unpaid は past_due、incomplete_expired は canceled に寄せる。trialing/paused など表現できない状態は
   * empty を返す。
   */
  public static Optional<SubscriptionStatus> fromProvider(String providerStatus) {
    if ("unpaid".equals(providerStatus)) {
      return Optional.of(PAST_DUE);
    }
    if ("incomplete_expired".equals(providerStatus)) {
      return Optional.of(CANCELED);
    }
    return fromValue(providerStatus);
  }
}
