/*
 * どこで: Entitlement ドメインモデル
 * 何を: 処理対象の webhook イベント種別を閉じた集合として定義する
 * なぜ: ハンドラ選択を文字列比較ではなく enum で行うため
 */
package com.dentfinder.entitlement.model;

import java.util.Arrays;
import java.util.Optional;

public enum BillingEventType {
  CHECKOUT_SESSION_COMPLETED("checkout.session.completed"),
  SUBSCRIPTION_CREATED("customer.subscription.created"),
  SUBSCRIPTION_UPDATED("customer.subscription.updated"),
  SUBSCRIPTION_DELETED("customer.subscription.deleted"),
  INVOICE_PAYMENT_FAILED("invoice.payment_failed");

  private final String wireName;

  BillingEventType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<BillingEventType> fromWireName(String wireName) {
    return Arrays.stream(values()).filter(type -> type.wireName.equals(wireName)).findFirst();
  }
}
