/*
 * どこで: SubscriptionStatus の単体テスト
 * 何を: プロバイダ状態から 4 状態への対応を検証する
 * なぜ: 保存できない状態を CHECK 制約違反ではなく no-op で扱うため
 */
package com.dentfinder.entitlement.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SubscriptionStatusTest {

  @Test
  void mapsProviderStatuses() {
    assertThat(SubscriptionStatus.fromProvider("active")).contains(SubscriptionStatus.ACTIVE);
    assertThat(SubscriptionStatus.fromProvider("past_due")).contains(SubscriptionStatus.PAST_DUE);
    assertThat(SubscriptionStatus.fromProvider("unpaid")).contains(SubscriptionStatus.PAST_DUE);
    assertThat(SubscriptionStatus.fromProvider("canceled")).contains(SubscriptionStatus.CANCELED);
    assertThat(SubscriptionStatus.fromProvider("incomplete_expired"))
        .contains(SubscriptionStatus.CANCELED);
    assertThat(SubscriptionStatus.fromProvider("incomplete")).contains(SubscriptionStatus.INCOMPLETE);
  }

  @Test
  void untrackedStatusesAreEmpty() {
    assertThat(SubscriptionStatus.fromProvider("trialing")).isEmpty();
    assertThat(SubscriptionStatus.fromProvider("paused")).isEmpty();
    assertThat(SubscriptionStatus.fromProvider(null)).isEmpty();
  }
}
