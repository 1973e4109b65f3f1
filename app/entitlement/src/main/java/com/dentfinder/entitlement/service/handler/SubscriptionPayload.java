/*
 * どこで: Entitlement webhook ハンドラ補助
 * 何を: customer.subscription.* の data.object を検証済みの値へ変換する
 * なぜ: created/updated/deleted で同じ解釈規則を使うため
 */
package com.dentfinder.entitlement.service.handler;

import com.dentfinder.entitlement.model.FeaturedTier;
import com.dentfinder.entitlement.model.SubscriptionSnapshot;
import com.dentfinder.entitlement.model.SubscriptionStatus;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

record SubscriptionPayload(
    String subscriptionId,
    String customerId,
    String providerStatus,
    Optional<SubscriptionStatus> status,
    OptionalLong storeId,
    Optional<UUID> userId,
    Optional<FeaturedTier> tier,
    Optional<Instant> currentPeriodEnd) {

  /** subscription id が不正な場合は empty。 */
  static Optional<SubscriptionPayload> parse(JsonNode subscription) {
    final Optional<String> subscriptionId = BillingPayloads.providerId(subscription, "id");
    if (subscriptionId.isEmpty()) {
      return Optional.empty();
    }
    final String providerStatus = subscription.path("status").asText("");
    return Optional.of(
        new SubscriptionPayload(
            subscriptionId.get(),
            BillingPayloads.providerId(subscription, "customer").orElse(null),
            providerStatus,
            SubscriptionStatus.fromProvider(providerStatus),
            BillingPayloads.storeId(BillingPayloads.metadata(subscription, "storeId").orElse(null)),
            BillingPayloads.userId(BillingPayloads.metadata(subscription, "userId").orElse(null)),
            BillingPayloads.tier(BillingPayloads.metadata(subscription, "tier").orElse(null)),
            resolvePeriodEnd(subscription)));
  }

  // 新しい API バージョンでは current_period_end が items 側へ移っている
  private static Optional<Instant> resolvePeriodEnd(JsonNode subscription) {
    final Optional<Instant> topLevel = BillingPayloads.epochSeconds(subscription, "current_period_end");
    if (topLevel.isPresent()) {
      return topLevel;
    }
    return BillingPayloads.epochSeconds(
        subscription.path("items").path("data").path(0), "current_period_end");
  }

  boolean hasCompleteMetadata() {
    return storeId.isPresent() && userId.isPresent() && tier.isPresent();
  }

  SubscriptionSnapshot toSnapshot(SubscriptionStatus resolvedStatus) {
    return new SubscriptionSnapshot(
        subscriptionId,
        customerId,
        storeId.orElseThrow(),
        userId.orElseThrow(),
        tier.orElseThrow(),
        resolvedStatus,
        currentPeriodEnd.orElse(null));
  }
}
