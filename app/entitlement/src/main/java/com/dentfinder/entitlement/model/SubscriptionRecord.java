/*
 * どこで: Entitlement ドメインモデル
 * 何を: 保存済みサブスクリプションの 1 行を表す
 * なぜ: 運用向け一覧と統合テストで同じ型を使うため
 */
package com.dentfinder.entitlement.model;

import java.time.Instant;
import java.util.UUID;

public record SubscriptionRecord(
    String subscriptionId,
    String customerId,
    long storeId,
    UUID userId,
    FeaturedTier tier,
    SubscriptionStatus status,
    Instant currentPeriodEnd,
    Instant createdAt,
    Instant updatedAt) {}
