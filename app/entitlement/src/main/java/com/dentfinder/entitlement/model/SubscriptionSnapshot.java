/*
 * どこで: Entitlement ドメインモデル
 * 何を: webhook から得たサブスクリプションの書き込み内容を保持する
 * なぜ: upsert の入力を検証済みの型でハンドラからリポジトリへ渡すため
 */
package com.dentfinder.entitlement.model;

import java.time.Instant;
import java.util.UUID;

public record SubscriptionSnapshot(
    String subscriptionId,
    String customerId,
    long storeId,
    UUID userId,
    FeaturedTier tier,
    SubscriptionStatus status,
    Instant currentPeriodEnd) {}
