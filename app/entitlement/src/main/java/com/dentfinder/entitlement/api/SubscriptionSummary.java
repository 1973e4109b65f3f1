package com.dentfinder.entitlement.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriptionSummary(
    String subscriptionId,
    String customerId,
    long storeId,
    UUID userId,
    String tier,
    String status,
    Instant currentPeriodEnd,
    Instant createdAt) {}
