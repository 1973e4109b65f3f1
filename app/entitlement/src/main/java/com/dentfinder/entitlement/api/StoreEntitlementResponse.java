package com.dentfinder.entitlement.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StoreEntitlementResponse(
    long storeId, String tier, Instant featuredUntil, boolean featuredActive, boolean isFeatured) {}
