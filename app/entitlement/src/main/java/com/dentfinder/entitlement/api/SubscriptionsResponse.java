package com.dentfinder.entitlement.api;

import java.util.List;

public record SubscriptionsResponse(List<SubscriptionSummary> items, int limit, int offset) {}
