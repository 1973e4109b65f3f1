package com.dentfinder.entitlement.api;

public record WebhookAckResponse(boolean received) {}
