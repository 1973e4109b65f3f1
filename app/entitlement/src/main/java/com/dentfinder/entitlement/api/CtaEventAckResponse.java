package com.dentfinder.entitlement.api;

public record CtaEventAckResponse(boolean success) {}
