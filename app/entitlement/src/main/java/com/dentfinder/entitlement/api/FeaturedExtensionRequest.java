package com.dentfinder.entitlement.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeaturedExtensionRequest(
    @NotNull(message = "days is required")
        @Min(value = 1, message = "days must be between 1 and 3650")
        @Max(value = 3650, message = "days must be between 1 and 3650")
        Integer days) {}
