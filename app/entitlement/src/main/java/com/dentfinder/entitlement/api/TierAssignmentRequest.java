package com.dentfinder.entitlement.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** tier は monthly/annual/none。none または null でティアを外す。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TierAssignmentRequest(String tier, Instant featuredUntil) {}
