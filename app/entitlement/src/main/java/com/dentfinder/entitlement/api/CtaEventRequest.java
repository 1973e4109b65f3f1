/*
 * どこで: Entitlement API
 * 何を: CTA クリックイベントの入力を表す
 * なぜ: 必須項目の欠落をサービス層に入る前に弾くため
 */
package com.dentfinder.entitlement.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CtaEventRequest(
    @NotNull(message = "subject_id is required")
        @Positive(message = "subject_id must be positive")
        Long subjectId,
    @NotBlank(message = "event_type is required") String eventType,
    @NotBlank(message = "source is required")
        @Size(max = 2048, message = "source is too long")
        String source) {}
