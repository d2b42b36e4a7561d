package com.example.pawluxe_export.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Producer-facing submission. Null {@code dedupeKey}, {@code timeoutSeconds} or {@code maxRetries}
 * take the configured defaults.
 */
public record EnqueueRequest(@Size(max = 255) String dedupeKey,
                             @NotNull @Valid RenderParams params,
                             @Positive Integer timeoutSeconds,
                             @PositiveOrZero Integer maxRetries) {

    public static EnqueueRequest of(RenderParams params) {
        return new EnqueueRequest(null, params, null, null);
    }
}
