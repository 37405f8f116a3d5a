package com.gridpulse.analytics.controller.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Instant;

public record ReadingCreateRequestDto(
        @NotNull Long meterId,
        @NotNull Instant timestamp,
        @NotNull @PositiveOrZero Double valueKwh
) {
}
