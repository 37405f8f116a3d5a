package com.gridpulse.analytics.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record StatusUpdateRequestDto(@NotBlank String status) {
}
