package com.swab.backend.modules.scheduler.presentation.dto;

import jakarta.validation.constraints.Size;

public record ProbeRequest(
        @Size(max = 4000, message = "TEXT_TOO_LONG")
        String text
) {
}
