package com.opsagent.api;

import jakarta.validation.constraints.NotBlank;

public record CreateIncidentRequest(
        @NotBlank String task,
        String source
) {
}
