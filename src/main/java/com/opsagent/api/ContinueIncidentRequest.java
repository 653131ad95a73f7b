package com.opsagent.api;

import jakarta.validation.constraints.NotBlank;

public record ContinueIncidentRequest(
        @NotBlank String message
) {
}
