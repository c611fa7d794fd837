package com.agenteval.experiment.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record MarkFailedRequest(
    @NotBlank(message = "reason must not be blank")
    @Size(max = 2000)
    String reason
) {
}
