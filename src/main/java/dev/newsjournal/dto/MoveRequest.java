package dev.newsjournal.dto;

import jakarta.validation.constraints.NotNull;

public record MoveRequest(
        @NotNull(message = "Source article number is required")
        Integer from,

        @NotNull(message = "Target article number is required")
        Integer to
) {}
