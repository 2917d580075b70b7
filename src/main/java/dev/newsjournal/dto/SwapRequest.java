package dev.newsjournal.dto;

import jakarta.validation.constraints.NotNull;

public record SwapRequest(
        @NotNull(message = "First article number is required")
        Integer first,

        @NotNull(message = "Second article number is required")
        Integer second
) {}
