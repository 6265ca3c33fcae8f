package com.gnovoa.gridiron.api.dto;

import jakarta.validation.constraints.Min;

/**
 * @param years years of history to simulate; null for the configured default
 * @param seed random seed for a reproducible run; null for a random one
 */
public record StartRunRequest(
        @Min(1) Integer years,
        Long seed
) {}
