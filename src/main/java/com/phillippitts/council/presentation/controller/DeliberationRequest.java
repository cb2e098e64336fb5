package com.phillippitts.council.presentation.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Body of {@code POST /api/council/queries}.
 *
 * @param text      the question
 * @param workspace workspace name; blank for the default workspace
 * @param history   prior conversation turns, oldest first
 */
record DeliberationRequest(
        @NotBlank @Size(max = 20_000) String text,
        @Size(max = 100) String workspace,
        @Size(max = 50) List<@NotBlank String> history
) {
}
