package com.tradejournal.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradejournal.core.model.UserSettings;

/**
 * Request body for POST /api/v1/journal/profiles. Null settings fall back to the configured defaults.
 */
public record CreateProfileRequest(
    @JsonProperty("name")           String name,
    @JsonProperty("initialCapital") double initialCapital,
    @JsonProperty("settings")       UserSettings settings
) {}
