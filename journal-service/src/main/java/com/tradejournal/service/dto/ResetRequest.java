package com.tradejournal.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ResetRequest(
    @JsonProperty("newInitialCapital") double newInitialCapital
) {}
