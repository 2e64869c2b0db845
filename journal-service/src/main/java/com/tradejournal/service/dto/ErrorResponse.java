package com.tradejournal.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ErrorResponse(
    @JsonProperty("error")   String error,
    @JsonProperty("details") List<String> details
) {
    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, List.of());
    }
}
