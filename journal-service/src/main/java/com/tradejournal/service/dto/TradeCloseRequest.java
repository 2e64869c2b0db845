package com.tradejournal.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradejournal.core.model.Emotion;

import java.time.LocalDateTime;

/**
 * Request body for POST .../trades/{tradeId}/close. A null exitDate means now; exitPrice is required.
 */
public record TradeCloseRequest(
    @JsonProperty("exitPrice")   Double exitPrice,
    @JsonProperty("exitDate")    LocalDateTime exitDate,
    @JsonProperty("exitEmotion") Emotion exitEmotion
) {}
