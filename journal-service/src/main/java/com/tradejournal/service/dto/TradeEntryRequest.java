package com.tradejournal.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradejournal.core.model.ChecklistAnswers;
import com.tradejournal.core.model.Emotion;
import com.tradejournal.core.model.OptionType;
import com.tradejournal.core.model.TradeDirection;
import com.tradejournal.core.model.TradeStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Request body for logging or editing a trade.
 *
 * <p>On edit every null field keeps the stored value. The daily-limit checklist
 * item is not accepted here; it is computed when the trade is logged.
 */
public record TradeEntryRequest(
    @JsonProperty("ticker")          String ticker,
    @JsonProperty("direction")       TradeDirection direction,
    @JsonProperty("optionType")      OptionType optionType,
    @JsonProperty("strikePrice")     Double strikePrice,
    @JsonProperty("expirationDate")  LocalDate expirationDate,
    @JsonProperty("setup")           String setup,
    @JsonProperty("entryDate")       LocalDateTime entryDate,
    @JsonProperty("exitDate")        LocalDateTime exitDate,
    @JsonProperty("status")          TradeStatus status,
    @JsonProperty("entryPrice")      Double entryPrice,
    @JsonProperty("exitPrice")       Double exitPrice,
    @JsonProperty("quantity")        Integer quantity,
    @JsonProperty("fees")            Double fees,
    @JsonProperty("targetPrice")     Double targetPrice,
    @JsonProperty("stopLossPrice")   Double stopLossPrice,
    @JsonProperty("notes")           String notes,
    @JsonProperty("entryEmotion")    Emotion entryEmotion,
    @JsonProperty("exitEmotion")     Emotion exitEmotion,
    @JsonProperty("checklist")       ChecklistAnswers checklist,
    @JsonProperty("violationReason") String violationReason
) {}
