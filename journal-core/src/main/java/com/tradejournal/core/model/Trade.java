package com.tradejournal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One options position in the journal.
 *
 * <p>{@code exitPrice}, {@code exitDate} and {@code pnl} are only meaningful when
 * {@code status == CLOSED}; an open trade never carries a realized pnl. The
 * {@code disciplineScore} is fixed when the trade is logged and only changes
 * through an explicit edit.
 */
public record Trade(
    @JsonProperty("id")              String id,
    @JsonProperty("ticker")          String ticker,
    @JsonProperty("direction")       TradeDirection direction,
    @JsonProperty("optionType")      OptionType optionType,
    @JsonProperty("strikePrice")     Double strikePrice,
    @JsonProperty("expirationDate")  LocalDate expirationDate,
    @JsonProperty("setup")           String setup,
    @JsonProperty("entryDate")       LocalDateTime entryDate,
    @JsonProperty("exitDate")        LocalDateTime exitDate,
    @JsonProperty("status")          TradeStatus status,
    @JsonProperty("entryPrice")      double entryPrice,
    @JsonProperty("exitPrice")       Double exitPrice,
    @JsonProperty("quantity")        int quantity,
    @JsonProperty("fees")            double fees,
    @JsonProperty("targetPrice")     Double targetPrice,
    @JsonProperty("stopLossPrice")   Double stopLossPrice,
    @JsonProperty("pnl")             Double pnl,
    @JsonProperty("notes")           String notes,
    @JsonProperty("entryEmotion")    Emotion entryEmotion,
    @JsonProperty("exitEmotion")     Emotion exitEmotion,
    @JsonProperty("checklist")       DisciplineChecklist checklist,
    @JsonProperty("disciplineScore") int disciplineScore,
    @JsonProperty("violationReason") String violationReason
) {

    @JsonIgnore
    public boolean isClosed() {
        return status == TradeStatus.CLOSED;
    }

    @JsonIgnore
    public boolean hasPnl() {
        return pnl != null;
    }

    /**
     * True when status and pnl agree: CLOSED with a finite pnl, or OPEN without one.
     */
    @JsonIgnore
    public boolean isLifecycleConsistent() {
        if (status == TradeStatus.CLOSED) {
            return pnl != null && Double.isFinite(pnl);
        }
        return pnl == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id).ticker(ticker).direction(direction).optionType(optionType)
            .strikePrice(strikePrice).expirationDate(expirationDate).setup(setup)
            .entryDate(entryDate).exitDate(exitDate).status(status)
            .entryPrice(entryPrice).exitPrice(exitPrice).quantity(quantity).fees(fees)
            .targetPrice(targetPrice).stopLossPrice(stopLossPrice).pnl(pnl).notes(notes)
            .entryEmotion(entryEmotion).exitEmotion(exitEmotion)
            .checklist(checklist).disciplineScore(disciplineScore)
            .violationReason(violationReason);
    }

    public static final class Builder {
        private String id;
        private String ticker;
        private TradeDirection direction = TradeDirection.LONG;
        private OptionType optionType = OptionType.CALL;
        private Double strikePrice;
        private LocalDate expirationDate;
        private String setup;
        private LocalDateTime entryDate;
        private LocalDateTime exitDate;
        private TradeStatus status = TradeStatus.OPEN;
        private double entryPrice;
        private Double exitPrice;
        private int quantity = 1;
        private double fees;
        private Double targetPrice;
        private Double stopLossPrice;
        private Double pnl;
        private String notes = "";
        private Emotion entryEmotion = Emotion.CALM;
        private Emotion exitEmotion;
        private DisciplineChecklist checklist;
        private int disciplineScore;
        private String violationReason;

        private Builder() {}

        public Builder id(String id)                             { this.id = id; return this; }
        public Builder ticker(String ticker)                     { this.ticker = ticker; return this; }
        public Builder direction(TradeDirection direction)       { this.direction = direction; return this; }
        public Builder optionType(OptionType optionType)         { this.optionType = optionType; return this; }
        public Builder strikePrice(Double strikePrice)           { this.strikePrice = strikePrice; return this; }
        public Builder expirationDate(LocalDate expirationDate)  { this.expirationDate = expirationDate; return this; }
        public Builder setup(String setup)                       { this.setup = setup; return this; }
        public Builder entryDate(LocalDateTime entryDate)        { this.entryDate = entryDate; return this; }
        public Builder exitDate(LocalDateTime exitDate)          { this.exitDate = exitDate; return this; }
        public Builder status(TradeStatus status)                { this.status = status; return this; }
        public Builder entryPrice(double entryPrice)             { this.entryPrice = entryPrice; return this; }
        public Builder exitPrice(Double exitPrice)               { this.exitPrice = exitPrice; return this; }
        public Builder quantity(int quantity)                    { this.quantity = quantity; return this; }
        public Builder fees(double fees)                         { this.fees = fees; return this; }
        public Builder targetPrice(Double targetPrice)           { this.targetPrice = targetPrice; return this; }
        public Builder stopLossPrice(Double stopLossPrice)       { this.stopLossPrice = stopLossPrice; return this; }
        public Builder pnl(Double pnl)                           { this.pnl = pnl; return this; }
        public Builder notes(String notes)                       { this.notes = notes; return this; }
        public Builder entryEmotion(Emotion entryEmotion)        { this.entryEmotion = entryEmotion; return this; }
        public Builder exitEmotion(Emotion exitEmotion)          { this.exitEmotion = exitEmotion; return this; }
        public Builder checklist(DisciplineChecklist checklist)  { this.checklist = checklist; return this; }
        public Builder disciplineScore(int disciplineScore)      { this.disciplineScore = disciplineScore; return this; }
        public Builder violationReason(String violationReason)   { this.violationReason = violationReason; return this; }

        public Trade build() {
            return new Trade(id, ticker, direction, optionType, strikePrice, expirationDate, setup,
                entryDate, exitDate, status, entryPrice, exitPrice, quantity, fees,
                targetPrice, stopLossPrice, pnl, notes, entryEmotion, exitEmotion,
                checklist, disciplineScore, violationReason);
        }
    }
}
