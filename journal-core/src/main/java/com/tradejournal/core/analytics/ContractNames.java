package com.tradejournal.core.analytics;

import com.tradejournal.core.model.Trade;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;

/**
 * Compact contract label such as {@code SPY 510P 240515}. Falls back to the bare
 * ticker when strike, option type or expiration is unknown.
 */
public final class ContractNames {

    private static final DateTimeFormatter EXPIRY = DateTimeFormatter.ofPattern("yyMMdd");

    private ContractNames() {}

    public static String of(Trade trade) {
        if (trade.strikePrice() == null || trade.optionType() == null || trade.expirationDate() == null) {
            return trade.ticker();
        }
        String strike = BigDecimal.valueOf(trade.strikePrice()).stripTrailingZeros().toPlainString();
        return trade.ticker() + " " + strike + trade.optionType().code() + " " + EXPIRY.format(trade.expirationDate());
    }
}
