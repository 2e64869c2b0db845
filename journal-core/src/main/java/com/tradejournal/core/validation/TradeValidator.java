package com.tradejournal.core.validation;

import com.tradejournal.core.exception.InvalidTradeException;
import com.tradejournal.core.model.Trade;
import com.tradejournal.core.model.TradeStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Gatekeeper for trades entering the ledger.
 *
 * <p>Write-side only. The read-side calculators never call this; they skip
 * inconsistent records instead of failing, so imported data cannot break the
 * dashboard.
 */
public final class TradeValidator {

    private TradeValidator() {}

    /**
     * Trims and upper-cases the ticker, defaults missing notes to "" and blank
     * setup / violation reason to null. Does not validate.
     */
    public static Trade normalize(Trade trade) {
        String ticker = trade.ticker() != null ? trade.ticker().trim().toUpperCase(Locale.ROOT) : null;
        return trade.toBuilder()
            .ticker(ticker)
            .notes(trade.notes() != null ? trade.notes() : "")
            .setup(blankToNull(trade.setup()))
            .violationReason(blankToNull(trade.violationReason()))
            .build();
    }

    /**
     * @return the trade unchanged when it is valid
     * @throws InvalidTradeException listing every violation otherwise
     */
    public static Trade validate(Trade trade) {
        List<String> violations = violations(trade);
        if (!violations.isEmpty()) {
            throw new InvalidTradeException(trade.id() != null ? trade.id() : "new", violations);
        }
        return trade;
    }

    /** All rule violations of {@code trade}; empty when valid. */
    public static List<String> violations(Trade trade) {
        List<String> out = new ArrayList<>();

        if (isBlank(trade.id()))       out.add("id is required");
        if (isBlank(trade.ticker()))   out.add("ticker is required");
        if (trade.direction() == null) out.add("direction is required");
        if (trade.optionType() == null) out.add("optionType is required");
        if (trade.status() == null)    out.add("status is required");
        if (trade.entryDate() == null) out.add("entryDate is required");
        if (trade.checklist() == null) out.add("checklist is required");

        if (trade.quantity() <= 0) out.add("quantity must be positive");
        if (!isNonNegativeFinite(trade.entryPrice())) out.add("entryPrice must be a finite number >= 0");
        if (!isNonNegativeFinite(trade.fees()))       out.add("fees must be a finite number >= 0");
        checkOptionalPrice(out, "exitPrice", trade.exitPrice());
        checkOptionalPrice(out, "strikePrice", trade.strikePrice());
        checkOptionalPrice(out, "targetPrice", trade.targetPrice());
        checkOptionalPrice(out, "stopLossPrice", trade.stopLossPrice());

        if (trade.disciplineScore() < 0 || trade.disciplineScore() > 100) {
            out.add("disciplineScore must be within 0..100");
        }

        if (trade.status() == TradeStatus.CLOSED) {
            if (trade.pnl() == null || !Double.isFinite(trade.pnl())) out.add("closed trade requires a finite pnl");
            if (trade.exitPrice() == null) out.add("closed trade requires an exitPrice");
        } else if (trade.status() == TradeStatus.OPEN) {
            if (trade.pnl() != null)       out.add("open trade must not carry a realized pnl");
            if (trade.exitPrice() != null) out.add("open trade must not carry an exitPrice");
        }

        if (trade.exitDate() != null && trade.entryDate() != null
                && trade.exitDate().isBefore(trade.entryDate())) {
            out.add("exitDate must not be before entryDate");
        }
        return out;
    }

    private static void checkOptionalPrice(List<String> out, String field, Double value) {
        if (value != null && !isNonNegativeFinite(value)) {
            out.add(field + " must be a finite number >= 0");
        }
    }

    private static boolean isNonNegativeFinite(double value) {
        return Double.isFinite(value) && value >= 0;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }
}
