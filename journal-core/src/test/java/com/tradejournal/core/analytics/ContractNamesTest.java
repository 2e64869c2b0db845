package com.tradejournal.core.analytics;

import com.tradejournal.core.model.OptionType;
import com.tradejournal.core.model.Trade;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static com.tradejournal.core.support.TestTrades.D1;
import static com.tradejournal.core.support.TestTrades.open;
import static org.junit.jupiter.api.Assertions.*;

class ContractNamesTest {

    @Test
    @DisplayName("full contract → TICKER STRIKE{C|P} yyMMdd")
    void fullName() {
        Trade t = open("1", D1).toBuilder()
            .optionType(OptionType.PUT).strikePrice(510.0).expirationDate(LocalDate.of(2024, 5, 15)).build();
        assertEquals("SPY 510P 240515", ContractNames.of(t));
    }

    @Test
    @DisplayName("fractional strikes keep their decimals")
    void fractionalStrike() {
        Trade t = open("1", D1).toBuilder()
            .optionType(OptionType.CALL).strikePrice(172.5).expirationDate(LocalDate.of(2024, 6, 21)).build();
        assertEquals("SPY 172.5C 240621", ContractNames.of(t));
    }

    @Test
    @DisplayName("missing strike or expiration → bare ticker")
    void fallback() {
        assertEquals("SPY", ContractNames.of(open("1", D1)));
    }
}
