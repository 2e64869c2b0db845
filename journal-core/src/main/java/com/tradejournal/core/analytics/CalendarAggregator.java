package com.tradejournal.core.analytics;

import com.tradejournal.core.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Buckets a ledger into calendar days of one month by entry date.
 *
 * <p>Every trade entered in the month counts toward the day's trade count; only
 * realized, consistent trades add pnl and wins.
 */
public final class CalendarAggregator {

    private static final Logger log = LoggerFactory.getLogger(CalendarAggregator.class);

    private CalendarAggregator() {}

    public static MonthlySummary month(List<Trade> trades, YearMonth month) {
        Map<LocalDate, int[]> counts = new TreeMap<>();
        Map<LocalDate, Double> pnlByDay = new TreeMap<>();

        for (Trade trade : trades) {
            if (trade.entryDate() == null) continue;
            LocalDate day = trade.entryDate().toLocalDate();
            if (!YearMonth.from(day).equals(month)) continue;

            int[] c = counts.computeIfAbsent(day, d -> new int[2]);
            pnlByDay.putIfAbsent(day, 0.0);
            c[0]++;

            if (!trade.hasPnl()) continue;
            if (!trade.isLifecycleConsistent()) {
                log.warn("Skipping inconsistent trade in calendar. id={} status={}", trade.id(), trade.status());
                continue;
            }
            pnlByDay.merge(day, trade.pnl(), Double::sum);
            if (trade.pnl() > 0) c[1]++;
        }

        List<DailySummary> days = new ArrayList<>(counts.size());
        double totalPnl = 0.0;
        int tradeCount = 0;
        int wins = 0;
        for (Map.Entry<LocalDate, int[]> e : counts.entrySet()) {
            double pnl = pnlByDay.get(e.getKey());
            days.add(new DailySummary(e.getKey(), pnl, e.getValue()[0], e.getValue()[1]));
            totalPnl   += pnl;
            tradeCount += e.getValue()[0];
            wins       += e.getValue()[1];
        }

        double winRate = tradeCount > 0 ? (wins * 100.0) / tradeCount : 0.0;
        return new MonthlySummary(month, days, totalPnl, tradeCount, wins, winRate);
    }
}
