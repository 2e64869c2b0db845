package com.tradejournal.core.discipline;

import com.tradejournal.core.model.ChecklistAnswers;
import com.tradejournal.core.model.DailyTradeCount;
import com.tradejournal.core.model.DisciplineChecklist;

/**
 * Pre-trade discipline scoring.
 *
 * <pre>
 *   dailyLimitRespected = (existingDailyCount + 0.5) &lt;= maxTradesPerDay
 *   score               = round(100 × trueItems / 6)
 * </pre>
 *
 * <p>The daily-limit item is injected here and cannot be supplied by the caller.
 * Opens and closes each count 0.5 toward the limit; this half weighting is product
 * policy and can undercount distinct round trips on busy days.
 *
 * <p>Pure logic. No side effects.
 */
public final class DisciplineScorer {

    private DisciplineScorer() {}

    /**
     * @param answers            the trader's manual checklist answers
     * @param existingDailyCount trade usage already logged on the new trade's calendar day
     * @param maxTradesPerDay    configured daily allowance (fractional)
     */
    public static DisciplineResult score(ChecklistAnswers answers,
                                         DailyTradeCount existingDailyCount,
                                         double maxTradesPerDay) {
        boolean limitRespected = dailyLimitRespected(existingDailyCount, maxTradesPerDay);
        DisciplineChecklist checklist = DisciplineChecklist.of(answers, limitRespected);
        return new DisciplineResult(checklist, scoreOf(checklist));
    }

    /** True when one more half-unit still fits within {@code maxTradesPerDay}. */
    public static boolean dailyLimitRespected(DailyTradeCount existingDailyCount, double maxTradesPerDay) {
        return existingDailyCount.plusHalf().trades() <= maxTradesPerDay;
    }

    /** Percentage of satisfied items, rounded half up. */
    public static int scoreOf(DisciplineChecklist checklist) {
        return percentage(checklist.trueCount(), DisciplineChecklist.ITEM_COUNT);
    }

    static int percentage(int trueCount, int totalItems) {
        if (totalItems <= 0) return 0;
        return (int) Math.round(100.0 * trueCount / totalItems);
    }
}
