package com.tradejournal.core.risk;

import com.tradejournal.core.metrics.MetricsAggregator;
import com.tradejournal.core.model.UserProfile;
import com.tradejournal.core.model.UserSettings;

/**
 * Turns {@link UserSettings} percentages into amounts and prices.
 *
 * <pre>
 *   currentBalance = initialCapital + realized pnl
 *   maxRiskAmount  = max(0, currentBalance × maxRiskPerTradePercent / 100)
 *   targetPrice    = entry × (1 + defaultTargetPercent / 100)
 *   stopLossPrice  = max(0, entry × (1 − defaultStopLossPercent / 100))
 * </pre>
 */
public final class RiskBudgetCalculator {

    private RiskBudgetCalculator() {}

    public static RiskBudget forProfile(UserProfile profile, Double entryPrice) {
        double balance = currentBalance(profile);
        UserSettings settings = profile.settings();
        double maxRisk = Math.max(0.0, balance * settings.maxRiskPerTradePercent() / 100.0);

        if (entryPrice == null) {
            return new RiskBudget(balance, maxRisk, null, null);
        }
        return new RiskBudget(balance, maxRisk,
            defaultTarget(entryPrice, settings), defaultStopLoss(entryPrice, settings));
    }

    public static double currentBalance(UserProfile profile) {
        return profile.initialCapital() + MetricsAggregator.aggregate(profile.trades()).totalPnL();
    }

    public static double defaultTarget(double entryPrice, UserSettings settings) {
        return entryPrice * (1 + settings.defaultTargetPercent() / 100.0);
    }

    public static double defaultStopLoss(double entryPrice, UserSettings settings) {
        return Math.max(0.0, entryPrice * (1 - settings.defaultStopLossPercent() / 100.0));
    }
}
