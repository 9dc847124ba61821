package com.quantops.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantops.core.model.GateResult;
import com.quantops.engine.metrics.OperationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Deterministic checks between research phases.
 *
 * Checks run in a fixed order and the first failure wins. A value exactly on
 * a threshold passes; a missing metric counts as 0.
 */
public class QualityGates {

    private static final Logger log = LoggerFactory.getLogger(QualityGates.class);

    public static final String TRAINING_GATE = "training";
    public static final String BACKTEST_GATE = "backtest";

    private final GateThresholds thresholds;
    private final OperationMetrics metrics;

    public QualityGates(GateThresholds thresholds, OperationMetrics metrics) {
        this.thresholds = thresholds;
        this.metrics = metrics;
    }

    /**
     * Check a training result: accuracy, then final loss, then relative loss decrease.
     */
    public GateResult checkTraining(JsonNode result) {
        double accuracy = metric(result, "accuracy");
        double finalLoss = metric(result, "final_loss");
        double initialLoss = metric(result, "initial_loss");

        GateResult outcome;
        if (accuracy < thresholds.minAccuracy()) {
            outcome = GateResult.fail(format("accuracy_below_threshold (%.1f%% < %.1f%%)",
                accuracy * 100, thresholds.minAccuracy() * 100));
        } else if (finalLoss > thresholds.maxLoss()) {
            outcome = GateResult.fail(format("loss_too_high (%.3f > %.3f)", finalLoss, thresholds.maxLoss()));
        } else if (initialLoss > 0 && (initialLoss - finalLoss) / initialLoss < thresholds.minLossDecrease()) {
            double decrease = (initialLoss - finalLoss) / initialLoss;
            outcome = GateResult.fail(format("insufficient_loss_decrease (%.1f%% < %.1f%%)",
                decrease * 100, thresholds.minLossDecrease() * 100));
        } else {
            outcome = GateResult.pass();
        }
        return record(TRAINING_GATE, outcome);
    }

    /**
     * Check a backtest result: win rate, then max drawdown, then Sharpe ratio.
     */
    public GateResult checkBacktest(JsonNode result) {
        double winRate = metric(result, "win_rate");
        double maxDrawdown = metric(result, "max_drawdown");
        double sharpe = metric(result, "sharpe_ratio");

        GateResult outcome;
        if (winRate < thresholds.minWinRate()) {
            outcome = GateResult.fail(format("win_rate_below_threshold (%.1f%% < %.1f%%)",
                winRate * 100, thresholds.minWinRate() * 100));
        } else if (maxDrawdown > thresholds.maxDrawdown()) {
            outcome = GateResult.fail(format("drawdown_too_high (%.1f%% > %.1f%%)",
                maxDrawdown * 100, thresholds.maxDrawdown() * 100));
        } else if (sharpe < thresholds.minSharpe()) {
            outcome = GateResult.fail(format("sharpe_below_threshold (%.2f < %.2f)", sharpe, thresholds.minSharpe()));
        } else {
            outcome = GateResult.pass();
        }
        return record(BACKTEST_GATE, outcome);
    }

    public GateThresholds thresholds() {
        return thresholds;
    }

    // ========== Helper Methods ==========

    private GateResult record(String gate, GateResult outcome) {
        if (!outcome.passed()) {
            metrics.gateFailed(gate);
            log.warn("{} gate failed: {}", gate, outcome.reason());
        }
        return outcome;
    }

    private static double metric(JsonNode result, String key) {
        if (result == null) {
            return 0.0;
        }
        JsonNode value = result.get(key);
        return value != null && value.isNumber() ? value.asDouble() : 0.0;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
