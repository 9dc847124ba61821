package com.quantops.agent;

import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Pass thresholds for the training and backtest quality gates.
 * Ratios are fractions: 0.10 means 10%.
 */
public record GateThresholds(
    @DefaultValue("0.10") double minAccuracy,
    @DefaultValue("0.8") double maxLoss,
    @DefaultValue("-0.5") double minLossDecrease,
    @DefaultValue("0.10") double minWinRate,
    @DefaultValue("0.40") double maxDrawdown,
    @DefaultValue("-0.5") double minSharpe
) {

    public static GateThresholds defaults() {
        return new GateThresholds(0.10, 0.8, -0.5, 0.10, 0.40, -0.5);
    }
}
