package com.quantops.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quantops.core.model.GateResult;
import com.quantops.engine.metrics.OperationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class QualityGatesTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private QualityGates gates;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        gates = new QualityGates(GateThresholds.defaults(), new OperationMetrics(meterRegistry));
    }

    private ObjectNode training(double accuracy, double initialLoss, double finalLoss) {
        return objectMapper.createObjectNode()
            .put("accuracy", accuracy)
            .put("initial_loss", initialLoss)
            .put("final_loss", finalLoss);
    }

    private ObjectNode backtest(double winRate, double maxDrawdown, double sharpe) {
        return objectMapper.createObjectNode()
            .put("win_rate", winRate)
            .put("max_drawdown", maxDrawdown)
            .put("sharpe_ratio", sharpe);
    }

    // ========== Training Gate ==========

    @Test
    @DisplayName("A healthy training result passes")
    void testTrainingPasses() {
        assertThat(gates.checkTraining(training(0.62, 0.9, 0.35)).passed()).isTrue();
    }

    @Test
    @DisplayName("Low accuracy fails with actual and threshold in the reason")
    void testAccuracyBelowThreshold() {
        GateResult result = gates.checkTraining(training(0.05, 0.9, 0.35));

        assertThat(result.passed()).isFalse();
        assertThat(result.reason()).isEqualTo("accuracy_below_threshold (5.0% < 10.0%)");
    }

    @Test
    @DisplayName("Accuracy is checked before loss")
    void testFirstFailureWins() {
        GateResult result = gates.checkTraining(training(0.05, 0.9, 0.95));

        assertThat(result.reason()).startsWith("accuracy_below_threshold");
    }

    @Test
    @DisplayName("A final loss above the maximum fails")
    void testLossTooHigh() {
        GateResult result = gates.checkTraining(training(0.5, 0.9, 0.85));

        assertThat(result.reason()).isEqualTo("loss_too_high (0.850 > 0.800)");
    }

    @Test
    @DisplayName("A loss that grew by more than the allowed margin fails")
    void testInsufficientLossDecrease() {
        GateResult result = gates.checkTraining(training(0.5, 0.4, 0.7));

        assertThat(result.passed()).isFalse();
        assertThat(result.reason()).isEqualTo("insufficient_loss_decrease (-75.0% < -50.0%)");
    }

    @Test
    @DisplayName("The loss decrease check is skipped without an initial loss")
    void testNoInitialLoss() {
        assertThat(gates.checkTraining(training(0.5, 0.0, 0.7)).passed()).isTrue();
    }

    @Test
    @DisplayName("Values exactly on the thresholds pass")
    void testTrainingBoundaries() {
        assertThat(gates.checkTraining(training(0.10, 0.4, 0.6)).passed()).isTrue();
        assertThat(gates.checkTraining(training(0.10, 1.0, 0.8)).passed()).isTrue();
    }

    @Test
    @DisplayName("Missing metrics count as zero")
    void testMissingMetrics() {
        GateResult result = gates.checkTraining(objectMapper.createObjectNode());

        assertThat(result.reason()).isEqualTo("accuracy_below_threshold (0.0% < 10.0%)");
        assertThat(gates.checkTraining(null).passed()).isFalse();
    }

    // ========== Backtest Gate ==========

    @Test
    @DisplayName("Backtest checks run win rate, drawdown, then Sharpe")
    void testBacktestOrder() {
        assertThat(gates.checkBacktest(backtest(0.55, 0.2, 1.1)).passed()).isTrue();
        assertThat(gates.checkBacktest(backtest(0.05, 0.6, -2.0)).reason())
            .isEqualTo("win_rate_below_threshold (5.0% < 10.0%)");
        assertThat(gates.checkBacktest(backtest(0.5, 0.45, -2.0)).reason())
            .isEqualTo("drawdown_too_high (45.0% > 40.0%)");
        assertThat(gates.checkBacktest(backtest(0.5, 0.2, -0.8)).reason())
            .isEqualTo("sharpe_below_threshold (-0.80 < -0.50)");
    }

    @Test
    @DisplayName("Backtest values exactly on the thresholds pass")
    void testBacktestBoundaries() {
        assertThat(gates.checkBacktest(backtest(0.10, 0.40, -0.5)).passed()).isTrue();
    }

    @Test
    @DisplayName("Custom thresholds apply and failures are counted per gate")
    void testCustomThresholdsAndMetrics() {
        QualityGates strict = new QualityGates(
            new GateThresholds(0.5, 0.5, 0.0, 0.5, 0.1, 1.0), new OperationMetrics(meterRegistry));

        assertThat(strict.checkTraining(training(0.45, 0.9, 0.3)).passed()).isFalse();
        assertThat(strict.checkBacktest(backtest(0.55, 0.2, 1.1)).passed()).isFalse();
        assertThat(strict.checkBacktest(backtest(0.55, 0.05, 1.1)).passed()).isTrue();

        assertThat(meterRegistry.get(OperationMetrics.GATE_FAILURES).tag("gate", "training").counter().count())
            .isEqualTo(1.0);
        assertThat(meterRegistry.get(OperationMetrics.GATE_FAILURES).tag("gate", "backtest").counter().count())
            .isEqualTo(1.0);
    }
}
