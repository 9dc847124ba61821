package com.quantops.examples.simulated;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantops.worker.DomainException;
import com.quantops.worker.ExecutionContext;
import com.quantops.worker.OperationFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Simulated assessment agent. Grades a strategy from its backtest Sharpe ratio.
 */
public class SimulatedAssessment implements OperationFunction {

    private static final Logger log = LoggerFactory.getLogger(SimulatedAssessment.class);

    static final int TOKENS_USED = 800;
    private static final double COST_USD = 0.012;

    @Override
    public JsonNode execute(ExecutionContext ctx) throws DomainException {
        JsonNode request = ctx.getRequest();
        String strategy = request.path("strategy_name").asText("unnamed");
        double sharpe = request.path("backtest").path("sharpe_ratio").asDouble();
        double accuracy = request.path("training").path("accuracy").asDouble();

        ctx.throwIfCancelled();
        Pause.sleep(request.path("delay_ms").asLong(50));
        ctx.progress().writeState(100.0, "Assessment written");

        String verdict = verdict(sharpe);
        log.info("Assessed {}: {} (sharpe {})", strategy, verdict, sharpe);
        return ctx.toJsonNode(Map.of(
            "verdict", verdict,
            "assessment", String.format(Locale.ROOT,
                "%s reached %.1f%% accuracy and a Sharpe ratio of %.2f", strategy, accuracy * 100, sharpe),
            "tokens_used", TOKENS_USED,
            "cost_usd", COST_USD));
    }

    static String verdict(double sharpe) {
        if (sharpe > 1.0) {
            return "promising";
        }
        return sharpe > 0.0 ? "neutral" : "weak";
    }
}
