package com.quantops.examples.simulated;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantops.core.progress.ProgressBridge;
import com.quantops.worker.DomainException;
import com.quantops.worker.ExecutionContext;
import com.quantops.worker.OperationFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Simulated strategy design agent. Runs a fixed sequence of drafting steps
 * and returns the strategy it "wrote" along with token usage.
 */
public class SimulatedDesign implements OperationFunction {

    private static final Logger log = LoggerFactory.getLogger(SimulatedDesign.class);

    private static final List<String> STEPS = List.of("research market", "draft indicators", "write strategy config");
    private static final int TOKENS_PER_STEP = 400;
    private static final double COST_PER_TOKEN = 0.000015;

    @Override
    public JsonNode execute(ExecutionContext ctx) throws DomainException {
        JsonNode request = ctx.getRequest();
        String symbol = request.path("symbol").asText("EURUSD");
        String style = request.path("style").asText("momentum");
        String strategy = request.hasNonNull("strategy_name")
            ? request.get("strategy_name").asText()
            : String.format("%s_%s_v1", style, symbol.toLowerCase(Locale.ROOT));
        long delayMs = request.path("step_delay_ms").asLong(50);

        for (int step = ctx.startUnit(); step < STEPS.size(); step++) {
            ctx.throwIfCancelled();
            Pause.sleep(delayMs);
            int completed = step + 1;
            ctx.progress().writeState(100.0 * completed / STEPS.size(), "Design: " + STEPS.get(step),
                Map.of(ProgressBridge.CURRENT_STEP, STEPS.get(step),
                    ProgressBridge.STEPS_COMPLETED, completed,
                    ProgressBridge.STEPS_TOTAL, STEPS.size()));
            ctx.checkpointIfDue(completed, () -> ctx.toJsonNode(Map.of("strategy_name", strategy)));
        }

        int tokens = STEPS.size() * TOKENS_PER_STEP;
        log.info("Designed strategy {} for {}", strategy, symbol);
        return ctx.toJsonNode(Map.of(
            "strategy_name", strategy,
            "strategy_path", "strategies/" + strategy + ".yaml",
            "tokens_used", tokens,
            "cost_usd", tokens * COST_PER_TOKEN));
    }
}
