package com.quantops.examples.simulated;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quantops.core.checkpoint.SeriesSampler;
import com.quantops.core.model.ResumeContext;
import com.quantops.core.progress.ProgressBridge;
import com.quantops.worker.DomainException;
import com.quantops.worker.ErrorKind;
import com.quantops.worker.ExecutionContext;
import com.quantops.worker.OperationFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Simulated portfolio backtest over synthetic bars, processed in chunks.
 * One unit is one chunk of bars.
 *
 * Checkpoints store the running portfolio statistics and a down-sampled
 * equity curve.
 *
 * <pre>
 * {"strategy_name": "momentum_v1", "symbol": "EURUSD", "bars": 5000, "bars_per_unit": 250,
 *  "drift": 0.0004, "unit_delay_ms": 50}
 * </pre>
 */
public class SimulatedBacktest implements OperationFunction {

    private static final Logger log = LoggerFactory.getLogger(SimulatedBacktest.class);

    static final int MAX_CURVE_POINTS = 500;
    private static final double STARTING_EQUITY = 100_000.0;
    private static final double VOLATILITY = 0.01;
    private static final double TRADE_PROBABILITY = 0.1;
    private static final int DRAWS_PER_BAR = 2;

    @Override
    public JsonNode execute(ExecutionContext ctx) throws DomainException {
        JsonNode request = ctx.getRequest();
        String strategy = request.path("strategy_name").asText("unnamed");
        String symbol = request.path("symbol").asText("EURUSD");
        int bars = request.path("bars").asInt(5000);
        int barsPerUnit = request.path("bars_per_unit").asInt(250);
        double drift = request.path("drift").asDouble(0.0004);
        long delayMs = request.path("unit_delay_ms").asLong(50);
        if (bars < 2) {
            throw new DomainException(ErrorKind.BACKTEST_DATA,
                String.format("Not enough bars for %s: %d < 2", symbol, bars));
        }
        if (barsPerUnit <= 0) {
            throw new DomainException(ErrorKind.INVALID_REQUEST, "bars_per_unit must be positive, got " + barsPerUnit);
        }

        int units = (bars + barsPerUnit - 1) / barsPerUnit;
        Random random = new Random((strategy + "/" + symbol).hashCode());
        Portfolio portfolio = ctx.getResumeContext().map(Portfolio::restore).orElseGet(Portfolio::new);
        int startBar = Math.min(bars, ctx.startUnit() * barsPerUnit);
        for (long i = 0; i < (long) startBar * DRAWS_PER_BAR; i++) {
            random.nextDouble();
        }
        if (ctx.startUnit() > 0) {
            log.info("Backtest of {} on {} resumes at bar {}", strategy, symbol, startBar);
        }

        for (int unit = ctx.startUnit(); unit < units; unit++) {
            if (ctx.isCancelled()) {
                ctx.saveCancellationCheckpoint(unit, portfolio.toJson(ctx));
                ctx.throwIfCancelled();
            }

            int from = unit * barsPerUnit;
            int to = Math.min(bars, from + barsPerUnit);
            for (int bar = from; bar < to; bar++) {
                portfolio.onBar(drift + VOLATILITY * (random.nextDouble() - 0.5) * 2, random.nextDouble());
            }
            Pause.sleep(delayMs);

            int completed = unit + 1;
            ctx.progress().writeState(100.0 * to / bars,
                String.format("Bar %d/%d on %s", to, bars, symbol),
                Map.of(ProgressBridge.CURRENT_STEP, "bars " + from + "-" + to,
                    ProgressBridge.STEPS_COMPLETED, completed,
                    ProgressBridge.STEPS_TOTAL, units));
            ctx.progress().appendMetric(Map.of("bar", to, "equity", portfolio.equity, "trades", portfolio.trades));
            ctx.checkpointIfDue(completed, () -> portfolio.toJson(ctx));
        }

        ObjectNode result = ctx.toJsonNode(Map.of(
            "symbol", symbol,
            "bars", bars,
            "trades", portfolio.trades,
            "win_rate", portfolio.winRate(),
            "max_drawdown", portfolio.maxDrawdown,
            "sharpe_ratio", portfolio.sharpe(),
            "total_return", portfolio.equity / STARTING_EQUITY - 1)).deepCopy();
        ArrayNode curve = result.putArray("equity_curve");
        SeriesSampler.sampleToLimit(portfolio.curve, MAX_CURVE_POINTS).forEach(curve::add);
        return result;
    }

    /**
     * Running statistics of the simulated portfolio.
     */
    private static final class Portfolio {

        double equity = STARTING_EQUITY;
        double peak = STARTING_EQUITY;
        double maxDrawdown;
        int trades;
        int wins;
        long bars;
        double sumReturns;
        double sumSquaredReturns;
        final List<Double> curve = new ArrayList<>();

        void onBar(double barReturn, double tradeDraw) {
            equity *= 1 + barReturn;
            peak = Math.max(peak, equity);
            maxDrawdown = Math.max(maxDrawdown, (peak - equity) / peak);
            bars++;
            sumReturns += barReturn;
            sumSquaredReturns += barReturn * barReturn;
            if (tradeDraw < TRADE_PROBABILITY) {
                trades++;
                if (barReturn > 0) {
                    wins++;
                }
            }
            curve.add(equity);
        }

        double winRate() {
            return trades == 0 ? 0.0 : (double) wins / trades;
        }

        double sharpe() {
            if (bars < 2) {
                return 0.0;
            }
            double mean = sumReturns / bars;
            double variance = sumSquaredReturns / bars - mean * mean;
            return variance <= 0 ? 0.0 : mean / Math.sqrt(variance) * Math.sqrt(252);
        }

        JsonNode toJson(ExecutionContext ctx) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("equity", equity);
            json.put("peak", peak);
            json.put("max_drawdown", maxDrawdown);
            json.put("trades", trades);
            json.put("wins", wins);
            json.put("bars", bars);
            json.put("sum_returns", sumReturns);
            json.put("sum_squared_returns", sumSquaredReturns);
            json.put("equity_curve", SeriesSampler.sampleToLimit(curve, MAX_CURVE_POINTS));
            return ctx.toJsonNode(json);
        }

        static Portfolio restore(ResumeContext resume) {
            JsonNode json = resume.state();
            Portfolio portfolio = new Portfolio();
            portfolio.equity = json.path("equity").asDouble(STARTING_EQUITY);
            portfolio.peak = json.path("peak").asDouble(STARTING_EQUITY);
            portfolio.maxDrawdown = json.path("max_drawdown").asDouble();
            portfolio.trades = json.path("trades").asInt();
            portfolio.wins = json.path("wins").asInt();
            portfolio.bars = json.path("bars").asLong();
            portfolio.sumReturns = json.path("sum_returns").asDouble();
            portfolio.sumSquaredReturns = json.path("sum_squared_returns").asDouble();
            json.path("equity_curve").forEach(node -> portfolio.curve.add(node.asDouble()));
            return portfolio;
        }
    }
}
