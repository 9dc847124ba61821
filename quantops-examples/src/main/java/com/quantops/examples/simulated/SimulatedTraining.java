package com.quantops.examples.simulated;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quantops.core.checkpoint.ArtifactManifest;
import com.quantops.core.checkpoint.SeriesSampler;
import com.quantops.core.model.ResumeContext;
import com.quantops.core.progress.ProgressBridge;
import com.quantops.worker.DomainException;
import com.quantops.worker.ErrorKind;
import com.quantops.worker.ExecutionContext;
import com.quantops.worker.OperationFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Simulated model training: one unit per epoch.
 *
 * Loss decays and accuracy rises deterministically for a given strategy name.
 * Checkpoints carry the weights ({@code model.pt}) and optimizer step count
 * ({@code optimizer.pt}); a resumed run restores both.
 *
 * <pre>
 * {"strategy_name": "momentum_v1", "epochs": 20, "epoch_delay_ms": 100, "fail_at_epoch": 7}
 * </pre>
 */
public class SimulatedTraining implements OperationFunction {

    private static final Logger log = LoggerFactory.getLogger(SimulatedTraining.class);

    static final String MODEL = "model.pt";
    static final String OPTIMIZER = "optimizer.pt";
    private static final int WEIGHTS = 16;
    private static final int MAX_HISTORY_POINTS = 200;

    @Override
    public ArtifactManifest artifactManifest() {
        return ArtifactManifest.MODEL_CHECKPOINT;
    }

    @Override
    public JsonNode execute(ExecutionContext ctx) throws DomainException {
        JsonNode request = ctx.getRequest();
        String strategy = request.path("strategy_name").asText("unnamed");
        int epochs = request.path("epochs").asInt(10);
        long delayMs = request.path("epoch_delay_ms").asLong(100);
        int failAt = request.path("fail_at_epoch").asInt(-1);
        if (epochs <= 0) {
            throw new DomainException(ErrorKind.INVALID_REQUEST, "epochs must be positive, got " + epochs);
        }

        Random random = new Random(strategy.hashCode());
        double initialLoss = 0.9 + random.nextDouble() * 0.3;
        double decay = 0.12 + random.nextDouble() * 0.13;
        double ceiling = 0.55 + random.nextDouble() * 0.2;

        TrainingState state = ctx.getResumeContext()
            .map(this::restore)
            .orElseGet(() -> TrainingState.fresh(initialLoss));
        if (ctx.startUnit() > 0) {
            // Skip the draws of finished epochs so a resumed run follows the same trajectory
            for (int i = 0; i < ctx.startUnit() * (WEIGHTS + 1); i++) {
                random.nextDouble();
            }
            log.info("Training {} resumes at epoch {} (loss {})", strategy, ctx.startUnit(), state.loss);
        }

        for (int epoch = ctx.startUnit(); epoch < epochs; epoch++) {
            if (ctx.isCancelled()) {
                ctx.saveCancellationCheckpoint(epoch, state.toJson(ctx), state.artifacts());
                ctx.throwIfCancelled();
            }
            if (epoch == failAt) {
                throw new DomainException(ErrorKind.TRAINING_DATA,
                    String.format("Training data exhausted at epoch %d for %s", epoch, strategy));
            }

            Pause.sleep(delayMs);
            state.step(random, initialLoss, decay, ceiling, epoch + 1);

            int completed = epoch + 1;
            ctx.progress().writeState(100.0 * completed / epochs,
                String.format("Epoch %d/%d (loss %.4f)", completed, epochs, state.loss),
                Map.of(ProgressBridge.CURRENT_STEP, "epoch " + completed,
                    ProgressBridge.STEPS_COMPLETED, completed,
                    ProgressBridge.STEPS_TOTAL, epochs));
            ctx.progress().appendMetric(Map.of("epoch", completed, "loss", state.loss, "accuracy", state.accuracy));
            ctx.checkpointIfDue(completed, () -> state.toJson(ctx), state::artifacts);
        }

        ObjectNode result = ctx.toJsonNode(Map.of(
            "accuracy", state.accuracy,
            "initial_loss", state.initialLoss,
            "final_loss", state.loss,
            "epochs_trained", epochs,
            "model_path", "models/" + strategy + "/model.pt")).deepCopy();
        ArrayNode history = result.putArray("loss_history");
        SeriesSampler.sampleToLimit(state.lossHistory, MAX_HISTORY_POINTS).forEach(history::add);
        return result;
    }

    private TrainingState restore(ResumeContext resume) {
        JsonNode json = resume.state();
        TrainingState state = new TrainingState(json.path("initial_loss").asDouble());
        state.loss = json.path("loss").asDouble();
        state.accuracy = json.path("accuracy").asDouble();
        json.path("loss_history").forEach(node -> state.lossHistory.add(node.asDouble()));

        byte[] model = resume.artifacts().get(MODEL);
        if (model != null) {
            ByteBuffer buffer = ByteBuffer.wrap(model);
            for (int i = 0; i < WEIGHTS && buffer.remaining() >= Double.BYTES; i++) {
                state.weights[i] = buffer.getDouble();
            }
        }
        byte[] optimizer = resume.artifacts().get(OPTIMIZER);
        if (optimizer != null && optimizer.length >= Long.BYTES) {
            state.optimizerSteps = ByteBuffer.wrap(optimizer).getLong();
        }
        return state;
    }

    /**
     * Mutable training state owned by the executing thread.
     */
    private static final class TrainingState {

        final double initialLoss;
        final double[] weights = new double[WEIGHTS];
        final List<Double> lossHistory = new ArrayList<>();
        double loss;
        double accuracy;
        long optimizerSteps;

        TrainingState(double initialLoss) {
            this.initialLoss = initialLoss;
        }

        static TrainingState fresh(double initialLoss) {
            TrainingState state = new TrainingState(initialLoss);
            state.loss = initialLoss;
            state.accuracy = 0.0;
            return state;
        }

        void step(Random random, double initial, double decay, double ceiling, int epoch) {
            loss = initial * Math.exp(-decay * epoch) + 0.05 * random.nextDouble();
            accuracy = ceiling * (1 - Math.exp(-decay * 2 * epoch));
            for (int i = 0; i < weights.length; i++) {
                weights[i] += (random.nextDouble() - 0.5) * 0.01;
            }
            optimizerSteps++;
            lossHistory.add(loss);
        }

        JsonNode toJson(ExecutionContext ctx) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("initial_loss", initialLoss);
            json.put("loss", loss);
            json.put("accuracy", accuracy);
            json.put("loss_history", SeriesSampler.sampleToLimit(lossHistory, MAX_HISTORY_POINTS));
            return ctx.toJsonNode(json);
        }

        Map<String, byte[]> artifacts() {
            ByteBuffer model = ByteBuffer.allocate(WEIGHTS * Double.BYTES);
            for (double weight : weights) {
                model.putDouble(weight);
            }
            byte[] optimizer = ByteBuffer.allocate(Long.BYTES).putLong(optimizerSteps).array();
            Map<String, byte[]> artifacts = new HashMap<>();
            artifacts.put(MODEL, model.array());
            artifacts.put(OPTIMIZER, optimizer);
            return artifacts;
        }
    }
}
