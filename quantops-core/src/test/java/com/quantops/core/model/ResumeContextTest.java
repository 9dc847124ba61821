package com.quantops.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ResumeContextTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void fromCheckpoint_shouldUnwrapEnvelope() {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put(ResumeContext.UNIT_INDEX, 7);
        envelope.putObject(ResumeContext.ORIGINAL_REQUEST).put("epochs", 20);
        envelope.putObject(ResumeContext.STATE).put("best_loss", 0.12);

        Checkpoint checkpoint = new Checkpoint(
            "op-1", CheckpointType.CANCELLATION, Instant.now(), envelope, null, 10, 0,
            Map.of("model.pt", new byte[] {1, 2}));

        ResumeContext context = ResumeContext.fromCheckpoint(checkpoint);

        assertThat(context.resumeFromUnit()).isEqualTo(7);
        assertThat(context.originalRequest().get("epochs").asInt()).isEqualTo(20);
        assertThat(context.state().get("best_loss").asDouble()).isEqualTo(0.12);
        assertThat(context.artifacts()).containsKey("model.pt");
        assertThat(context.checkpointType()).isEqualTo(CheckpointType.CANCELLATION);
    }

    @Test
    void fromCheckpoint_shouldDefaultMissingFields() {
        Checkpoint checkpoint = new Checkpoint(
            "op-1", CheckpointType.PERIODIC, Instant.now(), objectMapper.createObjectNode(),
            null, 2, 0, null);

        ResumeContext context = ResumeContext.fromCheckpoint(checkpoint);

        assertThat(context.resumeFromUnit()).isZero();
        assertThat(context.state().isObject()).isTrue();
        assertThat(context.originalRequest().isEmpty()).isTrue();
    }
}
