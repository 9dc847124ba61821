package com.quantops.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Research cycle settings bound from {@code quantops.agent.*}.
 *
 * <pre>
 * quantops:
 *   agent:
 *     poll-interval: 5s
 *     max-concurrent-cycles: 1
 *     gates:
 *       min-accuracy: 0.10
 *       max-drawdown: 0.40
 * </pre>
 */
@ConfigurationProperties(prefix = "quantops.agent")
public record AgentProperties(
    @DefaultValue("5s") Duration pollInterval,
    @DefaultValue("1") int maxConcurrentCycles,
    @DefaultValue GateThresholds gates
) {}
