package com.quantops.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.quantops.agent.AgentService;
import com.quantops.agent.AgentService.AgentStatus;
import com.quantops.core.model.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for research cycles.
 */
@RestController
@RequestMapping("/api/v1/agent")
public class AgentController {

    private final AgentService agentService;

    public AgentController(AgentService agentService) {
        this.agentService = agentService;
    }

    /**
     * Start a research cycle. The body is passed to every phase.
     */
    @PostMapping("/trigger")
    public ResponseEntity<Map<String, Object>> trigger(@RequestBody(required = false) JsonNode parameters) {
        if (parameters != null && !parameters.isObject()) {
            throw new IllegalArgumentException("Trigger parameters must be a JSON object");
        }
        Operation cycle = agentService.trigger(parameters != null ? parameters : JsonNodeFactory.instance.objectNode());
        return ResponseEntity.ok(Map.of(
            "success", true,
            "operation_id", cycle.operationId(),
            "status", "started"
        ));
    }

    @GetMapping("/status")
    public ResponseEntity<AgentStatus> status() {
        return ResponseEntity.ok(agentService.status());
    }
}
