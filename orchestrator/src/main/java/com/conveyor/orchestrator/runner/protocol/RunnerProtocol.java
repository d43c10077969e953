package com.conveyor.orchestrator.runner.protocol;

import com.conveyor.orchestrator.execution.ExecutionConfig;
import com.conveyor.orchestrator.recovery.ReconnectAction;
import com.conveyor.orchestrator.routing.ExecutionRouter;
import com.conveyor.orchestrator.routing.RunnerLabels;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * JSON wire protocol between the backend and remote runners.
 *
 * Runner to backend: register, ack, heartbeat, log, step_complete.
 * Backend to runner: registered, execute_step, pong, error.
 *
 * Every message is an object with a {@code type} field. {@link #parse}
 * checks the required fields of each type and throws
 * {@link ProtocolException} before anything acts on a bad message.
 */
@Component
public class RunnerProtocol {

    /** A runner must register this soon after connecting. */
    public static final Duration REGISTRATION_TIMEOUT = Duration.ofSeconds(10);
    /** An execute_step must be acknowledged this soon or the step is requeued. */
    public static final Duration ACK_TIMEOUT          = Duration.ofSeconds(5);
    /** How often runners are expected to heartbeat. */
    public static final Duration HEARTBEAT_INTERVAL   = Duration.ofSeconds(10);
    /** A runner silent for this long is declared dead. */
    public static final Duration DEATH_TIMEOUT        = Duration.ofSeconds(30);

    public static final String REGISTER      = "register";
    public static final String ACK           = "ack";
    public static final String HEARTBEAT     = "heartbeat";
    public static final String LOG           = "log";
    public static final String STEP_COMPLETE = "step_complete";

    private final ObjectMapper json;

    public RunnerProtocol(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    // ------------------------------------------------------------------
    // Inbound
    // ------------------------------------------------------------------

    public RunnerMessage parse(String text) {
        JsonNode node;
        try {
            node = json.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Message must be a JSON object");
        }
        String type = node.path("type").asText("");
        switch (type) {
            case REGISTER: {
                String runnerId   = requireText(node, "runner_id", type);
                String runnerType = requireText(node, "runner_type", type);
                String name       = node.path("name").asText(runnerId);
                return new RunnerMessage.Register(runnerId, name, runnerType, labels(node.path("labels")));
            }
            case ACK:
                return new RunnerMessage.Ack(requireStepId(node, type));
            case HEARTBEAT:
                return new RunnerMessage.Heartbeat();
            case LOG: {
                UUID stepId = requireStepId(node, type);
                JsonNode lines = node.get("lines");
                if (lines == null || !lines.isArray()) {
                    throw new ProtocolException("Message 'log' requires array field 'lines'");
                }
                List<String> out = new ArrayList<>(lines.size());
                lines.forEach(l -> out.add(l.asText()));
                return new RunnerMessage.Log(stepId, out);
            }
            case STEP_COMPLETE: {
                UUID stepId = requireStepId(node, type);
                JsonNode exit = node.get("exit_code");
                if (exit == null || !exit.canConvertToInt()) {
                    throw new ProtocolException("Message 'step_complete' requires integer field 'exit_code'");
                }
                JsonNode error = node.get("error");
                return new RunnerMessage.StepComplete(stepId, exit.asInt(),
                        error == null || error.isNull() ? null : error.asText());
            }
            default:
                throw new ProtocolException(type.isEmpty()
                        ? "Message has no 'type'"
                        : "Unknown message type: " + type);
        }
    }

    /** Parse a labels object {@code {"arch": "...", "has": [...]}}; missing means none. */
    public RunnerLabels labels(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return RunnerLabels.none();
        }
        if (!node.isObject()) {
            throw new ProtocolException("'labels' must be an object");
        }
        String arch = node.hasNonNull("arch") ? ExecutionRouter.normalizeArch(node.get("arch").asText()) : null;
        Set<String> has = new LinkedHashSet<>();
        node.path("has").forEach(h -> has.add(h.asText()));
        return new RunnerLabels(arch, has);
    }

    // ------------------------------------------------------------------
    // Outbound
    // ------------------------------------------------------------------

    /** Registration accepted, with what to do about the step the runner remembers. */
    public String registered(String runnerId, ReconnectAction action) {
        ObjectNode msg = json.createObjectNode();
        msg.put("type", "registered");
        msg.put("runner_id", runnerId);
        msg.put("action", action.wireName());
        return write(msg);
    }

    public String executeStep(UUID stepId, ExecutionConfig config) {
        ObjectNode msg = json.createObjectNode();
        msg.put("type", "execute_step");
        msg.put("step_id", stepId.toString());
        msg.put("execution_key", config.executionKey());
        msg.set("config", json.valueToTree(config));
        return write(msg);
    }

    public String pong() {
        ObjectNode msg = json.createObjectNode();
        msg.put("type", "pong");
        return write(msg);
    }

    public String error(String message) {
        ObjectNode msg = json.createObjectNode();
        msg.put("type", "error");
        msg.put("message", message);
        return write(msg);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String requireText(JsonNode node, String field, String type) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ProtocolException("Message '" + type + "' requires field '" + field + "'");
        }
        return value.asText();
    }

    private static UUID requireStepId(JsonNode node, String type) {
        String raw = requireText(node, "step_id", type);
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Message '" + type + "' has invalid step_id: " + raw);
        }
    }

    private String write(ObjectNode msg) {
        try {
            return json.writeValueAsString(msg);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode runner message", e);
        }
    }
}
