package com.conveyor.orchestrator.driver;

import com.conveyor.orchestrator.driver.dto.DriverEvent;
import com.conveyor.orchestrator.driver.dto.DriverResult;
import com.conveyor.orchestrator.execution.ExecutionConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * HTTP client for the local container driver.
 *
 * The driver owns the container runtime: it creates workspace volumes,
 * runs one container per step execution and guarantees the container is
 * removed after completion or timeout. Step execution is a single POST whose
 * response is an NDJSON stream of status, log and result events.
 *
 * Called from worker threads, so blocking I/O here is fine.
 */
@Component
public class ContainerDriverClient {

    private static final Logger log = LoggerFactory.getLogger(ContainerDriverClient.class);

    // Extra wall-clock time on top of the step timeout for kill and cleanup.
    static final Duration KILL_GRACE = Duration.ofSeconds(30);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public ContainerDriverClient(
            @Value("${conveyor.driver.base-url}") String baseUrl,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Volumes
    // ------------------------------------------------------------------

    /** Create the named workspace volume. Idempotent on the driver side. */
    public void createVolume(String volumeName) {
        log.info("Creating volume '{}'", volumeName);
        send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/volumes"))
                        .timeout(Duration.ofSeconds(60))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(toJson(Map.of("name", volumeName))))
                        .build(),
                "createVolume " + volumeName);
    }

    public void deleteVolume(String volumeName) {
        log.info("Deleting volume '{}'", volumeName);
        send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/volumes/" + volumeName))
                        .timeout(Duration.ofSeconds(60))
                        .DELETE()
                        .build(),
                "deleteVolume " + volumeName);
    }

    // ------------------------------------------------------------------
    // Step execution
    // ------------------------------------------------------------------

    /**
     * Run one step container and block until the driver reports its result.
     *
     * @param onEvent receives every status and log event as it arrives
     * @throws DriverException driver unreachable, non-2xx, or stream ended without a result
     */
    public DriverResult executeStep(ExecutionConfig config, Consumer<DriverEvent> onEvent) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/steps/execute"))
                .timeout(Duration.ofSeconds(config.timeoutSeconds()).plus(KILL_GRACE))
                .header("Content-Type", "application/json")
                .header("Accept", "application/x-ndjson")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(config)))
                .build();

        HttpResponse<Stream<String>> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofLines());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriverException("executeStep " + config.executionKey() + " interrupted", e);
        } catch (Exception e) {
            throw new DriverException("executeStep " + config.executionKey() + " failed", e);
        }

        try (Stream<String> lines = resp.body()) {
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new DriverException("executeStep " + config.executionKey()
                        + " failed: HTTP " + resp.statusCode());
            }
            String containerId = null;
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                if (line.isBlank()) continue;
                DriverEvent event = parse(line);
                if (event.containerId() != null) {
                    containerId = event.containerId();
                }
                if (event.isResult()) {
                    int exit = event.exitCode() != null ? event.exitCode() : -1;
                    return new DriverResult(Boolean.TRUE.equals(event.success()), exit, event.error(), containerId);
                }
                onEvent.accept(event);
            }
            throw new DriverException("executeStep " + config.executionKey() + ": stream ended without a result");
        } catch (DriverException e) {
            throw e;
        } catch (Exception e) {
            throw new DriverException("executeStep " + config.executionKey() + ": stream broken", e);
        }
    }

    /** Ask the driver to kill and remove a running container. */
    public void stopContainer(String containerId) {
        log.info("Stopping container {}", containerId);
        send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/containers/" + containerId + "/stop"))
                        .timeout(Duration.ofSeconds(30))
                        .POST(HttpRequest.BodyPublishers.noBody())
                        .build(),
                "stopContainer " + containerId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new DriverException(opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (DriverException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriverException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new DriverException(opName + " failed", e);
        }
    }

    private DriverEvent parse(String line) {
        try {
            return json.readValue(line, DriverEvent.class);
        } catch (JsonProcessingException e) {
            throw new DriverException("Unparseable driver event: " + line, e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new DriverException("JSON serialization failed", e);
        }
    }
}
