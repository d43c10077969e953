package com.conveyor.orchestrator.api;

import com.conveyor.orchestrator.auth.StepTokenService;
import com.conveyor.orchestrator.event.StepFinishedEvent;
import com.conveyor.orchestrator.execution.StepExecutionService;
import com.conveyor.orchestrator.model.StepExecution;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for the bearer-token control endpoints a running step calls.
 */
@WebMvcTest(StepControlController.class)
@RecordApplicationEvents
class StepControlControllerTest {

    @Autowired MockMvc           mockMvc;
    @Autowired ApplicationEvents published;
    @MockitoBean StepTokenService     tokens;
    @MockitoBean StepExecutionService executions;

    private final UUID runId = UUID.randomUUID();
    private final String key = runId + ":0:1";

    // ------------------------------------------------------------------
    // Authentication
    // ------------------------------------------------------------------

    @Test
    void heartbeat_withoutAuthorization_returns401() throws Exception {
        mockMvc.perform(post("/api/steps/{key}/heartbeat", key))
                .andExpect(status().isUnauthorized());
        verify(tokens, never()).validate(any());
    }

    @Test
    void heartbeat_nonBearerScheme_returns401() throws Exception {
        mockMvc.perform(post("/api/steps/{key}/heartbeat", key)
                        .header(HttpHeaders.AUTHORIZATION, "Basic dXNlcjpwYXNz"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void heartbeat_unknownToken_returns403() throws Exception {
        when(tokens.validate("stale")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/steps/{key}/heartbeat", key)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer stale"))
                .andExpect(status().isForbidden());
    }

    @Test
    void heartbeat_tokenForAnotherStep_returns403() throws Exception {
        when(tokens.validate("tok")).thenReturn(Optional.of(runId + ":1:1"));

        mockMvc.perform(post("/api/steps/{key}/heartbeat", key)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andExpect(status().isForbidden());
        verify(executions, never()).findByKey(any());
    }

    @Test
    void heartbeat_validToken_recordsLiveness() throws Exception {
        StepExecution execution = authorized();
        when(executions.heartbeat(execution.getId())).thenReturn(true);

        mockMvc.perform(post("/api/steps/{key}/heartbeat", key)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer tok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true));
    }

    // ------------------------------------------------------------------
    // Status and logs
    // ------------------------------------------------------------------

    @Test
    void status_failedWithoutExitCode_reportsExitOne() throws Exception {
        StepExecution execution = authorized();

        mockMvc.perform(post("/api/steps/{key}/status", key)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer tok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"failed\",\"error\":\"lint errors\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("accepted"));

        assertThat(published.stream(StepFinishedEvent.class))
                .containsExactly(new StepFinishedEvent(execution.getId(), 1, "lint errors", null));
    }

    @Test
    void status_running_marksRunningWithContainer() throws Exception {
        StepExecution execution = authorized();

        mockMvc.perform(post("/api/steps/{key}/status", key)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer tok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"running\",\"containerId\":\"c-42\"}"))
                .andExpect(status().isOk());

        verify(executions).markRunning(execution.getId(), "c-42");
    }

    @Test
    void status_unknownValue_returns400() throws Exception {
        authorized();

        mockMvc.perform(post("/api/steps/{key}/status", key)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer tok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"paused\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void logs_appendsLines() throws Exception {
        StepExecution execution = authorized();

        mockMvc.perform(post("/api/steps/{key}/logs", key)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer tok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lines\":[\"one\",\"two\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(2));

        verify(executions).appendLogs(execution.getId(), List.of("one", "two"));
    }

    private StepExecution authorized() {
        StepExecution execution = new StepExecution(key, UUID.randomUUID(), runId, 0, 1);
        ReflectionTestUtils.setField(execution, "id", UUID.randomUUID());
        when(tokens.validate("tok")).thenReturn(Optional.of(key));
        when(executions.findByKey(key)).thenReturn(Optional.of(execution));
        return execution;
    }
}
