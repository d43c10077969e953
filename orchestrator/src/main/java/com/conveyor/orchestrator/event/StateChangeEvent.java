package com.conveyor.orchestrator.event;

import java.time.Instant;

/**
 * Published after every persisted state change, for UI fan-out.
 * Nothing in the orchestrator depends on these being delivered.
 *
 * @param entity "pipeline_run", "step_execution", "workspace", "runner" or "debug_session"
 */
public record StateChangeEvent(String entity, String id, String status, Instant at) {}
