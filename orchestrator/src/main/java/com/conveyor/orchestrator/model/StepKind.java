package com.conveyor.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a step runs. Closed set: the router and the config builder switch
 * over it exhaustively.
 */
public enum StepKind {
    /** Shell commands in the default base image. */
    SCRIPT,
    /** Commands in a user-specified container image. */
    DOCKER,
    /** An AI coding agent driven by a wrapper script. */
    AGENT;

    /** Parse the lowercase name used in pipeline definitions. */
    @JsonCreator
    public static StepKind fromName(String name) {
        if (name == null || name.isBlank()) {
            return SCRIPT;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown step type: " + name);
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
