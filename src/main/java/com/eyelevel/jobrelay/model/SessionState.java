package com.eyelevel.jobrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a batch session as recorded in the registry.
 */
public enum SessionState {
    SUBMITTING, SUBMITTED, MERGED, FAILED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SessionState convertByValue(final String value) {
        return SessionState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
