package com.genji.queue.usecase.job.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobState {
    QUEUED,
    PROCESSING,
    SUCCEEDED,
    FAILED,
    TIMEOUT;

    public boolean isInProgress() {
        return this == QUEUED || this == PROCESSING;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobState from(String value) {
        return JobState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
