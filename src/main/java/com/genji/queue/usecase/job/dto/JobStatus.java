package com.genji.queue.usecase.job.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobStatus(
        UUID id,
        JobState status,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("error_msg") String errorMsg
) {
}
