package com.genji.queue.usecase.job.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobUpdate(
        JobState status,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("error_msg") String errorMsg
) {

    public static JobUpdate of(JobState status) {
        return new JobUpdate(status, null, null);
    }

    public static JobUpdate failed(String errorCode, String errorMsg) {
        return new JobUpdate(JobState.FAILED, errorCode, errorMsg);
    }
}
