package com.genji.queue.usecase.completion.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FailedAutoverifyMessage(
        @JsonProperty("submitted_code") String submittedCode,
        @JsonProperty("submitted_time") String submittedTime,
        @JsonProperty("user_id") Long userId,
        JsonNode extracted
) {
}
