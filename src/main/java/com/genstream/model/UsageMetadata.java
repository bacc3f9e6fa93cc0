package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Token usage statistics.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UsageMetadata {

    @JsonProperty("promptTokenCount")
    Integer promptTokenCount;

    @JsonProperty("candidatesTokenCount")
    Integer candidatesTokenCount;

    @JsonProperty("totalTokenCount")
    Integer totalTokenCount;
}
