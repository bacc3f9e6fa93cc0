package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Sampling and output parameters for a generation request.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationConfig {

    @JsonProperty("temperature")
    Double temperature;

    @JsonProperty("topP")
    Double topP;

    @JsonProperty("topK")
    Integer topK;

    @JsonProperty("candidateCount")
    Integer candidateCount;

    @JsonProperty("maxOutputTokens")
    Integer maxOutputTokens;

    @JsonProperty("stopSequences")
    List<String> stopSequences;

    @JsonProperty("responseMimeType")
    String responseMimeType; // text/plain, application/json

    @JsonProperty("presencePenalty")
    Double presencePenalty;

    @JsonProperty("frequencyPenalty")
    Double frequencyPenalty;
}
