package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Safety rating for a candidate or a prompt.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SafetyRating {

    @JsonProperty("category")
    HarmCategory category;

    @JsonProperty("probability")
    HarmProbability probability;

    @JsonProperty("blocked")
    Boolean blocked;
}
