package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A single generated response option.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Candidate {

    @JsonProperty("index")
    Integer index;

    @JsonProperty("content")
    Content content;

    @JsonProperty("finishReason")
    FinishReason finishReason; // null while the candidate is still being generated

    @JsonProperty("safetyRatings")
    @Builder.Default
    List<SafetyRating> safetyRatings = List.of();

    @JsonProperty("citationMetadata")
    CitationMetadata citationMetadata;
}
