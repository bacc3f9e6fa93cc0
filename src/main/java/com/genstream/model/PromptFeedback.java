package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Feedback about the prompt itself. A set block reason means no candidates
 * were generated.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PromptFeedback {

    @JsonProperty("blockReason")
    BlockReason blockReason;

    @JsonProperty("safetyRatings")
    @Builder.Default
    List<SafetyRating> safetyRatings = List.of();
}
