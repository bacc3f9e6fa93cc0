package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Response of a generateContent call, or one element of a streamed response.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerateContentResponse {

    @JsonProperty("candidates")
    @Builder.Default
    List<Candidate> candidates = List.of();

    @JsonProperty("promptFeedback")
    PromptFeedback promptFeedback;

    @JsonProperty("usageMetadata")
    UsageMetadata usageMetadata;

    /**
     * Concatenated text parts of the first candidate, or null if there is none.
     */
    public String text() {
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }

        Content content = candidates.get(0).getContent();
        if (content == null || content.getParts() == null) {
            return null;
        }

        String text = content.getParts().stream()
                .map(Part::getText)
                .filter(Objects::nonNull)
                .collect(Collectors.joining());
        return text.isEmpty() ? null : text;
    }

    /**
     * Block reason from the prompt feedback, if any.
     */
    public BlockReason blockReason() {
        return promptFeedback != null ? promptFeedback.getBlockReason() : null;
    }
}
