package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Multi-part message content, either from the user or from the model.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Content {

    @JsonProperty("role")
    String role; // user, model

    @JsonProperty("parts")
    @Builder.Default
    List<Part> parts = List.of();

    public static Content user(String text) {
        return Content.builder()
                .role("user")
                .parts(List.of(Part.text(text)))
                .build();
    }
}
