package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One piece of a {@link Content}. Exactly one of the fields is normally set.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Part {

    @JsonProperty("text")
    String text;

    @JsonProperty("inlineData")
    Blob inlineData;

    @JsonProperty("functionCall")
    FunctionCall functionCall;

    @JsonProperty("functionResponse")
    FunctionResponse functionResponse;

    public static Part text(String text) {
        return Part.builder().text(text).build();
    }
}
