package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Body of generateContent and streamGenerateContent calls.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GenerateContentRequest implements Request {

    @JsonIgnore
    String model;

    @JsonProperty("contents")
    List<Content> contents;

    @JsonProperty("safetySettings")
    List<SafetySetting> safetySettings;

    @JsonProperty("generationConfig")
    GenerationConfig generationConfig;

    @JsonProperty("tools")
    List<Tool> tools;

    @JsonProperty("toolConfig")
    ToolConfig toolConfig;

    @JsonProperty("systemInstruction")
    Content systemInstruction;
}
