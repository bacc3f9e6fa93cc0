package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Capabilities offered to the model: function declarations and, optionally,
 * server-side code execution.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Tool {

    @JsonProperty("functionDeclarations")
    List<FunctionDeclaration> functionDeclarations;

    // Sent as an empty object to switch code execution on
    @JsonProperty("codeExecution")
    ObjectNode codeExecution;

    public static Tool functions(FunctionDeclaration... declarations) {
        return Tool.builder().functionDeclarations(List.of(declarations)).build();
    }

    public static Tool codeExecution() {
        return Tool.builder().codeExecution(JsonNodeFactory.instance.objectNode()).build();
    }
}
