package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Source attributed for a span of the generated content.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CitationSource {

    @JsonProperty("startIndex")
    Integer startIndex;

    @JsonProperty("endIndex")
    Integer endIndex;

    @JsonProperty("uri")
    String uri;

    @JsonProperty("license")
    String license;
}
