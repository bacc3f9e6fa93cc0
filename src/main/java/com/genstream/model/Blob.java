package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Inline binary data, base64 encoded on the wire.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Blob {

    @JsonProperty("mimeType")
    String mimeType;

    @JsonProperty("data")
    String data;
}
