package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Blocking threshold sent with a {@link SafetySetting}.
 */
public enum HarmBlockThreshold {

    @JsonEnumDefaultValue
    UNKNOWN,

    @JsonProperty("HARM_BLOCK_THRESHOLD_UNSPECIFIED")
    UNSPECIFIED,

    @JsonProperty("BLOCK_LOW_AND_ABOVE")
    LOW_AND_ABOVE,

    @JsonProperty("BLOCK_MEDIUM_AND_ABOVE")
    MEDIUM_AND_ABOVE,

    @JsonProperty("BLOCK_ONLY_HIGH")
    ONLY_HIGH,

    @JsonProperty("BLOCK_NONE")
    NONE
}
