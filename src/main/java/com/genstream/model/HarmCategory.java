package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Category of content a safety rating or setting applies to.
 */
public enum HarmCategory {

    @JsonEnumDefaultValue
    UNKNOWN,

    @JsonProperty("HARM_CATEGORY_HARASSMENT")
    HARASSMENT,

    @JsonProperty("HARM_CATEGORY_HATE_SPEECH")
    HATE_SPEECH,

    @JsonProperty("HARM_CATEGORY_SEXUALLY_EXPLICIT")
    SEXUALLY_EXPLICIT,

    @JsonProperty("HARM_CATEGORY_DANGEROUS_CONTENT")
    DANGEROUS_CONTENT
}
