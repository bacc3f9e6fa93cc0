package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Likelihood that a piece of content falls into a harm category.
 */
public enum HarmProbability {

    @JsonEnumDefaultValue
    UNKNOWN,

    HARM_PROBABILITY_UNSPECIFIED,

    NEGLIGIBLE,

    LOW,

    MEDIUM,

    HIGH
}
