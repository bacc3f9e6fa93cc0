package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How the model may use the declared functions.
 */
public enum FunctionCallingMode {

    @JsonEnumDefaultValue
    UNKNOWN,

    @JsonProperty("MODE_UNSPECIFIED")
    UNSPECIFIED,

    /** The model decides between text and a function call. */
    AUTO,

    /** The model must call one of the functions. */
    ANY,

    /** Function calls are disabled. */
    NONE
}
