package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Reason a prompt was rejected before any candidate was generated.
 */
public enum BlockReason {

    @JsonEnumDefaultValue
    UNKNOWN,

    BLOCKED_REASON_UNSPECIFIED,

    SAFETY,

    OTHER
}
