package com.genstream.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Reason the server gave for a candidate having stopped generating.
 *
 * STOP and MAX_TOKENS are normal endings. Everything else except an unset
 * value means the candidate was cut short.
 */
public enum FinishReason {

    /**
     * A value this client does not know about yet.
     */
    @JsonEnumDefaultValue
    UNKNOWN,

    FINISH_REASON_UNSPECIFIED,

    STOP,

    MAX_TOKENS,

    SAFETY,

    RECITATION,

    OTHER;

    /**
     * Check if the candidate ended abnormally.
     */
    public boolean isAbnormal() {
        return this == SAFETY || this == RECITATION || this == OTHER || this == UNKNOWN;
    }
}
