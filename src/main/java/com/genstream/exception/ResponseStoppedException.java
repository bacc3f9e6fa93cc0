package com.genstream.exception;

import com.genstream.model.FinishReason;
import com.genstream.model.GenerateContentResponse;
import lombok.Getter;

/**
 * A candidate stopped generating for a reason other than a natural stop or
 * the token limit. {@link #getResponse()} holds what was generated up to that
 * point.
 */
@Getter
public class ResponseStoppedException extends GenerativeAiException {

    private final FinishReason finishReason;

    private final transient GenerateContentResponse response;

    public ResponseStoppedException(FinishReason finishReason, GenerateContentResponse response) {
        super("Content generation stopped. Reason: " + finishReason);
        this.finishReason = finishReason;
        this.response = response;
    }
}
