package com.genstream.exception;

import com.genstream.model.BlockReason;
import com.genstream.model.GenerateContentResponse;
import lombok.Getter;

/**
 * The prompt was rejected before any candidate was generated.
 */
@Getter
public class PromptBlockedException extends GenerativeAiException {

    private final transient GenerateContentResponse response;

    public PromptBlockedException(GenerateContentResponse response) {
        super("Prompt was blocked: " + response.blockReason());
        this.response = response;
    }

    public BlockReason getBlockReason() {
        return response.blockReason();
    }
}
