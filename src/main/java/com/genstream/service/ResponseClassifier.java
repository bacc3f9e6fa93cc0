package com.genstream.service;

import com.genstream.exception.PromptBlockedException;
import com.genstream.exception.ResponseStoppedException;
import com.genstream.exception.SerializationException;
import com.genstream.model.BlockReason;
import com.genstream.model.Candidate;
import com.genstream.model.GenerateContentResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Rejects responses that arrived fine over HTTP but carry a failure in their
 * content: a blocked prompt, a candidate cut short, or nothing at all.
 *
 * Applied to every element of a stream, since a later element can report a
 * block after earlier ones were clean.
 */
@Slf4j
public class ResponseClassifier {

    /**
     * Pass a response through or throw the failure it represents.
     *
     * @return the same response
     * @throws PromptBlockedException    if the prompt was blocked and no candidate exists
     * @throws ResponseStoppedException  if a candidate ended abnormally
     * @throws SerializationException    if the response has neither candidates nor a block reason
     */
    public GenerateContentResponse classify(GenerateContentResponse response) {
        List<Candidate> candidates = response.getCandidates();
        boolean noCandidates = candidates == null || candidates.isEmpty();
        BlockReason blockReason = response.blockReason();
        boolean blocked = blockReason != null && blockReason != BlockReason.BLOCKED_REASON_UNSPECIFIED;

        if (noCandidates && blocked) {
            log.debug("Prompt blocked: {}", blockReason);
            throw new PromptBlockedException(response);
        }

        if (noCandidates) {
            throw new SerializationException("Error deserializing response, found no candidates and no block reason");
        }

        for (Candidate candidate : candidates) {
            if (candidate.getFinishReason() != null && candidate.getFinishReason().isAbnormal()) {
                log.debug("Candidate {} stopped: {}", candidate.getIndex(), candidate.getFinishReason());
                throw new ResponseStoppedException(candidate.getFinishReason(), response);
            }
        }

        return response;
    }
}
