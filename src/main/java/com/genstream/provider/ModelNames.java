package com.genstream.provider;

import com.genstream.exception.InvalidRequestException;

/**
 * Model name helpers.
 */
public final class ModelNames {

    private static final String MODELS_PREFIX = "models/";

    private ModelNames() {
    }

    /**
     * Resource name of a model as the endpoints expect it. Names that already
     * contain a path ("models/gemini-pro", "tunedModels/x") are kept as given.
     */
    public static String fullName(String model) {
        if (model == null || model.isBlank()) {
            throw new InvalidRequestException("Model must be specified");
        }
        return model.contains("/") ? model : MODELS_PREFIX + model;
    }
}
