package com.rdslens.inference;

/**
 * Natural-language inference service that answers with a JSON object.
 */
public interface InferenceClient {

    /**
     * Whether the client is configured well enough to be called.
     */
    boolean isEnabled();

    /**
     * Ask for a JSON completion.
     *
     * @param systemPrompt instructions for the model
     * @param userPrompt the question
     * @return result holding syntactically valid JSON text on success
     */
    InferenceResult completeJson(String systemPrompt, String userPrompt);
}
