package com.rdslens.inference;

/**
 * Result wrapper for an inference call.
 */
public class InferenceResult {
    private final String content;
    private final boolean enabled;
    private final String error;

    /**
     * Create a result.
     *
     * @param content JSON content
     * @param enabled whether inference is enabled
     * @param error error message, if any
     */
    public InferenceResult(String content, boolean enabled, String error) {
        this.content = content;
        this.enabled = enabled;
        this.error = error;
    }

    public static InferenceResult success(String content) {
        return new InferenceResult(content, true, null);
    }

    public static InferenceResult disabled() {
        return new InferenceResult(null, false, null);
    }

    public static InferenceResult error(String error) {
        return new InferenceResult(null, true, error);
    }

    public boolean isSuccess() {
        return enabled && error == null && content != null;
    }

    public String getContent() {
        return content;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getError() {
        return error;
    }
}
