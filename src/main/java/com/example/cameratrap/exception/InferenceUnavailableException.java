package com.example.cameratrap.exception;

/**
 * Network or service error from an inference backend.
 */
public class InferenceUnavailableException extends PipelineException {

    public InferenceUnavailableException(String message) {
        super(message);
    }

    public InferenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
