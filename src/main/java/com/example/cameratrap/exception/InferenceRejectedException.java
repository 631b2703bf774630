package com.example.cameratrap.exception;

/**
 * The inference backend refused the input. Retrying the same bytes cannot succeed.
 */
public class InferenceRejectedException extends PipelineException {

    public InferenceRejectedException(String message) {
        super(message);
    }

    public InferenceRejectedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
