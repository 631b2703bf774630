package com.example.cameratrap.exception;

/**
 * Base type for failures raised while processing a single image. {@link #isRetryable()} decides
 * whether the invocation retries the failing step or marks the image failed straight away.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
