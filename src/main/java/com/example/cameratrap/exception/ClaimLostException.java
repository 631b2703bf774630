package com.example.cameratrap.exception;

/**
 * Another worker took over the image after this invocation's lease expired.
 */
public class ClaimLostException extends PipelineException {

    public ClaimLostException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
