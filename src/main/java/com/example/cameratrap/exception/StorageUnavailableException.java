package com.example.cameratrap.exception;

/**
 * The object store could not be reached. Retried like an inference outage.
 */
public class StorageUnavailableException extends PipelineException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
