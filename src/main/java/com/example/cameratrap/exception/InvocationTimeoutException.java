package com.example.cameratrap.exception;

public class InvocationTimeoutException extends PipelineException {

    public InvocationTimeoutException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
