package com.example.cameratrap.exception;

/**
 * The image bytes could not be read at all: corrupt data, an unsupported format, or a missing
 * object.
 */
public class ImageDecodeException extends PipelineException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
