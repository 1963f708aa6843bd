package com.tinyeditor.core.error;

/**
 * Base for failures that abort a configuration request.
 * The error code is machine readable and goes out to web service clients as is.
 */
public class EditorConfigException extends RuntimeException {
    private final String errorCode;

    public EditorConfigException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
