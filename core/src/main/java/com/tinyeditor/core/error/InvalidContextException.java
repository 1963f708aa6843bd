package com.tinyeditor.core.error;

/**
 * Thrown when a context level name is not recognised.
 */
public class InvalidContextException extends EditorConfigException {
    public static final String ERROR_CODE = "invalidcontext";

    public InvalidContextException(String message) {
        super(ERROR_CODE, message);
    }
}
