package com.tinyeditor.core.error;

public class NotFoundException extends EditorConfigException {
    public static final String ERROR_CODE = "notfound";

    public NotFoundException(String message) {
        super(ERROR_CODE, message);
    }
}
