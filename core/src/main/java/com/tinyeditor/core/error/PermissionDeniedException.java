package com.tinyeditor.core.error;

/**
 * The user may not read anything in the requested context.
 */
public class PermissionDeniedException extends EditorConfigException {
    public static final String ERROR_CODE = "nopermission";

    public PermissionDeniedException(String message) {
        super(ERROR_CODE, message);
    }
}
