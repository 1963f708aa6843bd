package com.tinyeditor.common.auth;

import com.tinyeditor.core.context.EditorContext;

public interface PermissionChecker {

    boolean hasCapability(User user, String capability, EditorContext context);

    /**
     * Whether the user may see the context at all (e.g. is enrolled in the course).
     */
    boolean canAccess(User user, EditorContext context);

    default boolean hasAnyCapability(User user, Iterable<String> capabilities, EditorContext context) {
        for (String capability : capabilities) {
            if (hasCapability(user, capability, context)) return true;
        }
        return false;
    }
}
