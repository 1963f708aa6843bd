package com.tinyeditor.core.context;

/**
 * A scope under which permissions and settings are evaluated.
 * maxBytes only means something for course and module contexts (0 = no own limit).
 */
public record EditorContext(
        long id,
        ContextLevel level,
        long instanceId,
        long parentId,
        long maxBytes
) {
    public static final long SYSTEM_CONTEXT_ID = 1L;

    public static EditorContext system() {
        return new EditorContext(SYSTEM_CONTEXT_ID, ContextLevel.SYSTEM, 0L, 0L, 0L);
    }

    public boolean isSystem() {
        return level == ContextLevel.SYSTEM;
    }
}
