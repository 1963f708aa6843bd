package com.tinyeditor.core.context;

import java.util.LinkedList;
import java.util.List;

public interface ContextResolver {
    // Guards against broken parent chains in hand-edited context files
    int MAX_DEPTH = 16;

    /**
     * Resolves a context from its level name and instance id.
     *
     * @throws com.tinyeditor.core.error.InvalidContextException if the level is unknown
     * @throws com.tinyeditor.core.error.NotFoundException       if no such instance exists
     */
    EditorContext resolve(String contextLevel, long instanceId);

    /**
     * @return the context with the given id, or null
     */
    EditorContext getById(long contextId);

    /**
     * @return the context and all its parents, system context first
     */
    default List<EditorContext> getPath(EditorContext context) {
        LinkedList<EditorContext> path = new LinkedList<>();
        EditorContext current = context;
        while (current != null && path.size() < MAX_DEPTH) {
            path.addFirst(current);
            if (current.isSystem() || current.parentId() == 0L) break;
            current = getById(current.parentId());
        }
        return path;
    }
}
