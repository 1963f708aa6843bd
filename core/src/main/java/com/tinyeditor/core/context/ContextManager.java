package com.tinyeditor.core.context;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.error.InvalidContextException;
import com.tinyeditor.core.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the known contexts (system, users, courses, modules) in contexts.json.
 */
public class ContextManager implements ContextResolver {
    private static final Logger logger = LoggerFactory.getLogger(ContextManager.class);
    private final File dbFile;
    private final Gson gson;
    private final Map<Long, EditorContext> contexts = new ConcurrentHashMap<>();
    // Key = level + ":" + instanceId
    private final Map<String, Long> instanceIndex = new ConcurrentHashMap<>();

    public ContextManager(Kernel kernel) {
        this.dbFile = new File(kernel.getToolsDir(), "contexts.json");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
        if (!contexts.containsKey(EditorContext.SYSTEM_CONTEXT_ID)) {
            put(EditorContext.system());
        }
    }

    @Override
    public EditorContext resolve(String contextLevel, long instanceId) {
        ContextLevel level = ContextLevel.fromShortName(contextLevel);
        if (level == null) {
            throw new InvalidContextException("Invalid context level: " + contextLevel);
        }
        if (level == ContextLevel.SYSTEM) {
            return contexts.get(EditorContext.SYSTEM_CONTEXT_ID);
        }
        Long id = instanceIndex.get(key(level, instanceId));
        EditorContext context = id == null ? null : contexts.get(id);
        if (context == null) {
            throw new NotFoundException("No " + level.getShortName() + " context for instance " + instanceId);
        }
        return context;
    }

    @Override
    public EditorContext getById(long contextId) {
        return contexts.get(contextId);
    }

    public synchronized EditorContext createUserContext(long userId) {
        return create(ContextLevel.USER, userId, EditorContext.SYSTEM_CONTEXT_ID, 0L);
    }

    public synchronized EditorContext createCourse(long courseId, long maxBytes) {
        return create(ContextLevel.COURSE, courseId, EditorContext.SYSTEM_CONTEXT_ID, maxBytes);
    }

    public synchronized EditorContext createModule(long cmId, long courseId, long maxBytes) {
        EditorContext course = resolve(ContextLevel.COURSE.getShortName(), courseId);
        return create(ContextLevel.MODULE, cmId, course.id(), maxBytes);
    }

    private EditorContext create(ContextLevel level, long instanceId, long parentId, long maxBytes) {
        Long existing = instanceIndex.get(key(level, instanceId));
        if (existing != null) {
            logger.warn("Context {}:{} already exists (id {}). Reusing it.", level.getShortName(), instanceId, existing);
            return contexts.get(existing);
        }
        long nextId = contexts.keySet().stream().mapToLong(Long::longValue).max().orElse(0L) + 1;
        EditorContext context = new EditorContext(nextId, level, instanceId, parentId, maxBytes);
        put(context);
        save();
        logger.info("Context created: {} {} (id {})", level.getShortName(), instanceId, nextId);
        return context;
    }

    private void put(EditorContext context) {
        contexts.put(context.id(), context);
        instanceIndex.put(key(context.level(), context.instanceId()), context.id());
    }

    private static String key(ContextLevel level, long instanceId) {
        return level.getShortName() + ":" + instanceId;
    }

    private void save() {
        List<EditorContext> sorted = new ArrayList<>(contexts.values());
        sorted.sort(Comparator.comparingLong(EditorContext::id));
        try (Writer w = new FileWriter(dbFile, StandardCharsets.UTF_8)) {
            gson.toJson(sorted, w);
        } catch (IOException e) {
            logger.error("Context DB save error", e);
        }
    }

    private void load() {
        if (!dbFile.exists()) return;
        try (Reader r = new FileReader(dbFile, StandardCharsets.UTF_8)) {
            List<EditorContext> loaded = gson.fromJson(r, new TypeToken<List<EditorContext>>() {}.getType());
            if (loaded != null) {
                loaded.forEach(this::put);
                logger.info("Contexts loaded: {}", loaded.size());
            }
        } catch (Exception e) {
            logger.error("Context DB load error", e);
        }
    }
}
