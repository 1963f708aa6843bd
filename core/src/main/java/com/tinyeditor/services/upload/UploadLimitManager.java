package com.tinyeditor.services.upload;

import com.tinyeditor.core.config.ConfigStore;
import com.tinyeditor.core.config.Configuration;
import com.tinyeditor.core.context.ContextLevel;
import com.tinyeditor.core.context.ContextResolver;
import com.tinyeditor.core.context.EditorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the effective upload limit: the smallest positive limit among the server,
 * the site and every course or module on the context path.
 */
public class UploadLimitManager implements UploadLimitService {
    private static final Logger logger = LoggerFactory.getLogger(UploadLimitManager.class);
    private final ConfigStore config;
    private final ContextResolver contexts;

    public UploadLimitManager(ConfigStore config, ContextResolver contexts) {
        this.config = config;
        this.contexts = contexts;
    }

    @Override
    public long maxUploadSize(EditorContext context) {
        long limit = readBytes("uploadmaxfilesize");
        limit = smallest(limit, readBytes("maxbytes"));

        if (context != null) {
            for (EditorContext c : contexts.getPath(context)) {
                if (c.level() == ContextLevel.COURSE || c.level() == ContextLevel.MODULE) {
                    limit = smallest(limit, c.maxBytes());
                }
            }
        }
        return limit;
    }

    // 0 means "no limit" on every level
    private static long smallest(long current, long candidate) {
        if (candidate <= 0) return current;
        if (current <= 0) return candidate;
        return Math.min(current, candidate);
    }

    private long readBytes(String key) {
        String raw = config.get(Configuration.CORE_NAMESPACE, key, "0");
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed core/{}: {}", key, raw);
            return 0;
        }
    }
}
