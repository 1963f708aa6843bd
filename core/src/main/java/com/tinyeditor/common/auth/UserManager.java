package com.tinyeditor.common.auth;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;
import com.tinyeditor.core.Kernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the known users in users.json.
 */
public class UserManager {
    private static final Logger logger = LoggerFactory.getLogger(UserManager.class);
    private final File dbFile;
    private final Gson gson;
    private final Map<Long, User> users = new ConcurrentHashMap<>();
    private final Map<String, Long> usernameIndex = new ConcurrentHashMap<>();

    public UserManager(Kernel kernel) {
        this.dbFile = new File(kernel.getToolsDir(), "users.json");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
    }

    public synchronized User createUser(String username, boolean siteAdmin) {
        String clean = username.trim().toLowerCase();
        Long existing = usernameIndex.get(clean);
        if (existing != null) {
            logger.warn("User {} already exists (id {}).", clean, existing);
            return users.get(existing);
        }
        long id = users.keySet().stream().mapToLong(Long::longValue).max().orElse(1L) + 1;
        User user = new User(id, clean, siteAdmin);
        users.put(id, user);
        usernameIndex.put(clean, id);
        save();
        logger.info("User created: {} (id {})", clean, id);
        return user;
    }

    public User getUser(long id) {
        return users.get(id);
    }

    public User findByUsername(String username) {
        if (username == null) return null;
        Long id = usernameIndex.get(username.trim().toLowerCase());
        return id == null ? null : users.get(id);
    }

    private void save() {
        try (Writer w = new FileWriter(dbFile, StandardCharsets.UTF_8)) {
            gson.toJson(users, w);
        } catch (IOException e) { logger.error("UserDB Save Error", e); }
    }

    private void load() {
        if (!dbFile.exists()) return;
        try (Reader r = new FileReader(dbFile, StandardCharsets.UTF_8)) {
            Map<Long, User> loaded = gson.fromJson(r, new TypeToken<ConcurrentHashMap<Long, User>>(){}.getType());
            if (loaded != null) {
                users.putAll(loaded);
                users.values().forEach(u -> usernameIndex.put(u.username(), u.id()));
            }
        } catch (Exception e) { logger.error("UserDB Load Error", e); }
    }
}
