package com.tinyeditor.common.auth;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.tinyeditor.core.Kernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Issues and checks web service tokens. Tokens are stored in auth.json.
 */
public class AuthManager {
    private static final Logger logger = LoggerFactory.getLogger(AuthManager.class);
    private static final long DEFAULT_VALIDITY_MS = TimeUnit.HOURS.toMillis(24);

    private final File authFile;
    private final Gson gson;
    private AuthData data;

    private static class Token {
        long userId;
        long expiry; // 0 = never
    }

    private static class AuthData {
        Map<String, Token> tokens = new HashMap<>();
    }

    public AuthManager(Kernel kernel) {
        this.authFile = new File(kernel.getToolsDir(), "auth.json");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
    }

    private void load() {
        if (authFile.exists()) {
            try (Reader r = new FileReader(authFile, StandardCharsets.UTF_8)) {
                data = gson.fromJson(r, AuthData.class);
            } catch (Exception e) {
                logger.error("Auth Load Error", e);
            }
        }
        if (data == null)
            data = new AuthData();
        if (data.tokens == null)
            data.tokens = new HashMap<>();
    }

    public synchronized void save() {
        try (Writer w = new FileWriter(authFile, StandardCharsets.UTF_8)) {
            gson.toJson(data, w);
        } catch (IOException e) {
            logger.error("Failed to save auth", e);
        }
    }

    public String createToken(long userId) {
        return createToken(userId, DEFAULT_VALIDITY_MS);
    }

    /**
     * @param validityMs lifetime of the token, 0 for a token that never expires
     */
    public synchronized String createToken(long userId, long validityMs) {
        String token = UUID.randomUUID().toString().replace("-", "");
        Token t = new Token();
        t.userId = userId;
        t.expiry = validityMs > 0 ? System.currentTimeMillis() + validityMs : 0;
        data.tokens.put(token, t);
        save();
        logger.info("Web service token created for user {}", userId);
        return token;
    }

    /**
     * @return the user id behind a valid token, or null
     */
    public synchronized Long resolveUserId(String token) {
        if (token == null)
            return null;
        Token t = data.tokens.get(token);
        if (t == null)
            return null;
        if (t.expiry > 0 && System.currentTimeMillis() > t.expiry) {
            data.tokens.remove(token);
            save();
            logger.info("Expired token removed for user {}", t.userId);
            return null;
        }
        return t.userId;
    }

    public synchronized void revokeToken(String token) {
        if (data.tokens.remove(token) != null) {
            save();
        }
    }
}
