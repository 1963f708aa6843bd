package com.tinyeditor.server.internal;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.tinyeditor.common.auth.User;
import com.tinyeditor.common.model.ConfigurationResponse;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.error.EditorConfigException;
import com.tinyeditor.core.error.InvalidContextException;
import com.tinyeditor.core.error.NotFoundException;
import com.tinyeditor.core.error.PermissionDeniedException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP front of the configuration service, consumed by the editor bootstrap.
 *
 * GET /webservice/editor_tiny_get_configuration?contextlevel=course&instanceid=2
 * with the web service token in the X-Editor-Token header (or a "token" query parameter).
 */
public class EditorWebService {
    private static final Logger logger = LoggerFactory.getLogger(EditorWebService.class);

    public static final String FUNCTION_PATH = "/webservice/editor_tiny_get_configuration";
    public static final String HEALTH_PATH = "/webservice/health";
    public static final String TOKEN_HEADER = "X-Editor-Token";

    private final Kernel kernel;
    private final int port;
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();
    private HttpServer server;
    private ExecutorService executor;

    public EditorWebService(Kernel kernel, int port) {
        this.kernel = kernel;
        this.port = port;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);

            logger.info("Registering PUBLIC context: {}", HEALTH_PATH);
            server.createContext(HEALTH_PATH, new HealthHandler());
            logger.info("Registering PROTECTED context: {}", FUNCTION_PATH);
            server.createContext(FUNCTION_PATH, new TokenWrapper(new GetConfigurationHandler()));

            executor = Executors.newFixedThreadPool(10);
            server.setExecutor(executor);
            server.start();
            logger.info("Editor web service running on port {}", getPort());
        } catch (IOException e) {
            logger.error("Failed to start web service", e);
            server = null;
        }
    }

    public void stop() {
        if (server != null)
            server.stop(0);
        if (executor != null)
            executor.shutdownNow();
    }

    public boolean isRunning() {
        return server != null;
    }

    /**
     * @return the bound port, useful when started on port 0
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    // Attribute under which the resolved user travels to the wrapped handler
    private static final String USER_ATTRIBUTE = "editor.user";

    private class TokenWrapper implements HttpHandler {
        private final HttpHandler inner;

        TokenWrapper(HttpHandler inner) {
            this.inner = inner;
        }

        @Override
        public void handle(HttpExchange ex) throws IOException {
            String token = ex.getRequestHeaders().getFirst(TOKEN_HEADER);
            if (token == null) {
                token = parseQuery(ex.getRequestURI().getRawQuery()).get("token");
            }

            Long userId = kernel.getAuthManager().resolveUserId(token);
            User user = userId == null ? null : kernel.getUserManager().getUser(userId);
            if (user == null) {
                logger.warn("Auth failed: token invalid or missing. Path: {}", ex.getRequestURI().getPath());
                sendError(ex, 401, "invalidtoken", "Invalid token - token not found");
                return;
            }

            ex.setAttribute(USER_ATTRIBUTE, user);
            inner.handle(ex);
        }
    }

    private class GetConfigurationHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange ex) throws IOException {
            if (!"GET".equalsIgnoreCase(ex.getRequestMethod())) {
                sendError(ex, 405, "invalidmethod", "GET expected");
                return;
            }

            Map<String, String> params = parseQuery(ex.getRequestURI().getRawQuery());
            String contextLevel = params.get("contextlevel");
            String rawInstanceId = params.get("instanceid");
            if (contextLevel == null || rawInstanceId == null) {
                sendError(ex, 400, "invalidparameter", "contextlevel and instanceid are required");
                return;
            }

            long instanceId;
            try {
                instanceId = Long.parseLong(rawInstanceId.trim());
            } catch (NumberFormatException e) {
                sendError(ex, 400, "invalidparameter", "instanceid must be an integer: " + rawInstanceId);
                return;
            }

            User user = (User) ex.getAttribute(USER_ATTRIBUTE);
            try {
                ConfigurationResponse response = kernel.getConfigurationService()
                        .getConfiguration(contextLevel, instanceId, user);
                sendJson(ex, 200, response);
            } catch (EditorConfigException e) {
                logger.warn("Configuration request failed for user {}: {}", user.id(), e.getMessage());
                sendError(ex, statusFor(e), e.getErrorCode(), e.getMessage());
            } catch (Exception e) {
                logger.error("Configuration request crashed", e);
                sendError(ex, 500, "unexpectederror", "Internal Error");
            }
        }
    }

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange ex) throws IOException {
            sendJson(ex, 200, Map.of("status", kernel.isRunning() ? "ok" : "starting"));
        }
    }

    static int statusFor(EditorConfigException e) {
        if (e instanceof InvalidContextException) return 400;
        if (e instanceof NotFoundException) return 404;
        if (e instanceof PermissionDeniedException) return 403;
        return 500;
    }

    private void sendJson(HttpExchange ex, int code, Object data) throws IOException {
        byte[] b = gson.toJson(data).getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
        ex.sendResponseHeaders(code, b.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(b);
        }
    }

    private void sendError(HttpExchange ex, int code, String errorCode, String msg) throws IOException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("exception", errorCode);
        body.put("errorcode", errorCode);
        body.put("message", msg);
        sendJson(ex, code, body);
    }

    static Map<String, String> parseQuery(String query) {
        Map<String, String> result = new HashMap<>();
        if (query == null || query.isEmpty())
            return result;
        for (String pair : query.split("&")) {
            int idx = pair.indexOf('=');
            if (idx <= 0)
                continue;
            String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
            result.put(key, value);
        }
        return result;
    }
}
