package com.tinyeditor.server.internal;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tinyeditor.common.auth.User;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.context.EditorContext;
import com.tinyeditor.server.EditorPlugins;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EditorWebServiceTest {

    @TempDir
    Path toolsDir;

    private Kernel kernel;
    private EditorWebService webService;
    private final HttpClient client = HttpClient.newHttpClient();
    private EditorContext course;
    private String teacherToken;

    @BeforeEach
    void setUp() {
        kernel = new Kernel(toolsDir.toFile(), EditorPlugins.createRegistry());
        kernel.start();
        course = kernel.getContextManager().createCourse(2, 0);
        User teacher = kernel.getUserManager().createUser("teacher", false);
        kernel.getCapabilityManager().assignRole(teacher.id(), "editingteacher", course.id());
        teacherToken = kernel.getAuthManager().createToken(teacher.id());

        webService = new EditorWebService(kernel, 0);
        webService.start();
        assertTrue(webService.isRunning());
    }

    @AfterEach
    void tearDown() {
        webService.stop();
    }

    private HttpResponse<String> get(String pathAndQuery, String token) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(
                URI.create("http://localhost:" + webService.getPort() + pathAndQuery)).GET();
        if (token != null) {
            request.header(EditorWebService.TOKEN_HEADER, token);
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonObject json(HttpResponse<String> response) {
        return JsonParser.parseString(response.body()).getAsJsonObject();
    }

    @Test
    void testConfigurationForTeacher() throws Exception {
        HttpResponse<String> response = get(EditorWebService.FUNCTION_PATH + "?contextlevel=course&instanceid=2",
                teacherToken);

        assertEquals(200, response.statusCode());
        JsonObject body = json(response);
        assertEquals(course.id(), body.get("contextid").getAsLong());
        assertTrue(body.get("branding").getAsBoolean());
        assertEquals("", body.get("extendedvalidelements").getAsString());
        assertEquals("en", body.getAsJsonArray("installedlanguages").get(0).getAsJsonObject()
                .get("lang").getAsString());
        JsonObject first = body.getAsJsonArray("plugins").get(0).getAsJsonObject();
        assertEquals("accessibilitychecker", first.get("name").getAsString());
        assertEquals(0, first.getAsJsonArray("settings").size());
    }

    @Test
    void testTokenAsQueryParameter() throws Exception {
        HttpResponse<String> response = get(EditorWebService.FUNCTION_PATH
                + "?contextlevel=course&instanceid=2&token=" + teacherToken, null);

        assertEquals(200, response.statusCode());
    }

    @Test
    void testMissingOrUnknownToken() throws Exception {
        HttpResponse<String> missing = get(EditorWebService.FUNCTION_PATH + "?contextlevel=course&instanceid=2", null);
        HttpResponse<String> unknown = get(EditorWebService.FUNCTION_PATH + "?contextlevel=course&instanceid=2",
                "not-a-token");

        assertEquals(401, missing.statusCode());
        assertEquals(401, unknown.statusCode());
        assertEquals("invalidtoken", json(unknown).get("errorcode").getAsString());
    }

    @Test
    void testBadParameters() throws Exception {
        HttpResponse<String> missing = get(EditorWebService.FUNCTION_PATH + "?contextlevel=course", teacherToken);
        HttpResponse<String> notNumeric = get(EditorWebService.FUNCTION_PATH + "?contextlevel=course&instanceid=abc",
                teacherToken);
        HttpResponse<String> badLevel = get(EditorWebService.FUNCTION_PATH + "?contextlevel=planet&instanceid=2",
                teacherToken);

        assertEquals(400, missing.statusCode());
        assertEquals("invalidparameter", json(notNumeric).get("errorcode").getAsString());
        assertEquals(400, badLevel.statusCode());
        assertEquals("invalidcontext", json(badLevel).get("errorcode").getAsString());
    }

    @Test
    void testUnknownCourse() throws Exception {
        HttpResponse<String> response = get(EditorWebService.FUNCTION_PATH + "?contextlevel=course&instanceid=99",
                teacherToken);

        assertEquals(404, response.statusCode());
        assertEquals("notfound", json(response).get("errorcode").getAsString());
    }

    @Test
    void testNoAccessToForeignCourse() throws Exception {
        User outsider = kernel.getUserManager().createUser("outsider", false);
        String token = kernel.getAuthManager().createToken(outsider.id());

        HttpResponse<String> response = get(EditorWebService.FUNCTION_PATH + "?contextlevel=course&instanceid=2",
                token);

        assertEquals(403, response.statusCode());
        assertEquals("nopermission", json(response).get("errorcode").getAsString());
    }

    @Test
    void testOnlyGetIsAccepted() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + webService.getPort()
                        + EditorWebService.FUNCTION_PATH + "?contextlevel=course&instanceid=2"))
                .header(EditorWebService.TOKEN_HEADER, teacherToken)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();

        assertEquals(405, client.send(request, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = get(EditorWebService.HEALTH_PATH, null);

        assertEquals(200, response.statusCode());
        assertEquals("ok", json(response).get("status").getAsString());
    }

    @Test
    void testParseQuery() {
        assertEquals(Map.of("a", "1", "b", "x y"), EditorWebService.parseQuery("a=1&b=x+y&=skip&novalue"));
        assertTrue(EditorWebService.parseQuery(null).isEmpty());
    }
}
