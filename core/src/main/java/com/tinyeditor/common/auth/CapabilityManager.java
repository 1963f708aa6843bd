package com.tinyeditor.common.auth;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.context.ContextResolver;
import com.tinyeditor.core.context.EditorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Role definitions and role assignments, stored in roles.json.
 *
 * A capability is granted when any role the user holds on the context path allows it.
 * Every user holds the "user" role in the system context, site admins hold everything.
 */
public class CapabilityManager implements PermissionChecker {
    private static final Logger logger = LoggerFactory.getLogger(CapabilityManager.class);

    public static final String AUTHENTICATED_ROLE = "user";
    public static final String COURSE_VIEW = "moodle/course:view";

    private final File rolesFile;
    private final Gson gson;
    private final ContextResolver contexts;
    private RoleData data;

    public record RoleAssignment(long userId, String role, long contextId) {}

    private static class RoleData {
        // Key = role short name, Value = allowed capabilities
        Map<String, Set<String>> roles = defaultRoles();
        List<RoleAssignment> assignments = new ArrayList<>();
    }

    public CapabilityManager(Kernel kernel) {
        this.rolesFile = new File(kernel.getToolsDir(), "roles.json");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        this.contexts = kernel.getContextManager();
        load();
    }

    static Map<String, Set<String>> defaultRoles() {
        Set<String> recording = Set.of(
                "tiny/recordrtc:recordaudio",
                "tiny/recordrtc:recordvideo",
                "tiny/recordrtc:recordscreen");
        Set<String> ai = Set.of(
                "aiplacement/editor:generate_text",
                "aiplacement/editor:generate_image");

        Map<String, Set<String>> roles = new LinkedHashMap<>();

        Set<String> manager = new TreeSet<>();
        manager.add(COURSE_VIEW);
        manager.addAll(ai);
        manager.addAll(recording);
        manager.add("tiny/h5p:addembed");
        manager.add("moodle/h5p:deploy");
        manager.add("tiny/premium:accesspremium");
        roles.put("manager", manager);

        Set<String> editingTeacher = new TreeSet<>(ai);
        editingTeacher.addAll(recording);
        editingTeacher.add("tiny/h5p:addembed");
        editingTeacher.add("moodle/h5p:deploy");
        editingTeacher.add("tiny/premium:accesspremium");
        roles.put("editingteacher", editingTeacher);

        Set<String> teacher = new TreeSet<>(ai);
        teacher.addAll(recording);
        teacher.add("tiny/h5p:addembed");
        roles.put("teacher", teacher);

        roles.put("student", new TreeSet<>(Set.of(
                "tiny/recordrtc:recordaudio",
                "tiny/recordrtc:recordvideo")));
        roles.put("guest", new TreeSet<>());

        Set<String> authenticated = new TreeSet<>(recording);
        authenticated.add("tiny/premium:accesspremium");
        roles.put(AUTHENTICATED_ROLE, authenticated);
        return roles;
    }

    @Override
    public boolean hasCapability(User user, String capability, EditorContext context) {
        if (user == null || context == null) return false;
        if (user.siteAdmin()) return true;
        for (String role : rolesOnPath(user, context)) {
            Set<String> allowed = data.roles.get(role);
            if (allowed != null && allowed.contains(capability)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean canAccess(User user, EditorContext context) {
        if (user == null || context == null) return false;
        if (user.siteAdmin() || context.isSystem()) return true;
        switch (context.level()) {
            case USER:
                return context.instanceId() == user.id();
            default:
                List<EditorContext> path = contexts.getPath(context);
                for (RoleAssignment ra : assignmentsOf(user)) {
                    for (EditorContext c : path) {
                        if (!c.isSystem() && c.id() == ra.contextId()) return true;
                    }
                }
                return hasCapability(user, COURSE_VIEW, context);
        }
    }

    /**
     * Role names the user holds anywhere on the path of the context.
     */
    public Set<String> rolesOnPath(User user, EditorContext context) {
        Set<String> result = new LinkedHashSet<>();
        result.add(AUTHENTICATED_ROLE);
        List<EditorContext> path = contexts.getPath(context);
        for (RoleAssignment ra : assignmentsOf(user)) {
            for (EditorContext c : path) {
                if (c.id() == ra.contextId()) {
                    result.add(ra.role());
                    break;
                }
            }
        }
        return result;
    }

    private List<RoleAssignment> assignmentsOf(User user) {
        List<RoleAssignment> result = new ArrayList<>();
        synchronized (this) {
            for (RoleAssignment ra : data.assignments) {
                if (ra.userId() == user.id()) result.add(ra);
            }
        }
        return result;
    }

    public synchronized void assignRole(long userId, String role, long contextId) {
        if (!data.roles.containsKey(role)) {
            throw new IllegalArgumentException("Unknown role: " + role);
        }
        RoleAssignment ra = new RoleAssignment(userId, role, contextId);
        if (data.assignments.contains(ra)) return;
        data.assignments.add(ra);
        save();
        logger.info("Role {} assigned to user {} in context {}", role, userId, contextId);
    }

    public synchronized void allow(String role, String capability) {
        data.roles.computeIfAbsent(role, k -> new TreeSet<>()).add(capability);
        save();
    }

    public synchronized void revoke(String role, String capability) {
        Set<String> allowed = data.roles.get(role);
        if (allowed != null && allowed.remove(capability)) {
            save();
        }
    }

    private void load() {
        if (rolesFile.exists()) {
            try (Reader r = new FileReader(rolesFile, StandardCharsets.UTF_8)) {
                data = gson.fromJson(r, RoleData.class);
            } catch (Exception e) {
                logger.error("Roles Load Error", e);
            }
        }
        if (data == null) {
            data = new RoleData();
            save();
            logger.info("No roles file found. Created default role definitions.");
        }
        if (data.roles == null)
            data.roles = defaultRoles();
        if (data.assignments == null)
            data.assignments = new ArrayList<>();
    }

    private synchronized void save() {
        try (Writer w = new FileWriter(rolesFile, StandardCharsets.UTF_8)) {
            gson.toJson(data, w);
        } catch (IOException e) {
            logger.error("Failed to save roles", e);
        }
    }
}
