package com.tinyeditor.common.auth;

/**
 * The user a request runs as. Passed explicitly through every permission check.
 */
public record User(
        long id,
        String username,
        boolean siteAdmin
) {}
