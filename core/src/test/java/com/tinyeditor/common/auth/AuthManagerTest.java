package com.tinyeditor.common.auth;

import com.tinyeditor.test.TestBase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthManagerTest extends TestBase {

    @Test
    void testTokenResolvesToUser() {
        String token = kernel.getAuthManager().createToken(12);

        assertNotNull(token);
        assertEquals(12L, kernel.getAuthManager().resolveUserId(token));
    }

    @Test
    void testUnknownTokenResolvesToNothing() {
        assertNull(kernel.getAuthManager().resolveUserId("nope"));
        assertNull(kernel.getAuthManager().resolveUserId(null));
    }

    @Test
    void testRevokedToken() {
        String token = kernel.getAuthManager().createToken(12);
        kernel.getAuthManager().revokeToken(token);

        assertNull(kernel.getAuthManager().resolveUserId(token));
    }

    @Test
    void testExpiredToken() throws InterruptedException {
        String token = kernel.getAuthManager().createToken(12, 1);
        Thread.sleep(20);

        assertNull(kernel.getAuthManager().resolveUserId(token));
    }

    @Test
    void testTokensSurviveRestart() {
        String token = kernel.getAuthManager().createToken(5, 0);

        restartKernel();

        assertEquals(5L, kernel.getAuthManager().resolveUserId(token));
    }
}
