package com.minicall.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicall.auth.config.AuthProperties;
import com.minicall.auth.service.JwtService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

class AccessTokenInterceptorTest {

    private final JwtService jwt = new JwtService(new AuthProperties("mini-call", "change-me-please-change-me-please-change-me", 1800));
    private final AccessTokenInterceptor interceptor = new AccessTokenInterceptor(jwt, new ObjectMapper());

    @AfterEach
    void tearDown() {
        AuthContext.clear();
    }

    @Test
    void missingBearer_ShouldWrite401Envelope() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/call/token");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertFalse(interceptor.preHandle(req, resp, new Object()));
        assertEquals(401, resp.getStatus());
        assertTrue(resp.getContentAsString().contains("\"code\":40100"));
        assertNull(AuthContext.getUserId());
    }

    @Test
    void invalidToken_ShouldBeRejected() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/call/session/1");
        req.addHeader("Authorization", "Bearer not-a-jwt");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertFalse(interceptor.preHandle(req, resp, new Object()));
        assertEquals(401, resp.getStatus());
    }

    @Test
    void validToken_ShouldExposeUserIdUntilCompletion() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/call/session/1");
        req.addHeader("Authorization", "Bearer " + jwt.issueAccessToken(42L));
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertTrue(interceptor.preHandle(req, resp, new Object()));
        assertEquals(42L, AuthContext.getUserId());
        assertEquals(42L, req.getAttribute(AccessTokenInterceptor.REQ_ATTR_USER_ID));

        interceptor.afterCompletion(req, resp, new Object(), null);
        assertNull(AuthContext.getUserId());
    }
}
