package com.minicall.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minicall.auth.service.JwtService;
import com.minicall.common.api.ApiCodes;
import com.minicall.common.api.Result;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 通话接口强制登录：
 * <ul>
 *   <li>没有 Bearer token：401（subject uid 必须由服务端根据身份推导，不能匿名）</li>
 *   <li>token 无效：401</li>
 *   <li>有效：userId 写入 request attribute 与 ThreadLocal</li>
 * </ul>
 */
@Slf4j
@Component
public class AccessTokenInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_USER_ID = "X-Auth-UserId";

    private final JwtService jwtService;
    private final ObjectMapper objectMapper;

    public AccessTokenInterceptor(JwtService jwtService, ObjectMapper objectMapper) {
        this.jwtService = jwtService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            writeUnauthorized(request, response, "unauthorized");
            return false;
        }

        String token = header.substring("Bearer ".length()).trim();
        try {
            Jws<Claims> jws = jwtService.parseAccessToken(token);
            long userId = jwtService.getUserId(jws.getPayload());
            request.setAttribute(REQ_ATTR_USER_ID, userId);
            AuthContext.setUserId(userId);
            return true;
        } catch (Exception e) {
            log.debug("access token rejected: path={}, err={}", request.getRequestURI(), e.toString());
            writeUnauthorized(request, response, "unauthorized");
            return false;
        }
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }

    private void writeUnauthorized(HttpServletRequest request, HttpServletResponse response, String reason) {
        response.setStatus(401);
        response.setCharacterEncoding("UTF-8");
        response.setContentType("application/json;charset=UTF-8");
        try {
            String json = objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, reason));
            response.getWriter().write(json);
        } catch (Exception writeErr) {
            log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
        }
    }
}
