package ru.uzden.vpnpanel.controllers;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Проверка X-Admin-Token для /api/admin/**. Пустой токен в настройках - проверка выключена.
 */
@Slf4j
public class AdminTokenInterceptor implements HandlerInterceptor {

    public static final String HEADER = "X-Admin-Token";

    private final String token;

    public AdminTokenInterceptor(String token) {
        this.token = token;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (isAuthorized(request.getHeader(HEADER))) {
            return true;
        }
        log.warn("Admin API: rejected {} {} from {}", request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write("{\"error\":\"unauthorized\",\"message\":\"invalid admin token\"}");
        return false;
    }

    boolean isAuthorized(String header) {
        if (token == null || token.isBlank()) {
            return true;
        }
        if (header == null || header.isBlank()) {
            return false;
        }
        String presented = header.startsWith("Bearer ") ? header.substring("Bearer ".length()) : header;
        return MessageDigest.isEqual(
                presented.trim().getBytes(StandardCharsets.UTF_8),
                token.getBytes(StandardCharsets.UTF_8));
    }
}
