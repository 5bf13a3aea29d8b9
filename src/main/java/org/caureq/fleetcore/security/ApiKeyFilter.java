package org.caureq.fleetcore.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleetcore.config.FleetProps;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.security.MessageDigest;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Shared-key guard on mutating API calls. Disabled when {@code fleet.api-key} is blank;
 * reads are never guarded.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiKeyFilter extends OncePerRequestFilter {
    private static final Set<String> MUTATING = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final FleetProps props;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String path = req.getRequestURI();       // ex: "/api/deployments/create"
        String method = req.getMethod();         // ex: "POST"
        String expected = props.apiKey();

        boolean needsKey = expected != null && !expected.isBlank()
                && path.startsWith("/api/")
                && MUTATING.contains(method.toUpperCase());

        if (needsKey) {
            String key = req.getHeader("X-API-KEY");
            if (key == null || !MessageDigest.isEqual(key.getBytes(StandardCharsets.UTF_8),
                    expected.getBytes(StandardCharsets.UTF_8))) {
                log.warn("[Auth] rejected {} {} from {}", method, path, req.getRemoteAddr());
                res.setStatus(HttpStatus.UNAUTHORIZED.value());
                res.setContentType("application/json");
                res.getWriter().write("{\"success\":false,\"code\":\"AUTH_REQUIRED\",\"message\":\"Missing or invalid X-API-KEY\"}");
                return;
            }
        }

        chain.doFilter(req, res);
    }
}
