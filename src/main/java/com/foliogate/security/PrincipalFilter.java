package com.foliogate.security;

import com.foliogate.shared.exception.MissingPrincipalException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Filter that attaches the forwarded principal to the request and guards the API surface.
 * Authentication happens upstream; this filter only trusts X-Principal-Id / X-Principal-Roles.
 *
 * - /api/public/** is served to anyone and never looks at the principal headers.
 * - /api/admin/** requires the staff role.
 * - any other /api/** path requires a principal.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class PrincipalFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(PrincipalFilter.class);

    public static final String PRINCIPAL_HEADER = "X-Principal-Id";
    public static final String ROLES_HEADER = "X-Principal-Roles";
    public static final String PRINCIPAL_ATTRIBUTE = PrincipalFilter.class.getName() + ".principal";
    private static final String PRINCIPAL_MDC_KEY = "principal_id";
    private static final int MAX_PRINCIPAL_LENGTH = 128;

    private static final String PUBLIC_PREFIX = "/api/public/";
    private static final String ADMIN_PREFIX = "/api/admin/";
    private static final String API_PREFIX = "/api/";

    private static final List<String> OPEN_PATHS = List.of(
        "/actuator/health",
        "/swagger-ui",
        "/v3/api-docs"
    );

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String path = request.getRequestURI().substring(request.getContextPath().length());

        if (path.startsWith(PUBLIC_PREFIX) || OPEN_PATHS.stream().anyMatch(path::startsWith)) {
            filterChain.doFilter(request, response);
            return;
        }

        Optional<Principal> principal = readPrincipal(request);

        if (path.startsWith(API_PREFIX) && principal.isEmpty()) {
            logger.debug("Missing principal for protected endpoint: path={}", path);
            sendError(response, HttpServletResponse.SC_UNAUTHORIZED, "UNAUTHORIZED", "Authentication required");
            return;
        }

        if (path.startsWith(ADMIN_PREFIX) && !principal.get().isStaff()) {
            logger.warn("Non-staff principal denied admin access: principal={}, path={}",
                    principal.get().id(), path);
            sendError(response, HttpServletResponse.SC_FORBIDDEN, "FORBIDDEN", "Staff access required");
            return;
        }

        principal.ifPresent(p -> {
            request.setAttribute(PRINCIPAL_ATTRIBUTE, p);
            MDC.put(PRINCIPAL_MDC_KEY, p.id());
        });

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(PRINCIPAL_MDC_KEY);
        }
    }

    /**
     * Returns the principal attached by this filter.
     * @throws MissingPrincipalException if the request carries none
     */
    public static Principal requirePrincipal(HttpServletRequest request) {
        Object attribute = request.getAttribute(PRINCIPAL_ATTRIBUTE);
        if (attribute instanceof Principal principal) {
            return principal;
        }
        throw new MissingPrincipalException();
    }

    private Optional<Principal> readPrincipal(HttpServletRequest request) {
        String id = request.getHeader(PRINCIPAL_HEADER);
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        id = id.trim();
        if (id.length() > MAX_PRINCIPAL_LENGTH) {
            logger.debug("Principal id too long: length={}", id.length());
            return Optional.empty();
        }

        String rolesHeader = request.getHeader(ROLES_HEADER);
        Set<String> roles = rolesHeader == null ? Set.of() : Arrays.stream(rolesHeader.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(String::toLowerCase)
                .collect(Collectors.toSet());
        return Optional.of(new Principal(id, roles));
    }

    private void sendError(HttpServletResponse response, int status, String error, String message)
            throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(String.format(
            "{\"error\":\"%s\",\"message\":\"%s\",\"timestamp\":\"%s\"}",
            error, message, Instant.now()
        ));
    }
}
