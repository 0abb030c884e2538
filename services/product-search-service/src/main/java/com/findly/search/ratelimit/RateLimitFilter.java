package com.findly.search.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.findly.search.api.ErrorCode;
import com.findly.search.api.dto.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Per-client fixed window on the configured paths. Only the AI search route reaches the embedding and
 * LLM providers, so it is the default.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class RateLimitFilter extends OncePerRequestFilter {
    private final RateLimitService rateLimitService;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(RateLimitService rateLimitService, ObjectMapper objectMapper) {
        this.rateLimitService = rateLimitService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path == null) {
            return true;
        }
        for (String prefix : rateLimitService.getProperties().getProtectedPaths()) {
            if (path.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        RateLimitProperties props = rateLimitService.getProperties();
        int limit = props.getAiSearchPerWindow();
        if (!props.isEnabled() || limit <= 0) {
            filterChain.doFilter(request, response);
            return;
        }

        String key = "ai_search:" + resolveIdentity(request);
        if (!rateLimitService.allow(key, limit)) {
            response.setStatus(ErrorCode.RATE_LIMIT_EXCEEDED.getStatus().value());
            response.setHeader("Retry-After", String.valueOf(props.getWindowSeconds()));
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            ErrorResponse payload = ErrorResponse.of(
                ErrorCode.RATE_LIMIT_EXCEEDED,
                "Too many requests",
                headerOrGenerate(request, "x-trace-id"),
                headerOrGenerate(request, "x-request-id")
            );
            objectMapper.writeValue(response.getWriter(), payload);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private String resolveIdentity(HttpServletRequest request) {
        String forwarded = request.getHeader("x-forwarded-for");
        if (rateLimitService.getProperties().isTrustForwardedFor() && forwarded != null && !forwarded.isBlank()) {
            return "ip:" + forwarded.split(",")[0].trim();
        }
        return "ip:" + request.getRemoteAddr();
    }

    private String headerOrGenerate(HttpServletRequest request, String name) {
        String value = request.getHeader(name);
        return value == null || value.isBlank() ? UUID.randomUUID().toString() : value.trim();
    }
}
