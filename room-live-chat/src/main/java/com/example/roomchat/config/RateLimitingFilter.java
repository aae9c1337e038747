package com.example.roomchat.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Token bucket per client address over the REST API. Socket.IO traffic runs on its own port and
 * never passes through this filter.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitingFilter extends OncePerRequestFilter {

    static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private final ChatSecurityProperties securityProperties;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimitingFilter(ChatSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!securityProperties.isRateLimitingEnabled() || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI();
        return securityProperties.getRateLimit().getExemptPaths().stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String client = resolveClient(request);
        ConsumptionProbe probe = buckets.computeIfAbsent(client, key -> newBucket()).tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            response.setHeader(REMAINING_HEADER, String.valueOf(probe.getRemainingTokens()));
            filterChain.doFilter(request, response);
            return;
        }

        log.debug("Rate limit exceeded for {} on {}", client, request.getRequestURI());
        writeRateLimitResponse(response, probe.getNanosToWaitForRefill());
    }

    private Bucket newBucket() {
        ChatSecurityProperties.RateLimit limitConfig = securityProperties.getRateLimit();
        Duration refillPeriod = limitConfig.getRefillPeriod();
        if (refillPeriod == null || refillPeriod.isZero() || refillPeriod.isNegative()) {
            refillPeriod = Duration.ofMinutes(1);
        }
        Bandwidth limit = Bandwidth.classic(
                Math.max(limitConfig.getCapacity(), 1),
                Refill.greedy(Math.max(limitConfig.getRefillTokens(), 1), refillPeriod));
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }

    private void writeRateLimitResponse(HttpServletResponse response, long nanosToWait) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        long retryAfterSeconds = Math.max(TimeUnit.NANOSECONDS.toSeconds(nanosToWait), 1);
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.setHeader(REMAINING_HEADER, "0");
        response.getWriter()
                .write("{\"error\":\"too_many_requests\",\"message\":\"Request rate exceeded. Please retry later.\"}");
    }

    private String resolveClient(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        return forwardedFor != null && !forwardedFor.isBlank()
                ? forwardedFor.split(",")[0].trim()
                : request.getRemoteAddr();
    }
}
