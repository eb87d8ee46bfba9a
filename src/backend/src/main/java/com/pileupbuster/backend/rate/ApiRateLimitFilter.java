package com.pileupbuster.backend.rate;

import com.pileupbuster.backend.config.PileupProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter throttling public queue writes (register and self-removal).
 *
 * <p>Only {@code POST} and {@code DELETE} under {@code /api/queue/} are limited; reads and the
 * admin surface pass through. Excess requests get HTTP 429.
 */
@Component
public class ApiRateLimitFilter extends OncePerRequestFilter {
  private static final Logger log = LoggerFactory.getLogger(ApiRateLimitFilter.class);

  private final PileupProperties properties;
  private final InMemoryRateLimiter limiter;

  public ApiRateLimitFilter(PileupProperties properties, InMemoryRateLimiter limiter) {
    this.properties = properties;
    this.limiter = limiter;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    if (path == null || !path.startsWith("/api/queue/")) {
      return true;
    }
    String method = request.getMethod();
    return !HttpMethod.POST.matches(method) && !HttpMethod.DELETE.matches(method);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain)
      throws ServletException, IOException {
    String client = extractClientKey(request);
    PileupProperties.RateLimit rateLimit = properties.getApi().getRateLimit();
    boolean allowed = limiter.allow(client, rateLimit.getWindowSeconds(), rateLimit.getMaxRequests());

    if (!allowed) {
      long retryAfter = limiter.retryAfterSeconds(client, rateLimit.getWindowSeconds());
      log.info("Rate limit exceeded for {} on {} {}", client, request.getMethod(), request.getRequestURI());
      response.setStatus(429);
      response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(retryAfter));
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      response.getWriter().write(
          "{\"error\":\"too_many_requests\",\"message\":\"rate limit exceeded\",\"retryAfterSeconds\":"
              + retryAfter + "}");
      return;
    }

    filterChain.doFilter(request, response);
  }

  private static String extractClientKey(HttpServletRequest request) {
    String forwardedFor = request.getHeader("X-Forwarded-For");
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      return forwardedFor.split(",")[0].trim();
    }
    return request.getRemoteAddr() == null ? "unknown" : request.getRemoteAddr();
  }
}
