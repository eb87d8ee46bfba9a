package com.pileupbuster.backend.auth;

import com.pileupbuster.backend.service.QueueError;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter guarding {@code /api/admin/**} with HTTP Basic authentication.
 *
 * <p>Responds 503 when no admin account is configured and 401 with a
 * {@code WWW-Authenticate} challenge on missing or wrong credentials.
 */
@Component
public class AdminAuthFilter extends OncePerRequestFilter {
  private static final Logger log = LoggerFactory.getLogger(AdminAuthFilter.class);
  private static final String ADMIN_PREFIX = "/api/admin/";

  private final AdminCredentialsVerifier verifier;

  public AdminAuthFilter(AdminCredentialsVerifier verifier) {
    this.verifier = verifier;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path == null
        || !path.startsWith(ADMIN_PREFIX)
        || HttpMethod.OPTIONS.matches(request.getMethod());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain)
      throws ServletException, IOException {
    if (!verifier.isConfigured()) {
      log.warn("Admin request to {} refused: admin credentials are not configured", request.getRequestURI());
      writeError(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "admin_not_configured",
          "admin credentials are not configured");
      return;
    }
    if (!verifier.isAuthorized(request.getHeader(HttpHeaders.AUTHORIZATION))) {
      log.info("Admin request to {} rejected from {}", request.getRequestURI(), request.getRemoteAddr());
      response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"pileup-admin\"");
      writeError(response, HttpServletResponse.SC_UNAUTHORIZED, QueueError.UNAUTHORIZED.code(),
          "invalid admin credentials");
      return;
    }
    filterChain.doFilter(request, response);
  }

  private static void writeError(HttpServletResponse response, int status, String code, String message)
      throws IOException {
    response.setStatus(status);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.getWriter().write("{\"error\":\"" + code + "\",\"message\":\"" + message
        + "\",\"timestamp\":\"" + Instant.now() + "\"}");
  }
}
