package com.pileupbuster.backend.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.pileupbuster.backend.config.PileupProperties;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class AdminAuthFilterTest {

  private PileupProperties properties;
  private AdminAuthFilter filter;

  @BeforeEach
  void setUp() {
    properties = new PileupProperties();
    properties.getAdmin().setUsername("op");
    properties.getAdmin().setPassword("s3cret");
    filter = new AdminAuthFilter(new AdminCredentialsVerifier(properties));
  }

  @Test
  void validCredentialsPassThrough() throws Exception {
    MockHttpServletRequest request = adminRequest(basic("op", "s3cret"));
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request, response, chain);

    assertEquals(200, response.getStatus());
    assertNotNull(chain.getRequest());
  }

  @Test
  void wrongPasswordIsChallenged() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(adminRequest(basic("op", "guess")), response, chain);

    assertEquals(401, response.getStatus());
    assertTrue(response.getHeader("WWW-Authenticate").startsWith("Basic"));
    assertTrue(response.getContentAsString().contains("\"error\":\"unauthorized\""));
    assertNull(chain.getRequest());
  }

  @Test
  void missingHeaderIsChallenged() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(adminRequest(null), response, new MockFilterChain());

    assertEquals(401, response.getStatus());
  }

  @Test
  void unconfiguredAdminReturns503() throws Exception {
    properties.getAdmin().setPassword("");
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(adminRequest(basic("op", "")), response, chain);

    assertEquals(503, response.getStatus());
    assertNull(chain.getRequest());
  }

  @Test
  void publicRoutesAreNotFiltered() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/queue/register");
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request, response, chain);

    assertNotNull(chain.getRequest());
  }

  @Test
  void malformedBase64IsRejected() {
    AdminCredentialsVerifier verifier = new AdminCredentialsVerifier(properties);

    assertFalse(verifier.isAuthorized("Basic %%%"));
    assertFalse(verifier.isAuthorized("Bearer abc"));
  }

  private static MockHttpServletRequest adminRequest(String authorization) {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/admin/queue/next");
    if (authorization != null) {
      request.addHeader("Authorization", authorization);
    }
    return request;
  }

  private static String basic(String username, String password) {
    String token = username + ":" + password;
    return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
  }
}
