package com.pileupbuster.backend.qrz;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pileupbuster.backend.config.PileupProperties;
import com.pileupbuster.backend.model.CallsignProfile;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

class QrzLookupServiceTest {
  private static final String W1AW_RECORD = """
      <QRZDatabase>
        <Session><Key>%s</Key></Session>
        <Callsign>
          <call>W1AW</call>
          <fname>Hiram Percy</fname>
          <name>Maxim</name>
          <addr1>225 Main St</addr1>
          <addr2>Newington</addr2>
          <state>CT</state>
          <zip>06111</zip>
          <country>United States</country>
          <lat>41.714775</lat>
          <lon>-72.727260</lon>
          <grid>FN31pr</grid>
          <image>https://cdn.qrz.com/w1aw.jpg</image>
        </Callsign>
      </QRZDatabase>
      """;

  private PileupProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private HttpClient httpClient;
  private StringRedisTemplate redisTemplate;
  private ValueOperations<String, String> valueOperations;
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final Map<String, String> redis = new HashMap<>();
  private final Map<String, Long> redisTtls = new HashMap<>();
  private final List<String> requestedQueries = new ArrayList<>();

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    redisTemplate = mock(StringRedisTemplate.class);
    valueOperations = (ValueOperations<String, String>) mock(ValueOperations.class);
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    when(valueOperations.get(anyString())).thenAnswer(invocation -> redis.get(invocation.<String>getArgument(0)));
    doAnswer(invocation -> {
      redis.put(invocation.getArgument(0), invocation.getArgument(1));
      redisTtls.put(invocation.getArgument(0), invocation.getArgument(2));
      return null;
    }).when(valueOperations).set(anyString(), anyString(), anyLong(), eq(TimeUnit.SECONDS));

    properties = new PileupProperties();
    properties.getQrz().setUsername("n0call");
    properties.getQrz().setPassword("secret");
    properties.getQrz().setBaseUrl("https://qrz.example/xml/current/");
    meterRegistry = new SimpleMeterRegistry();
    httpClient = mock(HttpClient.class);
  }

  @Test
  void lookup_logsInThenMapsTheCallsignRecord() throws Exception {
    script(Map.of(
        "username=", List.of(session("key-1")),
        "s=key-1;callsign=W1AW", List.of(W1AW_RECORD.formatted("key-1"))));
    QrzLookupService service = new QrzLookupService(redisTemplate, objectMapper, properties, meterRegistry, httpClient);

    CallsignProfile profile = service.lookup("w1aw");

    assertThat(profile.hasError()).isFalse();
    assertThat(profile.name()).isEqualTo("Hiram Percy Maxim");
    assertThat(profile.address()).isEqualTo("225 Main St, Newington, CT 06111, United States");
    assertThat(profile.dxccName()).isEqualTo("United States");
    assertThat(profile.imageUrl()).isEqualTo("https://cdn.qrz.com/w1aw.jpg");
    assertThat(profile.grid().latitude()).isEqualTo(41.714775);
    assertThat(profile.grid().longitude()).isEqualTo(-72.727260);
    assertThat(profile.grid().locator()).isEqualTo("FN31pr");
    assertThat(requestedQueries.get(0)).contains("username=n0call").contains("agent=pileup-buster");
    assertThat(meterRegistry.get("pileup.qrz.lookups.total").tag("outcome", "success").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void lookup_withoutCredentialsFailsWithoutCallingQrz() throws Exception {
    properties.getQrz().setPassword(" ");
    QrzLookupService service = new QrzLookupService(redisTemplate, objectMapper, properties, meterRegistry, httpClient);

    CallsignProfile profile = service.lookup("W1AW");

    assertThat(profile.error()).contains("credentials not configured");
    verify(httpClient, never())
        .send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void lookup_reauthenticatesOnceWhenSessionExpires() throws Exception {
    script(Map.of(
        "username=", List.of(session("key-1"), session("key-2")),
        "s=key-1;callsign=W1AW", List.of(
            "<QRZDatabase><Session><Error>Session Timeout</Error></Session></QRZDatabase>"),
        "s=key-2;callsign=W1AW", List.of(W1AW_RECORD.formatted("key-2"))));
    QrzLookupService service = new QrzLookupService(redisTemplate, objectMapper, properties, meterRegistry, httpClient);

    CallsignProfile profile = service.lookup("W1AW");

    assertThat(profile.hasError()).isFalse();
    assertThat(meterRegistry.get("pileup.qrz.logins.total").counter().count()).isEqualTo(2.0);
  }

  @Test
  void lookup_unknownCallsignReturnsErrorProfile() throws Exception {
    script(Map.of(
        "username=", List.of(session("key-1")),
        "s=key-1;callsign=ZZ9ZZZ", List.of(
            "<QRZDatabase><Session><Key>key-1</Key><Error>Not found: ZZ9ZZZ</Error></Session></QRZDatabase>")));
    QrzLookupService service = new QrzLookupService(redisTemplate, objectMapper, properties, meterRegistry, httpClient);

    CallsignProfile profile = service.lookup("ZZ9ZZZ");

    assertThat(profile.error()).isEqualTo("Not found: ZZ9ZZZ");
    assertThat(profile.name()).isNull();
    assertThat(meterRegistry.get("pileup.qrz.lookups.total").tag("outcome", "not_found").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void lookup_rejectedLoginIsReportedInTheProfile() throws Exception {
    script(Map.of(
        "username=", List.of(
            "<QRZDatabase><Session><Error>Username/password incorrect</Error></Session></QRZDatabase>")));
    QrzLookupService service = new QrzLookupService(redisTemplate, objectMapper, properties, meterRegistry, httpClient);

    CallsignProfile profile = service.lookup("W1AW");

    assertThat(profile.error()).isEqualTo("QRZ.com authentication failed: Username/password incorrect");
  }

  @Test
  void lookup_servesRepeatedCallsignsFromCache() throws Exception {
    script(Map.of(
        "username=", List.of(session("key-1")),
        "s=key-1;callsign=W1AW", List.of(W1AW_RECORD.formatted("key-1"))));
    QrzLookupService service = new QrzLookupService(redisTemplate, objectMapper, properties, meterRegistry, httpClient);

    CallsignProfile first = service.lookup("W1AW");
    CallsignProfile second = service.lookup("w1aw");

    assertThat(second).isEqualTo(first);
    assertThat(redisTtls).containsEntry("pileup:qrz:profile:W1AW", 3600L);
    verify(httpClient, times(2))
        .send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(meterRegistry.get("pileup.qrz.lookups.total").tag("outcome", "cache_hit").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void lookup_httpErrorBecomesErrorProfile() throws Exception {
    HttpResponse<String> response = response(503, "unavailable");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);
    QrzLookupService service = new QrzLookupService(redisTemplate, objectMapper, properties, meterRegistry, httpClient);

    CallsignProfile profile = service.lookup("W1AW");

    assertThat(profile.error()).isEqualTo("QRZ.com returned HTTP 503");
  }

  @Test
  void lookup_cachesWithRedisTtlSoEntriesExpireServerSide() throws Exception {
    properties.getQrz().setErrorCacheTtlSeconds(30);
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenThrow(new IOException("connection refused"));
    QrzLookupService service = new QrzLookupService(redisTemplate, objectMapper, properties, meterRegistry, httpClient);

    for (int i = 0; i < 50; i++) {
      service.lookup("W" + i + "ABC");
    }

    assertThat(redisTtls).hasSize(50);
    assertThat(redisTtls.values()).containsOnly(30L);
  }

  @Test
  void lookup_stillResolvesWhenRedisIsUnavailable() throws Exception {
    when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("redis down"));
    doThrow(new RedisConnectionFailureException("redis down"))
        .when(valueOperations).set(anyString(), anyString(), anyLong(), eq(TimeUnit.SECONDS));
    script(Map.of(
        "username=", List.of(session("key-1")),
        "s=key-1;callsign=W1AW", List.of(W1AW_RECORD.formatted("key-1"))));
    QrzLookupService service = new QrzLookupService(redisTemplate, objectMapper, properties, meterRegistry, httpClient);

    CallsignProfile profile = service.lookup("W1AW");

    assertThat(profile.hasError()).isFalse();
    assertThat(profile.name()).isEqualTo("Hiram Percy Maxim");
  }

  private void script(Map<String, List<String>> bodiesByQuery) throws Exception {
    Map<String, Deque<String>> remaining = new HashMap<>();
    bodiesByQuery.forEach((query, bodies) -> remaining.put(query, new ArrayDeque<>(bodies)));
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenAnswer(invocation -> {
          HttpRequest request = invocation.getArgument(0);
          String query = request.uri().getRawQuery();
          requestedQueries.add(query);
          for (Map.Entry<String, Deque<String>> entry : remaining.entrySet()) {
            if (query.startsWith(entry.getKey()) && !entry.getValue().isEmpty()) {
              return response(200, entry.getValue().poll());
            }
          }
          throw new AssertionError("unexpected QRZ query " + query);
        });
  }

  private static String session(String key) {
    return "<QRZDatabase><Session><Key>" + key + "</Key></Session></QRZDatabase>";
  }

  @SuppressWarnings("unchecked")
  private static HttpResponse<String> response(int status, String body) {
    HttpResponse<String> response = (HttpResponse<String>) mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
    return response;
  }
}
