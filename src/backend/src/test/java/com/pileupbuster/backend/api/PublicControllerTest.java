package com.pileupbuster.backend.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.pileupbuster.backend.auth.AdminAuthFilter;
import com.pileupbuster.backend.model.ContactOrigin;
import com.pileupbuster.backend.model.CurrentContact;
import com.pileupbuster.backend.model.QueueEntry;
import com.pileupbuster.backend.model.QueuePosition;
import com.pileupbuster.backend.model.QueueView;
import com.pileupbuster.backend.model.SystemStatus;
import com.pileupbuster.backend.rate.ApiRateLimitFilter;
import com.pileupbuster.backend.service.QueueCoordinator;
import com.pileupbuster.backend.service.QueueError;
import com.pileupbuster.backend.service.QueueOperationException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = PublicController.class)
@AutoConfigureMockMvc(addFilters = false)
class PublicControllerTest {
  private static final Instant JOINED = Instant.parse("2026-03-01T12:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockBean private QueueCoordinator coordinator;
  @MockBean private ApiRateLimitFilter apiRateLimitFilter;
  @MockBean private AdminAuthFilter adminAuthFilter;

  @Test
  void register_returns201WithPosition() throws Exception {
    when(coordinator.register("w1aw")).thenReturn(new QueuePosition("W1AW", JOINED, 1, 0, null));

    mockMvc.perform(post("/api/queue/register")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"callsign\":\"w1aw\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.callsign").value("W1AW"))
        .andExpect(jsonPath("$.position").value(1))
        .andExpect(jsonPath("$.joinedAt").value("2026-03-01T12:00:00Z"));
  }

  @Test
  void register_duplicateReturns409WithCode() throws Exception {
    when(coordinator.register("W1AW"))
        .thenThrow(new QueueOperationException(QueueError.DUPLICATE_CALLSIGN, "W1AW is already in the queue"));

    mockMvc.perform(post("/api/queue/register")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"callsign\":\"W1AW\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("duplicate_callsign"))
        .andExpect(jsonPath("$.message").value("W1AW is already in the queue"));
  }

  @Test
  void register_invalidFormatReturns400() throws Exception {
    when(coordinator.register("HELLO"))
        .thenThrow(new QueueOperationException(QueueError.INVALID_FORMAT, "invalid callsign format: HELLO"));

    mockMvc.perform(post("/api/queue/register")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"callsign\":\"HELLO\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_format"));
  }

  @Test
  void register_missingCallsignReturns400() throws Exception {
    mockMvc.perform(post("/api/queue/register")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"));
  }

  @Test
  void status_unknownCallsignReturns404() throws Exception {
    when(coordinator.findQueued("K1ABC"))
        .thenThrow(new QueueOperationException(QueueError.NOT_FOUND, "K1ABC is not in the queue"));

    mockMvc.perform(get("/api/queue/status/K1ABC"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"));
  }

  @Test
  void list_returnsQueueView() throws Exception {
    when(coordinator.queueView()).thenReturn(new QueueView(
        List.of(new QueuePosition("W1AW", JOINED, 1, 30, null),
            new QueuePosition("K1ABC", JOINED.plusSeconds(5), 2, 25, null)),
        2, 4, true));

    mockMvc.perform(get("/api/queue/list"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(2))
        .andExpect(jsonPath("$.maxSize").value(4))
        .andExpect(jsonPath("$.queue[1].callsign").value("K1ABC"))
        .andExpect(jsonPath("$.queue[1].position").value(2));
  }

  @Test
  void leave_returnsRemovedEntry() throws Exception {
    when(coordinator.remove("W1AW")).thenReturn(new QueueEntry("W1AW", JOINED, null));

    mockMvc.perform(delete("/api/queue/W1AW"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.callsign").value("W1AW"));
  }

  @Test
  void currentQso_idleReturnsNullContact() throws Exception {
    when(coordinator.currentContact()).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/public/current-qso"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.currentQso").doesNotExist());
  }

  @Test
  void currentQso_reportsOrigin() throws Exception {
    when(coordinator.currentContact()).thenReturn(Optional.of(
        new CurrentContact("W1AW", JOINED, null, ContactOrigin.FROM_QUEUE, null)));

    mockMvc.perform(get("/api/public/current-qso"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.currentQso.callsign").value("W1AW"))
        .andExpect(jsonPath("$.currentQso.origin").value("from-queue"));
  }

  @Test
  void status_returnsFlags() throws Exception {
    when(coordinator.status()).thenReturn(new SystemStatus(true, false, JOINED));

    mockMvc.perform(get("/api/public/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(true))
        .andExpect(jsonPath("$.integrationEnabled").value(false));
  }

  @Test
  void status_answersJsonToBrowserAcceptHeader() throws Exception {
    when(coordinator.status()).thenReturn(new SystemStatus(true, false, JOINED));

    mockMvc.perform(get("/api/public/status")
            .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.active").value(true));
  }

  @Test
  void storeFailureReturns502() throws Exception {
    when(coordinator.queueView()).thenThrow(new QueryTimeoutException("redis timed out"));

    mockMvc.perform(get("/api/queue/list"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.error").value("backend_unavailable"));
  }
}
