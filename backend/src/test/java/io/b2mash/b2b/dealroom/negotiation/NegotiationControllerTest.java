package io.b2mash.b2b.dealroom.negotiation;

import static io.b2mash.b2b.dealroom.testutil.TestJwts.advertiserJwt;
import static io.b2mash.b2b.dealroom.testutil.TestJwts.providerJwt;
import static io.b2mash.b2b.dealroom.testutil.TestJwts.requesterJwt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.b2b.dealroom.TestcontainersConfiguration;
import io.b2mash.b2b.dealroom.audit.AuditEventRepository;
import io.b2mash.b2b.dealroom.contract.Contract;
import io.b2mash.b2b.dealroom.contract.ContractRepository;
import io.b2mash.b2b.dealroom.contract.ContractStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Testcontainers(disabledWithoutDocker = true)
class NegotiationControllerTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ContractRepository contractRepository;
  @Autowired private AuditEventRepository auditEventRepository;

  private UUID requesterId;
  private UUID providerId;
  private UUID contractId;

  @BeforeEach
  void seedContract() {
    requesterId = UUID.randomUUID();
    providerId = UUID.randomUUID();
    contractId =
        contractRepository
            .save(
                new Contract(
                    requesterId,
                    providerId,
                    ContractStatus.PENDING,
                    new BigDecimal("100.00"),
                    Instant.parse("2026-11-01T09:00:00Z"),
                    Instant.parse("2026-11-15T17:00:00Z")))
            .getId();
  }

  // ==================== Happy path ====================

  @Test
  void shouldCreateNegotiation() throws Exception {
    mockMvc
        .perform(
            post("/api/negotiations")
                .with(requesterJwt(requesterId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "contractId": "%s",
                      "price": 100,
                      "notes": "Can you do it for 100?"
                    }
                    """
                        .formatted(contractId)))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", startsWith("/api/negotiations/")))
        .andExpect(jsonPath("$.negotiation.status").value("AWAITING_PROVIDER"))
        .andExpect(jsonPath("$.negotiation.contractId").value(contractId.toString()))
        .andExpect(jsonPath("$.negotiation.finalTerms").doesNotExist())
        .andExpect(jsonPath("$.history.length()").value(1))
        .andExpect(jsonPath("$.history[0].type").value("PROPOSAL"))
        .andExpect(jsonPath("$.history[0].sequenceNumber").value(1));
  }

  @Test
  void shouldNegotiateAndAccept() throws Exception {
    String negotiationId = createNegotiation();

    mockMvc
        .perform(
            post("/api/negotiations/" + negotiationId + "/entries")
                .with(providerJwt(providerId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "RESPONSE", "price": 130, "notes": "130 covers materials"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.negotiation.status").value("AWAITING_REQUESTER"))
        .andExpect(jsonPath("$.history.length()").value(2));

    mockMvc
        .perform(
            post("/api/negotiations/" + negotiationId + "/finalize")
                .with(requesterJwt(requesterId))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"decision": "ACCEPT"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.negotiation.status").value("ACCEPTED"))
        .andExpect(
            jsonPath("$.negotiation.finalTerms.price", closeTo(130.0, 0.001), Double.class))
        .andExpect(jsonPath("$.history[2].type").value("MESSAGE"))
        .andExpect(jsonPath("$.history[2].notes").value("negotiation accepted by requester"));

    var contract = contractRepository.findById(contractId).orElseThrow();
    assertThat(contract.getTotalValue()).isEqualByComparingTo("130");
  }

  @Test
  void shouldGetNegotiationForParticipant() throws Exception {
    String negotiationId = createNegotiation();

    mockMvc
        .perform(get("/api/negotiations/" + negotiationId).with(providerJwt(providerId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.negotiation.id").value(negotiationId))
        .andExpect(jsonPath("$.history[0].notes").value("opening offer"));
  }

  @Test
  void shouldListMyNegotiationsWithStatusFilter() throws Exception {
    createNegotiation();

    mockMvc
        .perform(
            get("/api/negotiations")
                .param("status", "AWAITING_PROVIDER")
                .with(providerJwt(providerId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content.length()").value(1))
        .andExpect(jsonPath("$.content[0].contractId").value(contractId.toString()))
        .andExpect(jsonPath("$.page.totalElements").value(1));

    mockMvc
        .perform(get("/api/negotiations").param("status", "ACCEPTED").with(providerJwt(providerId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.page.totalElements").value(0));
  }

  @Test
  void shouldListNegotiationsForContract() throws Exception {
    String negotiationId = createNegotiation();

    mockMvc
        .perform(
            get("/api/contracts/" + contractId + "/negotiations").with(requesterJwt(requesterId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].id").value(negotiationId));
  }

  @Test
  void shouldCancelNegotiation() throws Exception {
    String negotiationId = createNegotiation();

    mockMvc
        .perform(
            post("/api/negotiations/" + negotiationId + "/cancel").with(requesterJwt(requesterId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.negotiation.status").value("CANCELLED"))
        .andExpect(jsonPath("$.negotiation.closedAt").exists())
        .andExpect(jsonPath("$.history[1].notes").value("negotiation cancelled by requester"));
  }

  // ==================== Errors ====================

  @Test
  void shouldReturn403ForNonParticipant() throws Exception {
    String negotiationId = createNegotiation();
    long deniedBefore = countAccessDenied();

    mockMvc
        .perform(get("/api/negotiations/" + negotiationId).with(providerJwt(UUID.randomUUID())))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("FORBIDDEN"));

    assertThat(countAccessDenied()).isGreaterThan(deniedBefore);
  }

  @Test
  void shouldReturn403WhenProviderOpensNegotiation() throws Exception {
    mockMvc
        .perform(
            post("/api/negotiations")
                .with(providerJwt(providerId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"contractId": "%s", "notes": "I propose"}
                    """
                        .formatted(contractId)))
        .andExpect(status().isForbidden());
  }

  @Test
  void shouldReturn403ForAdvertiser() throws Exception {
    mockMvc
        .perform(get("/api/negotiations").with(advertiserJwt(UUID.randomUUID())))
        .andExpect(status().isForbidden());
  }

  @Test
  void shouldReturn404ForUnknownContract() throws Exception {
    mockMvc
        .perform(
            post("/api/negotiations")
                .with(requesterJwt(requesterId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"contractId": "%s", "notes": "hello"}
                    """
                        .formatted(UUID.randomUUID())))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void shouldReturn409ForSecondOpenNegotiation() throws Exception {
    createNegotiation();

    mockMvc
        .perform(
            post("/api/negotiations")
                .with(requesterJwt(requesterId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"contractId": "%s", "notes": "another try"}
                    """
                        .formatted(contractId)))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CONFLICT"));
  }

  @Test
  void shouldReturn409WhenProposingOutOfTurn() throws Exception {
    String negotiationId = createNegotiation();

    mockMvc
        .perform(
            post("/api/negotiations/" + negotiationId + "/entries")
                .with(requesterJwt(requesterId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "PROPOSAL", "price": 90, "notes": "lower?"}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"))
        .andExpect(jsonPath("$.negotiationStatus").value("AWAITING_PROVIDER"));
  }

  @Test
  void shouldReturn409WhenFinalizingTwice() throws Exception {
    String negotiationId = createNegotiation();
    finalizeAs(negotiationId, "REJECT").andExpect(status().isOk());

    finalizeAs(negotiationId, "REJECT")
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
  }

  @Test
  void shouldReturn400ForMessageWithPrice() throws Exception {
    String negotiationId = createNegotiation();

    mockMvc
        .perform(
            post("/api/negotiations/" + negotiationId + "/entries")
                .with(providerJwt(providerId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "MESSAGE", "price": 10, "notes": "psst"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }

  @Test
  void shouldReturn400ForNotesOverLimit() throws Exception {
    String negotiationId = createNegotiation();

    mockMvc
        .perform(
            post("/api/negotiations/" + negotiationId + "/entries")
                .with(providerJwt(providerId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "MESSAGE", "notes": "%s"}
                    """
                        .formatted("x".repeat(1001))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }

  @Test
  void shouldReturn400ForBlankNotes() throws Exception {
    String negotiationId = createNegotiation();

    mockMvc
        .perform(
            post("/api/negotiations/" + negotiationId + "/entries")
                .with(providerJwt(providerId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "MESSAGE", "notes": "   "}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }

  @Test
  void shouldReturn400ForUnparsableDeadline() throws Exception {
    String negotiationId = createNegotiation();

    mockMvc
        .perform(
            post("/api/negotiations/" + negotiationId + "/entries")
                .with(providerJwt(providerId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "RESPONSE", "deadline": "not-a-date", "notes": "next week"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }

  @Test
  void shouldReturn400ForPriceWithFractionalCents() throws Exception {
    String negotiationId = createNegotiation();

    mockMvc
        .perform(
            post("/api/negotiations/" + negotiationId + "/entries")
                .with(providerJwt(providerId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type": "RESPONSE", "price": 130.555, "notes": "odd cents"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

    mockMvc
        .perform(get("/api/negotiations/" + negotiationId).with(providerJwt(providerId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.negotiation.status").value("AWAITING_PROVIDER"))
        .andExpect(jsonPath("$.history.length()").value(1));
  }

  @Test
  void shouldReturn400ForContractInProgress() throws Exception {
    var started =
        contractRepository.save(
            new Contract(
                requesterId,
                providerId,
                ContractStatus.IN_PROGRESS,
                new BigDecimal("100.00"),
                null,
                null));

    mockMvc
        .perform(
            post("/api/negotiations")
                .with(requesterJwt(requesterId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"contractId": "%s", "notes": "too late?"}
                    """
                        .formatted(started.getId())))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_STATE"));
  }

  @Test
  void shouldReturn401WithoutToken() throws Exception {
    mockMvc.perform(get("/api/negotiations")).andExpect(status().isUnauthorized());
  }

  // ==================== Helpers ====================

  private String createNegotiation() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/negotiations")
                    .with(requesterJwt(requesterId))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"contractId": "%s", "price": 100, "notes": "opening offer"}
                        """
                            .formatted(contractId)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.negotiation.id").toString();
  }

  private ResultActions finalizeAs(String negotiationId, String decision) throws Exception {
    return mockMvc.perform(
        post("/api/negotiations/" + negotiationId + "/finalize")
            .with(providerJwt(providerId))
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"decision": "%s"}
                """
                    .formatted(decision)));
  }

  private long countAccessDenied() {
    return auditEventRepository.findAll().stream()
        .filter(e -> "security.access_denied".equals(e.getEventType()))
        .count();
  }
}
