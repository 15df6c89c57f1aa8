package io.b2mash.b2b.dealroom.negotiation;

import io.b2mash.b2b.dealroom.security.ActorJwtUtils;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class NegotiationController {

  private final NegotiationService negotiationService;

  public NegotiationController(NegotiationService negotiationService) {
    this.negotiationService = negotiationService;
  }

  @PostMapping("/api/negotiations")
  @PreAuthorize("hasRole('REQUESTER')")
  public ResponseEntity<NegotiationDetailResponse> createNegotiation(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody CreateNegotiationRequest request) {
    var actor = ActorJwtUtils.toActorContext(jwt);
    var details =
        negotiationService.create(
            actor,
            request.contractId(),
            EntryDraft.proposal(request.price(), request.deadline(), request.notes()));
    return ResponseEntity.created(
            URI.create("/api/negotiations/" + details.negotiation().getId()))
        .body(NegotiationDetailResponse.from(details));
  }

  @GetMapping("/api/negotiations")
  @PreAuthorize("hasAnyRole('REQUESTER', 'PROVIDER')")
  public ResponseEntity<Page<NegotiationResponse>> listMyNegotiations(
      @AuthenticationPrincipal Jwt jwt,
      @RequestParam(required = false) NegotiationStatus status,
      Pageable pageable) {
    var actor = ActorJwtUtils.toActorContext(jwt);
    var page = negotiationService.listMine(actor, status, pageable);
    return ResponseEntity.ok(page.map(NegotiationResponse::from));
  }

  @GetMapping("/api/negotiations/{id}")
  @PreAuthorize("hasAnyRole('REQUESTER', 'PROVIDER')")
  public ResponseEntity<NegotiationDetailResponse> getNegotiation(
      @AuthenticationPrincipal Jwt jwt, @PathVariable UUID id) {
    var actor = ActorJwtUtils.toActorContext(jwt);
    return ResponseEntity.ok(NegotiationDetailResponse.from(negotiationService.get(actor, id)));
  }

  @PostMapping("/api/negotiations/{id}/entries")
  @PreAuthorize("hasAnyRole('REQUESTER', 'PROVIDER')")
  public ResponseEntity<NegotiationDetailResponse> addEntry(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable UUID id,
      @Valid @RequestBody AddEntryRequest request) {
    var actor = ActorJwtUtils.toActorContext(jwt);
    var draft =
        new EntryDraft(request.type(), request.price(), request.deadline(), request.notes());
    return ResponseEntity.ok(
        NegotiationDetailResponse.from(negotiationService.addEntry(actor, id, draft)));
  }

  @PostMapping("/api/negotiations/{id}/finalize")
  @PreAuthorize("hasAnyRole('REQUESTER', 'PROVIDER')")
  public ResponseEntity<NegotiationDetailResponse> finalizeNegotiation(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable UUID id,
      @Valid @RequestBody FinalizeRequest request) {
    var actor = ActorJwtUtils.toActorContext(jwt);
    return ResponseEntity.ok(
        NegotiationDetailResponse.from(
            negotiationService.finalizeNegotiation(actor, id, request.decision())));
  }

  @PostMapping("/api/negotiations/{id}/cancel")
  @PreAuthorize("hasRole('REQUESTER')")
  public ResponseEntity<NegotiationDetailResponse> cancelNegotiation(
      @AuthenticationPrincipal Jwt jwt, @PathVariable UUID id) {
    var actor = ActorJwtUtils.toActorContext(jwt);
    return ResponseEntity.ok(NegotiationDetailResponse.from(negotiationService.cancel(actor, id)));
  }

  @GetMapping("/api/contracts/{contractId}/negotiations")
  @PreAuthorize("hasAnyRole('REQUESTER', 'PROVIDER')")
  public ResponseEntity<List<NegotiationResponse>> listContractNegotiations(
      @AuthenticationPrincipal Jwt jwt, @PathVariable UUID contractId) {
    var actor = ActorJwtUtils.toActorContext(jwt);
    var negotiations = negotiationService.listForContract(actor, contractId);
    return ResponseEntity.ok(negotiations.stream().map(NegotiationResponse::from).toList());
  }

  // --- DTOs ---

  public record CreateNegotiationRequest(
      @NotNull(message = "contractId is required") UUID contractId,
      @PositiveOrZero(message = "price must not be negative")
          @Digits(integer = 10, fraction = 2, message = "price must fit 10 digits and 2 decimals")
          BigDecimal price,
      Instant deadline,
      @NotBlank(message = "notes are required") String notes) {}

  public record AddEntryRequest(
      @NotNull(message = "type is required") EntryType type,
      @PositiveOrZero(message = "price must not be negative")
          @Digits(integer = 10, fraction = 2, message = "price must fit 10 digits and 2 decimals")
          BigDecimal price,
      Instant deadline,
      @NotBlank(message = "notes are required") String notes) {}

  public record FinalizeRequest(
      @NotNull(message = "decision is required") FinalizeDecision decision) {}

  public record TermsResponse(BigDecimal price, Instant deadline) {

    public static TermsResponse from(NegotiatedTerms terms) {
      return new TermsResponse(terms.price(), terms.deadline());
    }
  }

  public record NegotiationResponse(
      UUID id,
      UUID contractId,
      UUID requesterId,
      UUID providerId,
      NegotiationStatus status,
      TermsResponse finalTerms,
      int entryCount,
      Instant createdAt,
      Instant updatedAt,
      Instant closedAt) {

    public static NegotiationResponse from(Negotiation negotiation) {
      return new NegotiationResponse(
          negotiation.getId(),
          negotiation.getContractId(),
          negotiation.getRequesterId(),
          negotiation.getProviderId(),
          negotiation.getStatus(),
          negotiation.getFinalTerms().map(TermsResponse::from).orElse(null),
          negotiation.getEntryCount(),
          negotiation.getCreatedAt(),
          negotiation.getUpdatedAt(),
          negotiation.getClosedAt());
    }
  }

  public record EntryResponse(
      int sequenceNumber,
      UUID actorId,
      EntryType type,
      BigDecimal price,
      Instant deadline,
      String notes,
      Instant occurredAt) {

    public static EntryResponse from(NegotiationEntry entry) {
      return new EntryResponse(
          entry.getSequenceNumber(),
          entry.getActorId(),
          entry.getEntryType(),
          entry.getPrice(),
          entry.getDeadline(),
          entry.getNotes(),
          entry.getOccurredAt());
    }
  }

  public record NegotiationDetailResponse(
      NegotiationResponse negotiation, List<EntryResponse> history) {

    public static NegotiationDetailResponse from(NegotiationDetails details) {
      return new NegotiationDetailResponse(
          NegotiationResponse.from(details.negotiation()),
          details.history().stream().map(EntryResponse::from).toList());
    }
  }
}
