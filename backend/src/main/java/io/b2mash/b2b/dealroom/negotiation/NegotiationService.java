package io.b2mash.b2b.dealroom.negotiation;

import io.b2mash.b2b.dealroom.actor.ActorContext;
import io.b2mash.b2b.dealroom.actor.ActorRole;
import io.b2mash.b2b.dealroom.audit.AuditEventBuilder;
import io.b2mash.b2b.dealroom.audit.AuditService;
import io.b2mash.b2b.dealroom.contract.ContractRepository;
import io.b2mash.b2b.dealroom.contract.ContractTermsApplier;
import io.b2mash.b2b.dealroom.exception.ForbiddenException;
import io.b2mash.b2b.dealroom.exception.InvalidStateException;
import io.b2mash.b2b.dealroom.exception.ResourceConflictException;
import io.b2mash.b2b.dealroom.exception.ResourceNotFoundException;
import io.b2mash.b2b.dealroom.exception.ValidationException;
import io.b2mash.b2b.dealroom.negotiation.EntryPayload.TermsPayload;
import io.b2mash.b2b.dealroom.transaction.UnitOfWork;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point for every negotiation operation. Each write follows the same path: lock the
 * negotiation, check the actor with {@link NegotiationAuthorizationGuard}, check the transition
 * with {@link NegotiationStatus}, append to {@link NegotiationHistoryLog}, apply the new status.
 * Acceptance additionally writes the agreed terms to the contract in the same unit of work.
 */
@Service
public class NegotiationService {

  private static final Logger log = LoggerFactory.getLogger(NegotiationService.class);

  private final NegotiationRepository negotiationRepository;
  private final ContractRepository contractRepository;
  private final NegotiationHistoryLog historyLog;
  private final NegotiationAuthorizationGuard guard;
  private final ContractTermsApplier termsApplier;
  private final UnitOfWork unitOfWork;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public NegotiationService(
      NegotiationRepository negotiationRepository,
      ContractRepository contractRepository,
      NegotiationHistoryLog historyLog,
      NegotiationAuthorizationGuard guard,
      ContractTermsApplier termsApplier,
      UnitOfWork unitOfWork,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.negotiationRepository = negotiationRepository;
    this.contractRepository = contractRepository;
    this.historyLog = historyLog;
    this.guard = guard;
    this.termsApplier = termsApplier;
    this.unitOfWork = unitOfWork;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  // --- Create ---

  /**
   * Opens a negotiation on a contract with the requester's initial proposal. The negotiation starts
   * in AWAITING_PROVIDER.
   */
  @Transactional
  public NegotiationDetails create(ActorContext actor, UUID contractId, EntryDraft proposal) {
    if (!actor.hasRole(ActorRole.REQUESTER)) {
      throw new ForbiddenException(
          "Cannot open negotiation", "Only requesters can open a negotiation");
    }
    if (proposal == null || proposal.type() != EntryType.PROPOSAL) {
      throw new ValidationException("A negotiation must open with a proposal");
    }

    var contract =
        contractRepository
            .findByIdForUpdate(contractId)
            .orElseThrow(() -> new ResourceNotFoundException("Contract", contractId));
    if (!contract.getRequesterId().equals(actor.actorId())) {
      throw new ForbiddenException(
          "Cannot open negotiation", "Only the contract's requester can open a negotiation");
    }
    if (!contract.getStatus().allowsNegotiation()) {
      throw new InvalidStateException(
          "Invalid contract state",
          "Cannot negotiate a contract in status " + contract.getStatus());
    }
    if (contract.getRequesterId().equals(contract.getProviderId())) {
      throw new InvalidStateException(
          "Invalid contract state", "Requester and provider of the contract are the same user");
    }
    if (negotiationRepository.existsOpenForContract(contractId)) {
      throw new ResourceConflictException(
          "Negotiation already open",
          "Contract " + contractId + " already has an open negotiation");
    }

    var negotiation =
        negotiationRepository.save(
            new Negotiation(contractId, contract.getRequesterId(), contract.getProviderId()));
    historyLog.append(negotiation, actor.actorId(), proposal);
    negotiation = negotiationRepository.save(negotiation);

    audit(
        "negotiation.created",
        negotiation,
        actor,
        Map.of("contract_id", contractId.toString(), "status", negotiation.getStatus().name()));
    publish(negotiation, NegotiationAction.PROPOSAL, actor, ParticipantRole.REQUESTER);

    log.info(
        "Opened negotiation {} on contract {} by requester {}",
        negotiation.getId(),
        contractId,
        actor.actorId());
    return details(negotiation);
  }

  // --- Entries ---

  /** Appends a proposal, response or message and applies its status change. */
  @Transactional
  public NegotiationDetails addEntry(ActorContext actor, UUID negotiationId, EntryDraft draft) {
    if (draft == null || draft.type() == null) {
      throw new ValidationException("Entry type is required");
    }
    var negotiation = lockNegotiation(negotiationId);
    var action = draft.type().action();

    var role = guard.requireCanAct(negotiation, actor, action);
    negotiation.requireTransition(action);
    var entry = historyLog.append(negotiation, actor.actorId(), draft);
    negotiation.applyEntry(draft.type());
    negotiation = negotiationRepository.save(negotiation);

    audit(
        "negotiation.entry_added",
        negotiation,
        actor,
        Map.of(
            "entry_type", draft.type().name(),
            "sequence_number", entry.getSequenceNumber(),
            "status", negotiation.getStatus().name()));
    publish(negotiation, action, actor, role);

    log.info(
        "Negotiation {}: {} by {} -> {}",
        negotiationId,
        draft.type(),
        role.label(),
        negotiation.getStatus());
    return details(negotiation);
  }

  // --- Finalize / cancel ---

  /**
   * Accepts or rejects the negotiation. On acceptance the latest proposed terms become the final
   * terms and are written to the contract; status, closing entry and contract commit together or
   * not at all.
   */
  public NegotiationDetails finalizeNegotiation(
      ActorContext actor, UUID negotiationId, FinalizeDecision decision) {
    if (decision == null) {
      throw new ValidationException("Decision is required");
    }
    return unitOfWork.execute(
        handle -> {
          var negotiation = lockNegotiation(negotiationId);
          var action = decision.action();

          var role = guard.requireCanAct(negotiation, actor, action);
          negotiation.requireTransition(action);
          historyLog.append(negotiation, actor.actorId(), closingMessage(action, role));

          var auditDetails = new LinkedHashMap<String, Object>();
          if (decision == FinalizeDecision.ACCEPT) {
            var terms = resolveFinalTerms(negotiationId);
            negotiation.accept(terms);
            negotiation = negotiationRepository.save(negotiation);
            termsApplier.applyAcceptedTerms(negotiation, handle);
            if (terms.price() != null) {
              auditDetails.put("final_price", terms.price().toPlainString());
            }
            if (terms.deadline() != null) {
              auditDetails.put("final_deadline", terms.deadline().toString());
            }
          } else {
            negotiation.reject();
            negotiation = negotiationRepository.save(negotiation);
          }
          auditDetails.put("closed_by", role.label());

          audit(
              decision == FinalizeDecision.ACCEPT ? "negotiation.accepted" : "negotiation.rejected",
              negotiation,
              actor,
              auditDetails);
          publish(negotiation, action, actor, role);

          log.info(
              "Negotiation {} {} by {}",
              negotiationId,
              negotiation.getStatus(),
              role.label());
          return details(negotiation);
        });
  }

  /** Withdraws an open negotiation. Requester only; the contract is untouched. */
  @Transactional
  public NegotiationDetails cancel(ActorContext actor, UUID negotiationId) {
    var negotiation = lockNegotiation(negotiationId);

    var role = guard.requireCanAct(negotiation, actor, NegotiationAction.CANCEL);
    negotiation.requireTransition(NegotiationAction.CANCEL);
    historyLog.append(
        negotiation, actor.actorId(), closingMessage(NegotiationAction.CANCEL, role));
    negotiation.cancel();
    negotiation = negotiationRepository.save(negotiation);

    audit("negotiation.cancelled", negotiation, actor, Map.of("closed_by", role.label()));
    publish(negotiation, NegotiationAction.CANCEL, actor, role);

    log.info("Negotiation {} cancelled by {}", negotiationId, role.label());
    return details(negotiation);
  }

  // --- Queries ---

  @Transactional(readOnly = true)
  public NegotiationDetails get(ActorContext actor, UUID negotiationId) {
    var negotiation =
        negotiationRepository
            .findById(negotiationId)
            .orElseThrow(() -> new ResourceNotFoundException("Negotiation", negotiationId));
    guard.requireParticipant(negotiation, actor);
    return details(negotiation);
  }

  /** Negotiations of one contract, newest first. Visible to the contract's parties only. */
  @Transactional(readOnly = true)
  public List<Negotiation> listForContract(ActorContext actor, UUID contractId) {
    var contract =
        contractRepository
            .findById(contractId)
            .orElseThrow(() -> new ResourceNotFoundException("Contract", contractId));
    if (!contract.isParticipant(actor.actorId())) {
      throw new ForbiddenException(
          "Cannot list negotiations", "Actor is not a party to contract " + contractId);
    }
    return negotiationRepository.findByContractIdOrderByCreatedAtDesc(contractId);
  }

  /** Negotiations the actor takes part in on either side, optionally filtered by status. */
  @Transactional(readOnly = true)
  public Page<Negotiation> listMine(
      ActorContext actor, NegotiationStatus status, Pageable pageable) {
    return negotiationRepository.findForParticipant(actor.actorId(), status, pageable);
  }

  // --- Helpers ---

  private Negotiation lockNegotiation(UUID negotiationId) {
    return negotiationRepository
        .findByIdForUpdate(negotiationId)
        .orElseThrow(() -> new ResourceNotFoundException("Negotiation", negotiationId));
  }

  private NegotiatedTerms resolveFinalTerms(UUID negotiationId) {
    return historyLog
        .lastTermsEntry(negotiationId)
        .map(NegotiationEntry::getPayload)
        .filter(TermsPayload.class::isInstance)
        .map(payload -> ((TermsPayload) payload).toTerms())
        .orElse(NegotiatedTerms.empty());
  }

  static EntryDraft closingMessage(NegotiationAction action, ParticipantRole role) {
    String outcome =
        switch (action) {
          case ACCEPT -> "accepted";
          case REJECT -> "rejected";
          case CANCEL -> "cancelled";
          default -> throw new IllegalArgumentException("Not a closing action: " + action);
        };
    return EntryDraft.message("negotiation " + outcome + " by " + role.label());
  }

  private NegotiationDetails details(Negotiation negotiation) {
    return new NegotiationDetails(negotiation, historyLog.history(negotiation.getId()));
  }

  private void audit(
      String eventType, Negotiation negotiation, ActorContext actor, Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("negotiation")
            .entityId(negotiation.getId())
            .actor(actor)
            .details(details)
            .build());
  }

  private void publish(
      Negotiation negotiation,
      NegotiationAction action,
      ActorContext actor,
      ParticipantRole actorRole) {
    eventPublisher.publishEvent(
        new NegotiationTransitionEvent(
            negotiation.getId(),
            negotiation.getContractId(),
            action,
            negotiation.getStatus(),
            actor.actorId(),
            actorRole,
            negotiation.participantId(actorRole.counterpart())));
  }
}
