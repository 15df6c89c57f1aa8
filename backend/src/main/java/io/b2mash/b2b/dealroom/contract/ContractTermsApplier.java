package io.b2mash.b2b.dealroom.contract;

import io.b2mash.b2b.dealroom.audit.AuditEventBuilder;
import io.b2mash.b2b.dealroom.audit.AuditService;
import io.b2mash.b2b.dealroom.exception.InvalidStateException;
import io.b2mash.b2b.dealroom.exception.ResourceConflictException;
import io.b2mash.b2b.dealroom.negotiation.Negotiation;
import io.b2mash.b2b.dealroom.transaction.UnitOfWork;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes the final terms of an accepted negotiation onto its contract. Runs inside the caller's
 * unit of work; any failure here rolls back the acceptance as a whole.
 */
@Component
public class ContractTermsApplier {

  private static final Logger log = LoggerFactory.getLogger(ContractTermsApplier.class);

  private final ContractRepository contractRepository;
  private final AuditService auditService;

  public ContractTermsApplier(ContractRepository contractRepository, AuditService auditService) {
    this.contractRepository = contractRepository;
    this.auditService = auditService;
  }

  /**
   * Applies {@code negotiation}'s final terms: price to {@code totalValue}, deadline to {@code
   * serviceEnd}. Absent terms leave the corresponding field untouched.
   *
   * @throws ResourceConflictException if the contract is gone, no longer negotiable, or the
   *     deadline falls before the service start
   */
  public Contract applyAcceptedTerms(Negotiation negotiation, UnitOfWork.Handle handle) {
    handle.requireActive();
    var terms =
        negotiation
            .getFinalTerms()
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "Invalid negotiation state",
                        "Cannot apply terms of negotiation in status " + negotiation.getStatus()));

    var contract =
        contractRepository
            .findByIdForUpdate(negotiation.getContractId())
            .orElseThrow(
                () ->
                    new ResourceConflictException(
                        "Contract unavailable",
                        "Contract " + negotiation.getContractId() + " no longer exists"));

    if (!contract.getStatus().allowsNegotiation()) {
      throw new ResourceConflictException(
          "Contract not negotiable",
          "Cannot apply negotiated terms to contract in status " + contract.getStatus());
    }
    if (terms.deadline() != null
        && contract.getServiceStart() != null
        && terms.deadline().isBefore(contract.getServiceStart())) {
      throw new ResourceConflictException(
          "Deadline before service start",
          "Agreed deadline "
              + terms.deadline()
              + " is earlier than the contract's service start "
              + contract.getServiceStart());
    }
    if (terms.isEmpty()) {
      log.info(
          "Negotiation {} accepted without terms; contract {} left unchanged",
          negotiation.getId(),
          contract.getId());
      return contract;
    }

    var details = new LinkedHashMap<String, Object>();
    details.put("negotiation_id", negotiation.getId().toString());
    if (terms.price() != null) {
      details.put("total_value", contract.getTotalValue() + " -> " + terms.price());
    }
    if (terms.deadline() != null) {
      details.put("service_end", contract.getServiceEnd() + " -> " + terms.deadline());
    }

    contract.applyNegotiatedTerms(terms.price(), terms.deadline());
    var saved = contractRepository.save(contract);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("contract.terms_applied")
            .entityType("contract")
            .entityId(saved.getId())
            .details(details)
            .build());

    log.info(
        "Applied terms of negotiation {} to contract {}: price={}, deadline={}",
        negotiation.getId(),
        saved.getId(),
        terms.price(),
        terms.deadline());
    return saved;
  }
}
