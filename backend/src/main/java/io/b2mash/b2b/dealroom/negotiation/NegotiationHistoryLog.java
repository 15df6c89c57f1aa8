package io.b2mash.b2b.dealroom.negotiation;

import io.b2mash.b2b.dealroom.exception.InvalidTransitionException;
import io.b2mash.b2b.dealroom.exception.ValidationException;
import io.b2mash.b2b.dealroom.negotiation.EntryPayload.MessagePayload;
import io.b2mash.b2b.dealroom.negotiation.EntryPayload.TermsPayload;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Append-only history of a negotiation. Entries are validated, stamped with the server clock and a
 * dense sequence number, and never modified afterwards.
 *
 * <p>Callers hold the negotiation's row lock, so sequence numbers and timestamps are assigned
 * without interleaving.
 */
@Component
public class NegotiationHistoryLog {

  private static final Logger log = LoggerFactory.getLogger(NegotiationHistoryLog.class);

  static final int PRICE_INTEGER_DIGITS = 10;
  static final int PRICE_FRACTION_DIGITS = 2;

  private final NegotiationEntryRepository entryRepository;
  private final NegotiationProperties properties;

  public NegotiationHistoryLog(
      NegotiationEntryRepository entryRepository, NegotiationProperties properties) {
    this.entryRepository = entryRepository;
    this.properties = properties;
  }

  /**
   * Validates {@code draft} and appends it to the negotiation's history.
   *
   * @throws ValidationException if the draft is malformed
   * @throws InvalidTransitionException if the negotiation is already closed
   */
  public NegotiationEntry append(Negotiation negotiation, UUID actorId, EntryDraft draft) {
    if (negotiation.getStatus().isTerminal()) {
      throw new InvalidTransitionException(negotiation.getStatus().name(), "append to");
    }
    var payload = toPayload(draft);
    var occurredAt = nextTimestamp(negotiation.getId());
    int sequenceNumber = negotiation.nextSequenceNumber();

    var entry =
        entryRepository.save(
            new NegotiationEntry(
                negotiation.getId(), sequenceNumber, actorId, draft.type(), payload, occurredAt));
    log.debug(
        "Appended {} entry #{} to negotiation {}",
        draft.type(),
        sequenceNumber,
        negotiation.getId());
    return entry;
  }

  /** Most recent PROPOSAL or RESPONSE carrying a price or a deadline. Messages are skipped. */
  public Optional<NegotiationEntry> lastTermsEntry(UUID negotiationId) {
    return entryRepository.findByNegotiationIdOrderBySequenceNumberDesc(negotiationId).stream()
        .filter(NegotiationEntry::carriesTerms)
        .findFirst();
  }

  /** Full history in sequence order. */
  public List<NegotiationEntry> history(UUID negotiationId) {
    return entryRepository.findByNegotiationIdOrderBySequenceNumberAsc(negotiationId);
  }

  private Instant nextTimestamp(UUID negotiationId) {
    var now = Instant.now();
    if (negotiationId == null) {
      return now;
    }
    return entryRepository
        .findFirstByNegotiationIdOrderBySequenceNumberDesc(negotiationId)
        .map(NegotiationEntry::getOccurredAt)
        .filter(last -> last.isAfter(now))
        .orElse(now);
  }

  private EntryPayload toPayload(EntryDraft draft) {
    if (draft == null || draft.type() == null) {
      throw new ValidationException("Entry type is required");
    }
    var notes = draft.notes();
    if (notes == null || notes.isBlank()) {
      throw new ValidationException("Notes are required");
    }
    int maxLength = properties.history().maxNotesLength();
    if (notes.length() > maxLength) {
      throw new ValidationException("Notes must not exceed " + maxLength + " characters");
    }
    if (draft.type() == EntryType.MESSAGE) {
      if (draft.price() != null || draft.deadline() != null) {
        throw new ValidationException("A message entry cannot carry a price or a deadline");
      }
      return new MessagePayload(notes);
    }
    var price = draft.price();
    if (price != null) {
      if (price.compareTo(BigDecimal.ZERO) < 0) {
        throw new ValidationException("Price must not be negative");
      }
      // stored as NUMERIC(12,2)
      var digits = price.stripTrailingZeros();
      if (digits.scale() > PRICE_FRACTION_DIGITS
          || digits.precision() - digits.scale() > PRICE_INTEGER_DIGITS) {
        throw new ValidationException(
            "Price must have at most "
                + PRICE_INTEGER_DIGITS
                + " integer digits and "
                + PRICE_FRACTION_DIGITS
                + " decimals");
      }
    }
    return new TermsPayload(draft.price(), draft.deadline(), notes);
  }
}
