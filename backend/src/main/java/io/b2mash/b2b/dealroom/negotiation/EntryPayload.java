package io.b2mash.b2b.dealroom.negotiation;

import java.math.BigDecimal;
import java.time.Instant;

/** Content of a history entry. Each {@link EntryType} has exactly one payload variant. */
public sealed interface EntryPayload
    permits EntryPayload.TermsPayload, EntryPayload.MessagePayload {

  String notes();

  /** Returns true if the payload carries a price or a deadline. */
  boolean hasTerms();

  /** Payload of PROPOSAL and RESPONSE entries. Price and deadline are each optional. */
  record TermsPayload(BigDecimal price, Instant deadline, String notes) implements EntryPayload {

    @Override
    public boolean hasTerms() {
      return price != null || deadline != null;
    }

    public NegotiatedTerms toTerms() {
      return new NegotiatedTerms(price, deadline);
    }
  }

  /** Payload of MESSAGE entries. */
  record MessagePayload(String notes) implements EntryPayload {

    @Override
    public boolean hasTerms() {
      return false;
    }
  }
}
