package io.b2mash.b2b.dealroom.negotiation;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Unvalidated entry as submitted by a participant. The server assigns the timestamp; a draft never
 * carries one.
 */
public record EntryDraft(EntryType type, BigDecimal price, Instant deadline, String notes) {

  public static EntryDraft proposal(BigDecimal price, Instant deadline, String notes) {
    return new EntryDraft(EntryType.PROPOSAL, price, deadline, notes);
  }

  public static EntryDraft response(BigDecimal price, Instant deadline, String notes) {
    return new EntryDraft(EntryType.RESPONSE, price, deadline, notes);
  }

  public static EntryDraft message(String notes) {
    return new EntryDraft(EntryType.MESSAGE, null, null, notes);
  }
}
