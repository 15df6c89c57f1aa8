package io.b2mash.b2b.dealroom.negotiation;

import java.math.BigDecimal;
import java.time.Instant;

/** Price and deadline agreed in a negotiation. Either may be absent. */
public record NegotiatedTerms(BigDecimal price, Instant deadline) {

  private static final NegotiatedTerms EMPTY = new NegotiatedTerms(null, null);

  public static NegotiatedTerms empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return price == null && deadline == null;
  }
}
