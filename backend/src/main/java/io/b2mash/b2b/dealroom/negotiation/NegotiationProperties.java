package io.b2mash.b2b.dealroom.negotiation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for negotiation policy.
 *
 * @param policy turn-taking rules
 * @param history constraints on history entries
 */
@ConfigurationProperties(prefix = "negotiation")
public record NegotiationProperties(@DefaultValue Policy policy, @DefaultValue History history) {

  public static final int DEFAULT_MAX_NOTES_LENGTH = 1000;

  public static NegotiationProperties defaults() {
    return new NegotiationProperties(
        new Policy(false), new History(DEFAULT_MAX_NOTES_LENGTH));
  }

  /**
   * @param offTurnRejectAllowed whether the participant not holding the turn may reject
   */
  public record Policy(@DefaultValue("false") boolean offTurnRejectAllowed) {}

  /**
   * @param maxNotesLength upper bound on the notes of a single entry, in characters
   */
  public record History(@DefaultValue("1000") int maxNotesLength) {}
}
