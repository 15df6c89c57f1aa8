package io.b2mash.b2b.dealroom.negotiation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards committed negotiation transitions to the {@link NegotiationNotifier}. A failing notifier
 * is logged and never affects the already committed action.
 */
@Component
public class NegotiationEventHandler {

  private static final Logger log = LoggerFactory.getLogger(NegotiationEventHandler.class);

  private final NegotiationNotifier notifier;

  public NegotiationEventHandler(NegotiationNotifier notifier) {
    this.notifier = notifier;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTransition(NegotiationTransitionEvent event) {
    try {
      notifier.notifyTransition(event);
    } catch (Exception e) {
      log.error(
          "Failed to notify {} of {} on negotiation {}",
          event.recipientId(),
          event.action(),
          event.negotiationId(),
          e);
    }
  }
}
