package io.b2mash.b2b.dealroom.notification;

import io.b2mash.b2b.dealroom.negotiation.NegotiationNotifier;
import io.b2mash.b2b.dealroom.negotiation.NegotiationTransitionEvent;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Turns negotiation transitions into in-app notifications for the counterpart. */
@Component
public class InAppNegotiationNotifier implements NegotiationNotifier {

  private final NotificationService notificationService;

  public InAppNegotiationNotifier(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @Override
  public void notifyTransition(NegotiationTransitionEvent event) {
    String actor = event.actorRole().label();
    String title =
        switch (event.action()) {
          case PROPOSAL -> "New proposal from the " + actor;
          case RESPONSE -> "New response from the " + actor;
          case MESSAGE -> "New message from the " + actor;
          case ACCEPT -> "Negotiation accepted by the " + actor;
          case REJECT -> "Negotiation rejected by the " + actor;
          case CANCEL -> "Negotiation cancelled by the " + actor;
        };
    notificationService.createNotification(
        event.recipientId(),
        "NEGOTIATION_" + event.action().name(),
        title,
        "Negotiation %s on contract %s is now %s"
            .formatted(
                event.negotiationId(),
                event.contractId(),
                event.status().name().toLowerCase(Locale.ROOT)),
        "NEGOTIATION",
        event.negotiationId());
  }
}
