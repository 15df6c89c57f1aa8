package io.b2mash.b2b.dealroom.negotiation;

import java.util.UUID;

/**
 * Published inside the action's transaction; delivered to {@link NegotiationNotifier} only after
 * the transaction commits.
 *
 * @param recipientId the counterpart of the acting participant
 */
public record NegotiationTransitionEvent(
    UUID negotiationId,
    UUID contractId,
    NegotiationAction action,
    NegotiationStatus status,
    UUID actorId,
    ParticipantRole actorRole,
    UUID recipientId) {}
