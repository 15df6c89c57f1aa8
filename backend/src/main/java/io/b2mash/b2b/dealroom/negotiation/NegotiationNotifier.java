package io.b2mash.b2b.dealroom.negotiation;

/** Tells the other participant that a negotiation moved. Invoked after commit only. */
public interface NegotiationNotifier {

  void notifyTransition(NegotiationTransitionEvent event);
}
