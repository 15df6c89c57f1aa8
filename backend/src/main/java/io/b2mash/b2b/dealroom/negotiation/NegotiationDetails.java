package io.b2mash.b2b.dealroom.negotiation;

import java.util.List;

/** A negotiation together with its full history, oldest entry first. */
public record NegotiationDetails(Negotiation negotiation, List<NegotiationEntry> history) {}
