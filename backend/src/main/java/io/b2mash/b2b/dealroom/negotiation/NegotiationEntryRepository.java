package io.b2mash.b2b.dealroom.negotiation;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface NegotiationEntryRepository extends JpaRepository<NegotiationEntry, UUID> {

  List<NegotiationEntry> findByNegotiationIdOrderBySequenceNumberAsc(UUID negotiationId);

  List<NegotiationEntry> findByNegotiationIdOrderBySequenceNumberDesc(UUID negotiationId);

  Optional<NegotiationEntry> findFirstByNegotiationIdOrderBySequenceNumberDesc(UUID negotiationId);
}
