package io.b2mash.b2b.dealroom.negotiation;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NegotiationRepository extends JpaRepository<Negotiation, UUID> {

  /** Loads the negotiation with a row lock held until the surrounding transaction ends. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT n FROM Negotiation n WHERE n.id = :id")
  Optional<Negotiation> findByIdForUpdate(@Param("id") UUID id);

  @Query(
      """
      SELECT COUNT(n) > 0 FROM Negotiation n
      WHERE n.contractId = :contractId
        AND n.status IN (
          io.b2mash.b2b.dealroom.negotiation.NegotiationStatus.AWAITING_PROVIDER,
          io.b2mash.b2b.dealroom.negotiation.NegotiationStatus.AWAITING_REQUESTER)
      """)
  boolean existsOpenForContract(@Param("contractId") UUID contractId);

  List<Negotiation> findByContractIdOrderByCreatedAtDesc(UUID contractId);

  @Query(
      """
      SELECT n FROM Negotiation n
      WHERE (n.requesterId = :actorId OR n.providerId = :actorId)
        AND (:status IS NULL OR n.status = :status)
      ORDER BY n.createdAt DESC
      """)
  Page<Negotiation> findForParticipant(
      @Param("actorId") UUID actorId,
      @Param("status") NegotiationStatus status,
      Pageable pageable);
}
