package io.b2mash.b2b.dealroom.notification;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

  List<Notification> findByRecipientIdOrderByCreatedAtDesc(UUID recipientId);

  List<Notification> findByReferenceEntityIdOrderByCreatedAtAsc(UUID referenceEntityId);
}
