package io.b2mash.b2b.dealroom.notification;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  private final NotificationRepository notificationRepository;

  public NotificationService(NotificationRepository notificationRepository) {
    this.notificationRepository = notificationRepository;
  }

  /** Persists an in-app notification in its own transaction. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Notification createNotification(
      UUID recipientId,
      String type,
      String title,
      String body,
      String referenceEntityType,
      UUID referenceEntityId) {
    var notification =
        notificationRepository.save(
            new Notification(
                recipientId, type, title, body, referenceEntityType, referenceEntityId));
    log.debug("Created {} notification {} for {}", type, notification.getId(), recipientId);
    return notification;
  }
}
