package io.b2mash.b2b.dealroom.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "notifications")
public class Notification {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "recipient_id", nullable = false)
  private UUID recipientId;

  @Column(name = "type", nullable = false, length = 50)
  private String type;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "body", columnDefinition = "TEXT")
  private String body;

  @Column(name = "reference_entity_type", length = 20)
  private String referenceEntityType;

  @Column(name = "reference_entity_id")
  private UUID referenceEntityId;

  @Column(name = "is_read", nullable = false)
  private boolean isRead;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Notification() {}

  public Notification(
      UUID recipientId,
      String type,
      String title,
      String body,
      String referenceEntityType,
      UUID referenceEntityId) {
    this.recipientId = recipientId;
    this.type = type;
    this.title = title;
    this.body = body;
    this.referenceEntityType = referenceEntityType;
    this.referenceEntityId = referenceEntityId;
    this.isRead = false;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getRecipientId() {
    return recipientId;
  }

  public String getType() {
    return type;
  }

  public String getTitle() {
    return title;
  }

  public String getBody() {
    return body;
  }

  public String getReferenceEntityType() {
    return referenceEntityType;
  }

  public UUID getReferenceEntityId() {
    return referenceEntityId;
  }

  public boolean isRead() {
    return isRead;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
