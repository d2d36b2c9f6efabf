package io.b2mash.readiness.notification;

import io.b2mash.readiness.event.AbsenceJustifiedEvent;
import io.b2mash.readiness.event.AbsenceReviewedEvent;
import io.b2mash.readiness.event.ExemptionDecidedEvent;
import io.b2mash.readiness.event.ExemptionRequestedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Creates notifications for committed absence and leave changes. Handlers run AFTER_COMMIT and the
 * service writes in a new transaction, so:
 *
 * <ol>
 *   <li>Notifications are only created for committed changes.
 *   <li>Notification failures do not affect the change itself.
 * </ol>
 */
@Component
public class NotificationEventHandler {

  private static final Logger log = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final NotificationService notificationService;

  public NotificationEventHandler(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onAbsenceJustified(AbsenceJustifiedEvent event) {
    try {
      notificationService.handleAbsenceJustified(event);
    } catch (Exception e) {
      log.warn(
          "Failed to create notifications for absence.justified event={}", event.entityId(), e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onAbsenceReviewed(AbsenceReviewedEvent event) {
    try {
      notificationService.handleAbsenceReviewed(event);
    } catch (Exception e) {
      log.warn(
          "Failed to create notifications for absence.reviewed event={}", event.entityId(), e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onExemptionRequested(ExemptionRequestedEvent event) {
    try {
      notificationService.handleExemptionRequested(event);
    } catch (Exception e) {
      log.warn(
          "Failed to create notifications for exemption.requested event={}", event.entityId(), e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onExemptionDecided(ExemptionDecidedEvent event) {
    try {
      notificationService.handleExemptionDecided(event);
    } catch (Exception e) {
      log.warn(
          "Failed to create notifications for {} event={}", event.eventType(), event.entityId(), e);
    }
  }
}
