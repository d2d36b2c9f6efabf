package io.b2mash.readiness.notification;

import io.b2mash.readiness.scope.RequestScopes;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

  private final NotificationService notificationService;

  public NotificationController(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @GetMapping
  public ResponseEntity<List<NotificationResponse>> listNotifications(
      @RequestParam(defaultValue = "false") boolean unreadOnly,
      @RequestParam(defaultValue = "20") int size) {
    UUID memberId = RequestScopes.requireScope().callerId();
    var notifications =
        notificationService.listNotifications(
            memberId, unreadOnly, Math.max(1, Math.min(size, 100)));
    return ResponseEntity.ok(notifications.stream().map(NotificationResponse::from).toList());
  }

  @GetMapping("/unread-count")
  public ResponseEntity<UnreadCountResponse> getUnreadCount() {
    UUID memberId = RequestScopes.requireScope().callerId();
    return ResponseEntity.ok(new UnreadCountResponse(notificationService.getUnreadCount(memberId)));
  }

  @PutMapping("/{id}/read")
  public ResponseEntity<Void> markAsRead(@PathVariable UUID id) {
    notificationService.markAsRead(id, RequestScopes.requireScope().callerId());
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/read-all")
  public ResponseEntity<Void> markAllAsRead() {
    notificationService.markAllAsRead(RequestScopes.requireScope().callerId());
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record NotificationResponse(
      UUID id,
      String type,
      String title,
      String message,
      Map<String, Object> payload,
      boolean isRead,
      Instant createdAt) {

    public static NotificationResponse from(Notification notification) {
      return new NotificationResponse(
          notification.getId(),
          notification.getType(),
          notification.getTitle(),
          notification.getMessage(),
          notification.getPayload(),
          notification.isRead(),
          notification.getCreatedAt());
    }
  }

  public record UnreadCountResponse(long count) {}
}
