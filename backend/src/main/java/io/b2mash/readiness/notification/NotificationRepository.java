package io.b2mash.readiness.notification;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.recipientMemberId = :memberId
      ORDER BY n.createdAt DESC
      """)
  List<Notification> findByRecipientMemberId(
      @Param("memberId") UUID memberId, Pageable pageable);

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.recipientMemberId = :memberId
        AND n.isRead = false
      ORDER BY n.createdAt DESC
      """)
  List<Notification> findUnreadByRecipientMemberId(
      @Param("memberId") UUID memberId, Pageable pageable);

  @Query(
      """
      SELECT COUNT(n) FROM Notification n
      WHERE n.recipientMemberId = :memberId
        AND n.isRead = false
      """)
  long countUnreadByRecipientMemberId(@Param("memberId") UUID memberId);

  @Modifying
  @Query(
      """
      UPDATE Notification n SET n.isRead = true
      WHERE n.recipientMemberId = :memberId
        AND n.isRead = false
      """)
  int markAllAsRead(@Param("memberId") UUID memberId);
}
