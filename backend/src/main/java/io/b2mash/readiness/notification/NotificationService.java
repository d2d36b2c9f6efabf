package io.b2mash.readiness.notification;

import io.b2mash.readiness.event.AbsenceJustifiedEvent;
import io.b2mash.readiness.event.AbsenceReviewedEvent;
import io.b2mash.readiness.event.ExemptionDecidedEvent;
import io.b2mash.readiness.event.ExemptionRequestedEvent;
import io.b2mash.readiness.exception.ResourceNotFoundException;
import io.b2mash.readiness.member.Member;
import io.b2mash.readiness.member.MemberRepository;
import io.b2mash.readiness.team.TeamRepository;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  static final String ABSENCE_JUSTIFIED = "ABSENCE_JUSTIFIED";
  static final String ABSENCE_REVIEWED = "ABSENCE_REVIEWED";
  static final String EXEMPTION_REQUESTED = "EXEMPTION_REQUESTED";
  static final String EXEMPTION_DECIDED = "EXEMPTION_DECIDED";

  private final NotificationRepository notificationRepository;
  private final MemberRepository memberRepository;
  private final TeamRepository teamRepository;

  public NotificationService(
      NotificationRepository notificationRepository,
      MemberRepository memberRepository,
      TeamRepository teamRepository) {
    this.notificationRepository = notificationRepository;
    this.memberRepository = memberRepository;
    this.teamRepository = teamRepository;
  }

  /** Stores one notification for a member, committed independently of the caller. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Notification enqueue(
      UUID recipientId,
      UUID companyId,
      String title,
      String message,
      String type,
      Map<String, Object> payload) {
    var notification =
        notificationRepository.save(
            new Notification(recipientId, companyId, type, title, message, payload));
    log.debug(
        "Notification {} of type {} queued for member {}", notification.getId(), type, recipientId);
    return notification;
  }

  @Transactional(readOnly = true)
  public List<Notification> listNotifications(UUID memberId, boolean unreadOnly, int limit) {
    var page = PageRequest.of(0, limit);
    if (unreadOnly) {
      return notificationRepository.findUnreadByRecipientMemberId(memberId, page);
    }
    return notificationRepository.findByRecipientMemberId(memberId, page);
  }

  @Transactional(readOnly = true)
  public long getUnreadCount(UUID memberId) {
    return notificationRepository.countUnreadByRecipientMemberId(memberId);
  }

  @Transactional
  public void markAsRead(UUID notificationId, UUID memberId) {
    var notification =
        notificationRepository
            .findById(notificationId)
            .filter(n -> n.getRecipientMemberId().equals(memberId))
            .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
    notification.markAsRead();
  }

  @Transactional
  public int markAllAsRead(UUID memberId) {
    return notificationRepository.markAllAsRead(memberId);
  }

  // --- Event handlers ---

  /** Tells the team lead that a justification is waiting for review. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Optional<Notification> handleAbsenceJustified(AbsenceJustifiedEvent event) {
    var leaderId = teamLeaderOf(event.teamId());
    if (leaderId.isEmpty()) {
      log.debug("No team lead to notify for justified absence={}", event.entityId());
      return Optional.empty();
    }
    var memberName = memberName(event.memberId());
    return Optional.of(
        enqueue(
            leaderId.get(),
            event.companyId(),
            "Absence justification to review",
            memberName + " explained their absence on " + event.absenceDate(),
            ABSENCE_JUSTIFIED,
            Map.of(
                "absenceId", event.entityId().toString(),
                "memberId", event.memberId().toString(),
                "absenceDate", event.absenceDate().toString())));
  }

  /** Tells the worker the verdict on their absence. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Notification handleAbsenceReviewed(AbsenceReviewedEvent event) {
    boolean excused = "EXCUSED".equals(event.verdict());
    return enqueue(
        event.memberId(),
        event.companyId(),
        excused ? "Absence excused" : "Absence not excused",
        "Your absence on "
            + event.absenceDate()
            + (excused ? " was excused" : " was marked unexcused"),
        ABSENCE_REVIEWED,
        Map.of(
            "absenceId", event.entityId().toString(),
            "absenceDate", event.absenceDate().toString(),
            "verdict", event.verdict()));
  }

  /** Tells the team lead a leave request is waiting. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Optional<Notification> handleExemptionRequested(ExemptionRequestedEvent event) {
    var leaderId = teamLeaderOf(event.teamId());
    if (leaderId.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        enqueue(
            leaderId.get(),
            event.companyId(),
            "Leave request to review",
            memberName(event.memberId())
                + " requested leave from "
                + event.startDate()
                + " to "
                + event.endDate(),
            EXEMPTION_REQUESTED,
            Map.of(
                "exemptionId", event.entityId().toString(),
                "memberId", event.memberId().toString())));
  }

  /** Tells the worker about a decision on their leave, unless they made it themselves. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Optional<Notification> handleExemptionDecided(ExemptionDecidedEvent event) {
    if (event.memberId().equals(event.actorMemberId())) {
      return Optional.empty();
    }
    return Optional.of(
        enqueue(
            event.memberId(),
            event.companyId(),
            "Leave request " + event.status().toLowerCase(Locale.ROOT),
            "Your leave request is now " + event.status(),
            EXEMPTION_DECIDED,
            Map.of(
                "exemptionId", event.entityId().toString(),
                "status", event.status(),
                "action", event.eventType())));
  }

  private Optional<UUID> teamLeaderOf(UUID teamId) {
    return teamRepository.findById(teamId).map(team -> team.getLeaderId());
  }

  private String memberName(UUID memberId) {
    return memberRepository.findById(memberId).map(Member::getName).orElse("A team member");
  }
}
