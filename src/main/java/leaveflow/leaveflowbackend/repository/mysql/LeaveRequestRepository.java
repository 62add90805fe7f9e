package leaveflow.leaveflowbackend.repository.mysql;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.enums.LeaveMode;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;
import leaveflow.leaveflowbackend.enums.PriorityLevel;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 상태 변경은 전부 조건부 UPDATE 로 처리한다. 반환값 0 = 다른 쪽이 먼저 처리함
 */
@Repository
public interface LeaveRequestRepository extends JpaRepository<LeaveRequest, String> {

    Page<LeaveRequest> findByEmployeeId(String employeeId, Pageable pageable);

    Page<LeaveRequest> findByCurrentApproverAndStatus(String currentApprover, LeaveRequestStatus status, Pageable pageable);

    // ---------------------------------------------------------------
    // 상태 전이 (조건부)
    // ---------------------------------------------------------------

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeaveRequest r SET r.status = :to, r.decidedBy = :actor, r.decidedAt = :now, " +
            "r.decisionComment = :comment, r.version = r.version + 1 " +
            "WHERE r.requestId = :requestId AND r.status IN :from")
    int transitionDecision(@Param("requestId") String requestId,
                           @Param("from") Collection<LeaveRequestStatus> from,
                           @Param("to") LeaveRequestStatus to,
                           @Param("actor") String actor,
                           @Param("now") LocalDateTime now,
                           @Param("comment") String comment);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeaveRequest r SET r.status = leaveflow.leaveflowbackend.enums.LeaveRequestStatus.CANCELLED, " +
            "r.cancelledAt = :now, r.version = r.version + 1 " +
            "WHERE r.requestId = :requestId AND r.status IN :from")
    int transitionCancelled(@Param("requestId") String requestId,
                            @Param("from") Collection<LeaveRequestStatus> from,
                            @Param("now") LocalDateTime now);

    // hrViewedAt 은 null → 값 한 번만
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeaveRequest r SET r.hrViewedAt = :now, r.version = r.version + 1 " +
            "WHERE r.requestId = :requestId AND r.hrViewedAt IS NULL")
    int markViewed(@Param("requestId") String requestId, @Param("now") LocalDateTime now);

    // ---------------------------------------------------------------
    // 원장 가드
    // ---------------------------------------------------------------

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeaveRequest r SET r.balanceBooked = true, r.version = r.version + 1 " +
            "WHERE r.requestId = :requestId AND r.balanceBooked = false " +
            "AND r.status = leaveflow.leaveflowbackend.enums.LeaveRequestStatus.APPROVED")
    int markBalanceBooked(@Param("requestId") String requestId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeaveRequest r SET r.balanceBooked = false, r.version = r.version + 1 " +
            "WHERE r.requestId = :requestId AND r.balanceBooked = true")
    int releaseBalance(@Param("requestId") String requestId);

    // ---------------------------------------------------------------
    // 우선순위 자격 / 에스컬레이션
    // ---------------------------------------------------------------

    @Query("SELECT r FROM LeaveRequest r WHERE r.status = :status AND r.modeAtSubmission = :mode " +
            "AND r.hrViewedAt IS NULL AND r.canSetPriority = false AND r.priorityEligibleAt IS NULL " +
            "AND r.submittedAt <= :cutoff " +
            "AND NOT EXISTS (SELECT b.id FROM PriorityBadge b WHERE b.requestId = r.requestId " +
            "AND b.priorityLevel <> leaveflow.leaveflowbackend.enums.PriorityLevel.NONE) " +
            "ORDER BY r.submittedAt ASC")
    List<LeaveRequest> findPriorityEligibilityCandidates(@Param("status") LeaveRequestStatus status,
                                                         @Param("mode") LeaveMode mode,
                                                         @Param("cutoff") LocalDateTime cutoff);

    // canSetPriority 는 false → true 한 번만, 이후 재활성화 없음
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeaveRequest r SET r.canSetPriority = true, r.priorityEligibleAt = :now, r.version = r.version + 1 " +
            "WHERE r.requestId = :requestId " +
            "AND r.status = leaveflow.leaveflowbackend.enums.LeaveRequestStatus.PENDING " +
            "AND r.canSetPriority = false AND r.priorityEligibleAt IS NULL AND r.hrViewedAt IS NULL")
    int flipPriorityEligible(@Param("requestId") String requestId, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeaveRequest r SET r.canSetPriority = false, r.version = r.version + 1 " +
            "WHERE r.requestId = :requestId AND r.canSetPriority = true")
    int consumePriorityFlag(@Param("requestId") String requestId);

    @Query("SELECT r FROM LeaveRequest r, PriorityBadge b WHERE b.requestId = r.requestId " +
            "AND b.priorityLevel = :level " +
            "AND r.status = leaveflow.leaveflowbackend.enums.LeaveRequestStatus.PENDING " +
            "AND r.hrViewedAt IS NULL AND b.badgeSetAt <= :cutoff " +
            "AND NOT EXISTS (SELECT e.id FROM EscalationHistory e WHERE e.requestId = r.requestId " +
            "AND e.escalatedTo = 'ORACLE' AND e.resolved = false) " +
            "ORDER BY b.badgeSetAt ASC")
    List<LeaveRequest> findPriorityEscalationCandidates(@Param("level") PriorityLevel level,
                                                        @Param("cutoff") LocalDateTime cutoff);

    @Query("SELECT r FROM LeaveRequest r, PriorityBadge b WHERE b.requestId = r.requestId " +
            "AND b.priorityLevel IN :levels " +
            "AND r.status IN :statuses AND r.hrViewedAt IS NULL " +
            "ORDER BY b.badgeSetAt ASC")
    List<LeaveRequest> findUnviewedWithBadge(@Param("levels") Collection<PriorityLevel> levels,
                                             @Param("statuses") Collection<LeaveRequestStatus> statuses,
                                             Pageable pageable);

    // HR 대기 목록: RED → YELLOW → 없음 → 오래된 순
    @Query("SELECT r FROM LeaveRequest r LEFT JOIN PriorityBadge b ON b.requestId = r.requestId " +
            "WHERE r.status IN :statuses " +
            "ORDER BY CASE WHEN b.priorityLevel = leaveflow.leaveflowbackend.enums.PriorityLevel.RED THEN 1 " +
            "WHEN b.priorityLevel = leaveflow.leaveflowbackend.enums.PriorityLevel.YELLOW THEN 2 ELSE 3 END, " +
            "r.submittedAt ASC")
    List<LeaveRequest> findHrQueue(@Param("statuses") Collection<LeaveRequestStatus> statuses, Pageable pageable);

    // ---------------------------------------------------------------
    // 다단계 결재 / SLA
    // ---------------------------------------------------------------

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeaveRequest r SET r.currentLevel = :nextLevel, r.currentApprover = :nextApprover, " +
            "r.slaDeadline = :deadline, r.version = r.version + 1 " +
            "WHERE r.requestId = :requestId AND r.currentLevel = :expectedLevel " +
            "AND r.status = leaveflow.leaveflowbackend.enums.LeaveRequestStatus.PENDING")
    int advanceLevel(@Param("requestId") String requestId,
                     @Param("expectedLevel") Integer expectedLevel,
                     @Param("nextLevel") Integer nextLevel,
                     @Param("nextApprover") String nextApprover,
                     @Param("deadline") LocalDateTime deadline);

    @Query("SELECT r FROM LeaveRequest r " +
            "WHERE r.status = leaveflow.leaveflowbackend.enums.LeaveRequestStatus.PENDING " +
            "AND r.currentLevel IS NOT NULL AND r.slaDeadline < :now AND r.slaExhausted = false " +
            "ORDER BY r.slaDeadline ASC")
    List<LeaveRequest> findSlaBreached(@Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeaveRequest r SET r.currentLevel = :nextLevel, r.currentApprover = :nextApprover, " +
            "r.slaDeadline = :deadline, r.slaBreachCount = r.slaBreachCount + 1, " +
            "r.escalationCount = r.escalationCount + 1, r.lastEscalationAt = :now, r.version = r.version + 1 " +
            "WHERE r.requestId = :requestId AND r.currentLevel = :expectedLevel " +
            "AND r.slaDeadline = :expectedDeadline AND r.slaExhausted = false " +
            "AND r.status = leaveflow.leaveflowbackend.enums.LeaveRequestStatus.PENDING")
    int slaEscalate(@Param("requestId") String requestId,
                    @Param("expectedLevel") Integer expectedLevel,
                    @Param("expectedDeadline") LocalDateTime expectedDeadline,
                    @Param("nextLevel") Integer nextLevel,
                    @Param("nextApprover") String nextApprover,
                    @Param("deadline") LocalDateTime deadline,
                    @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeaveRequest r SET r.slaExhausted = true, r.slaBreachCount = r.slaBreachCount + 1, " +
            "r.version = r.version + 1 " +
            "WHERE r.requestId = :requestId AND r.currentLevel = :expectedLevel " +
            "AND r.slaDeadline = :expectedDeadline AND r.slaExhausted = false " +
            "AND r.status = leaveflow.leaveflowbackend.enums.LeaveRequestStatus.PENDING")
    int markSlaExhausted(@Param("requestId") String requestId,
                         @Param("expectedLevel") Integer expectedLevel,
                         @Param("expectedDeadline") LocalDateTime expectedDeadline);
}
