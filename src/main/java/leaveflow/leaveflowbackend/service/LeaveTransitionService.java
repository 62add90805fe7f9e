package leaveflow.leaveflowbackend.service;

import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.entity.mysql.escalation.EscalationHistory;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;
import leaveflow.leaveflowbackend.enums.PriorityLevel;
import leaveflow.leaveflowbackend.enums.TransitionResult;
import leaveflow.leaveflowbackend.enums.approval.EscalationKind;
import leaveflow.leaveflowbackend.enums.approval.EscalationTrigger;
import leaveflow.leaveflowbackend.enums.approval.LevelStatus;
import leaveflow.leaveflowbackend.enums.approval.ResolutionAction;
import leaveflow.leaveflowbackend.repository.mysql.LeaveRequestRepository;
import leaveflow.leaveflowbackend.repository.mysql.escalation.EscalationHistoryRepository;
import leaveflow.leaveflowbackend.service.oracle.OracleRecommendation;

import java.time.LocalDateTime;
import java.util.EnumSet;

/**
 * 휴가 신청 상태를 바꾸는 트랜잭션 단위 모음.
 * 모든 상태 변경은 조건부 UPDATE 로 하고, 영향 행 0 이면 ALREADY_HANDLED 를 돌려준다.
 * 외부 호출(오라클, 알림)은 여기서 하지 않는다
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaveTransitionService {

    public static final String SYSTEM_ESCALATION = "SYSTEM_ESCALATION";
    public static final String SYSTEM = "SYSTEM";

    private final LeaveRequestRepository leaveRequestRepository;
    private final EscalationHistoryRepository escalationHistoryRepository;
    private final LeaveBalanceService leaveBalanceService;

    /**
     * 신규 신청 저장. 승인 상태로 들어오면 같은 트랜잭션에서 원장 차감
     */
    @Transactional
    public LeaveRequest persistSubmission(LeaveRequest request) {
        leaveRequestRepository.saveAndFlush(request);
        if (request.getStatus() == LeaveRequestStatus.APPROVED) {
            bookIfNeeded(request.getRequestId());
        }
        return load(request.getRequestId());
    }

    /**
     * 사람(HR, 결재자)의 승인/반려. PENDING, PENDING_HR 에서만 가능
     */
    @Transactional
    public TransitionResult decide(String requestId, LeaveRequestStatus target, String actor,
                                   String comment, LocalDateTime now) {
        if (target != LeaveRequestStatus.APPROVED && target != LeaveRequestStatus.REJECTED) {
            throw new IllegalArgumentException("승인 또는 반려만 가능합니다: " + target);
        }

        int updated = leaveRequestRepository.transitionDecision(
                requestId, LeaveRequestStatus.DECIDABLE, target, actor, now, comment);
        if (updated == 0) {
            return TransitionResult.ALREADY_HANDLED;
        }

        // 사람이 결정했다면 본 것으로 간주
        leaveRequestRepository.markViewed(requestId, now);
        escalationHistoryRepository.resolveOpen(requestId, actor,
                target == LeaveRequestStatus.APPROVED ? ResolutionAction.APPROVED : ResolutionAction.REJECTED, now);
        if (target == LeaveRequestStatus.APPROVED) {
            bookIfNeeded(requestId);
        }

        LeaveRequest request = load(requestId);
        if (request.usesApprovalChain() && request.getLevelStatus(request.getCurrentLevel()) == LevelStatus.PENDING) {
            stampLevel(request, request.getCurrentLevel(),
                    target == LeaveRequestStatus.APPROVED ? LevelStatus.APPROVED : LevelStatus.REJECTED, comment, now);
        }
        request.appendNote(now, (target == LeaveRequestStatus.APPROVED ? "승인" : "반려") + " by " + actor
                + (comment != null && !comment.isBlank() ? " (" + comment + ")" : ""));
        return TransitionResult.APPLIED;
    }

    /**
     * 본인 취소. 승인 건이면 원장 복원
     */
    @Transactional
    public TransitionResult cancel(String requestId, String actor, LocalDateTime now) {
        int updated = leaveRequestRepository.transitionCancelled(
                requestId, LeaveStateMachine.sourcesOf(LeaveRequestStatus.CANCELLED), now);
        if (updated == 0) {
            return TransitionResult.ALREADY_HANDLED;
        }

        escalationHistoryRepository.resolveOpen(requestId, actor, ResolutionAction.CANCELLED, now);
        if (leaveRequestRepository.releaseBalance(requestId) == 1) {
            LeaveRequest request = load(requestId);
            leaveBalanceService.reverse(request.getEmployeeId(), request.getLeaveType(), request.getTotalDays(),
                    requestId, request.getStartDate().getYear());
        }

        LeaveRequest request = load(requestId);
        request.appendNote(now, "취소 by " + actor);
        return TransitionResult.APPLIED;
    }

    @Transactional
    public boolean markViewed(String requestId, LocalDateTime now) {
        return leaveRequestRepository.markViewed(requestId, now) == 1;
    }

    // ------------------------------------------------------------------
    // 우선순위 에스컬레이션
    // ------------------------------------------------------------------

    /**
     * 오라클 재평가 에스컬레이션 선점. 미해결 ORACLE 항목이 이미 있으면
     * unique(open_guard) 위반으로 DataIntegrityViolationException
     */
    @Transactional
    public EscalationHistory claimOracleEscalation(LeaveRequest request, int timeoutHours, LocalDateTime now) {
        EscalationHistory entry = new EscalationHistory();
        entry.setRequestId(request.getRequestId());
        entry.setEscalationKind(EscalationKind.PRIORITY_TIMEOUT);
        entry.setEscalationLevel(request.getEscalationCount() + 1);
        entry.setEscalatedFrom(EscalationHistory.ACTOR_SYSTEM);
        entry.setEscalatedTo(EscalationHistory.TARGET_ORACLE);
        entry.setEscalationReason("HR이 " + timeoutHours + "시간 내 RED 우선순위 신청에 응답하지 않아 재평가");
        entry.setTriggeredBy(EscalationTrigger.TIMEOUT);
        entry.setPriorityLevel(PriorityLevel.RED);
        entry.setOpenGuard(EscalationHistory.guardKey(request.getRequestId(), EscalationHistory.TARGET_ORACLE));
        return escalationHistoryRepository.saveAndFlush(entry);
    }

    /**
     * 오라클 재평가 결과 자동 승인. 사람이 먼저 처리했으면 ALREADY_HANDLED
     */
    @Transactional
    public TransitionResult autoApproveByEscalation(String requestId, OracleRecommendation recommendation,
                                                    int timeoutHours, LocalDateTime now) {
        String comment = "RED 우선순위 " + timeoutHours + "시간 미응답 후 자동 승인";
        int updated = leaveRequestRepository.transitionDecision(
                requestId, EnumSet.of(LeaveRequestStatus.PENDING),
                LeaveRequestStatus.APPROVED, SYSTEM_ESCALATION, now, comment);
        if (updated == 0) {
            return TransitionResult.ALREADY_HANDLED;
        }

        bookIfNeeded(requestId);
        escalationHistoryRepository.resolveOpen(requestId, EscalationHistory.TARGET_ORACLE, ResolutionAction.APPROVED, now);

        LeaveRequest request = load(requestId);
        request.appendNote(now, comment + ". confidence=" + recommendation.getConfidence()
                + (recommendation.isOffline() ? " [oracle-offline]" : ""));
        return TransitionResult.APPLIED;
    }

    /**
     * 오라클이 자동 승인하지 않은 경우 매니저에게 넘긴다. 상태는 그대로
     */
    @Transactional
    public boolean escalateToManager(String requestId, String managerId, OracleRecommendation recommendation,
                                     int timeoutHours, LocalDateTime now) {
        LeaveRequest request = load(requestId);
        if (request.getStatus() != LeaveRequestStatus.PENDING) {
            return false;
        }

        EscalationHistory entry = new EscalationHistory();
        entry.setRequestId(requestId);
        entry.setEscalationKind(EscalationKind.PRIORITY_TIMEOUT);
        entry.setEscalationLevel(request.getEscalationCount() + 2);
        entry.setEscalatedFrom(EscalationHistory.TARGET_ORACLE);
        entry.setEscalatedTo(EscalationHistory.TARGET_MANAGER);
        entry.setEscalationReason("재평가 결과 " + recommendation.getRecommendation().getValue()
                + ", 매니저(" + (managerId != null ? managerId : "미지정, HR") + ") 확인 필요");
        entry.setTriggeredBy(EscalationTrigger.POLICY);
        entry.setPriorityLevel(PriorityLevel.RED);
        entry.setOpenGuard(EscalationHistory.guardKey(requestId, EscalationHistory.TARGET_MANAGER));
        escalationHistoryRepository.save(entry);

        request.setEscalationCount(request.getEscalationCount() + 1);
        request.setLastEscalationAt(now);
        request.appendNote(now, "HR " + timeoutHours + "시간 미응답으로 매니저 에스컬레이션. recommendation="
                + recommendation.getRecommendation().getValue()
                + (recommendation.isOffline() ? " [oracle-offline]" : ""));
        return true;
    }

    // ------------------------------------------------------------------
    // 다단계 결재
    // ------------------------------------------------------------------

    /**
     * 현재 단계 승인 후 다음 단계로 진행
     */
    @Transactional
    public TransitionResult advanceChainLevel(String requestId, int fromLevel, int nextLevel, String nextApprover,
                                              String actor, String comment, LocalDateTime deadline, LocalDateTime now) {
        int updated = leaveRequestRepository.advanceLevel(requestId, fromLevel, nextLevel, nextApprover, deadline);
        if (updated == 0) {
            return TransitionResult.ALREADY_HANDLED;
        }
        leaveRequestRepository.markViewed(requestId, now);

        LeaveRequest request = load(requestId);
        stampLevel(request, fromLevel, LevelStatus.APPROVED, comment, now);
        request.appendNote(now, fromLevel + "단계 승인 by " + actor + ", " + nextLevel + "단계(" + nextApprover + ")로 진행");
        return TransitionResult.APPLIED;
    }

    /**
     * 마지막 단계 승인 → 최종 승인. 단계가 그 사이에 바뀌었으면 ALREADY_HANDLED
     */
    @Transactional
    public TransitionResult completeChain(String requestId, int level, String actor, String comment, LocalDateTime now) {
        LeaveRequest request = load(requestId);
        // 같은 단계로 advance → 행 잠금 + 단계 확인
        int claimed = leaveRequestRepository.advanceLevel(requestId, level, level,
                request.getCurrentApprover(), request.getSlaDeadline());
        if (claimed == 0) {
            return TransitionResult.ALREADY_HANDLED;
        }
        return decide(requestId, LeaveRequestStatus.APPROVED, actor, comment, now);
    }

    /**
     * SLA 초과로 다음 결재자에게 넘김
     */
    @Transactional
    public TransitionResult slaEscalate(LeaveRequest snapshot, int nextLevel, String nextApprover,
                                        LocalDateTime deadline, LocalDateTime now) {
        int fromLevel = snapshot.getCurrentLevel();
        int updated = leaveRequestRepository.slaEscalate(snapshot.getRequestId(), fromLevel, snapshot.getSlaDeadline(),
                nextLevel, nextApprover, deadline, now);
        if (updated == 0) {
            return TransitionResult.ALREADY_HANDLED;
        }

        LeaveRequest request = load(snapshot.getRequestId());
        stampLevel(request, fromLevel, LevelStatus.ESCALATED, "결재 기한 초과 (" + snapshot.getSlaDeadline() + ")", now);
        // 건너뛴 단계는 PENDING 으로
        if (request.getLevelStatus(nextLevel) != LevelStatus.PENDING || request.getLevelApprover(nextLevel) == null) {
            request.setLevel(nextLevel, nextApprover, LevelStatus.PENDING);
        }
        request.appendNote(now, fromLevel + "단계 결재 기한 초과 (" + snapshot.getCurrentApprover() + "), "
                + nextLevel + "단계(" + nextApprover + ")로 에스컬레이션");

        EscalationHistory entry = new EscalationHistory();
        entry.setRequestId(request.getRequestId());
        entry.setEscalationKind(EscalationKind.SLA_BREACH);
        entry.setEscalationLevel(nextLevel);
        entry.setEscalatedFrom(snapshot.getCurrentApprover() != null ? snapshot.getCurrentApprover() : "LEVEL" + fromLevel);
        entry.setEscalatedTo(nextApprover);
        entry.setEscalationReason(fromLevel + "단계 결재 기한(" + snapshot.getSlaDeadline() + ") 초과");
        entry.setTriggeredBy(EscalationTrigger.SLA);
        entry.setOpenGuard(EscalationHistory.guardKey(request.getRequestId(), "SLA-L" + nextLevel));
        escalationHistoryRepository.save(entry);
        return TransitionResult.APPLIED;
    }

    @Transactional
    public boolean markSlaExhausted(LeaveRequest snapshot, LocalDateTime now) {
        int updated = leaveRequestRepository.markSlaExhausted(
                snapshot.getRequestId(), snapshot.getCurrentLevel(), snapshot.getSlaDeadline());
        if (updated == 0) {
            return false;
        }
        LeaveRequest request = load(snapshot.getRequestId());
        request.appendNote(now, snapshot.getCurrentLevel() + "단계 결재 기한 초과, 더 이상 에스컬레이션할 결재자 없음");
        return true;
    }

    // ------------------------------------------------------------------

    /**
     * balanceBooked 가드를 넘긴 경우에만 차감. 승인 1건당 정확히 1번
     */
    private void bookIfNeeded(String requestId) {
        if (leaveRequestRepository.markBalanceBooked(requestId) == 1) {
            LeaveRequest request = load(requestId);
            leaveBalanceService.book(request.getEmployeeId(), request.getLeaveType(), request.getTotalDays(),
                    requestId, request.getStartDate().getYear());
        }
    }

    private void stampLevel(LeaveRequest request, int level, LevelStatus status, String comment, LocalDateTime now) {
        request.setLevel(level, request.getLevelApprover(level), status);
        switch (level) {
            case 1 -> {
                request.setLevel1ActionAt(now);
                request.setLevel1Comments(comment);
            }
            case 2 -> {
                request.setLevel2ActionAt(now);
                request.setLevel2Comments(comment);
            }
            case 3 -> {
                request.setLevel3ActionAt(now);
                request.setLevel3Comments(comment);
            }
            default -> throw new IllegalArgumentException("Unknown approval level: " + level);
        }
    }

    private LeaveRequest load(String requestId) {
        return leaveRequestRepository.findById(requestId)
                .orElseThrow(() -> new EntityNotFoundException("휴가 신청을 찾을 수 없습니다: " + requestId));
    }
}
