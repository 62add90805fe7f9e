package leaveflow.leaveflowbackend.service.escalation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import leaveflow.leaveflowbackend.config.LeaveNotificationProperties;
import leaveflow.leaveflowbackend.config.LeaveSchedulerProperties;
import leaveflow.leaveflowbackend.dto.response.EscalationRunResponseDto;
import leaveflow.leaveflowbackend.dto.response.SweepResult;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.entity.mysql.PriorityBadge;
import leaveflow.leaveflowbackend.enums.*;
import leaveflow.leaveflowbackend.repository.mysql.LeaveRequestRepository;
import leaveflow.leaveflowbackend.repository.mysql.PriorityBadgeRepository;
import leaveflow.leaveflowbackend.service.AuditService;
import leaveflow.leaveflowbackend.service.LeaveTransitionService;
import leaveflow.leaveflowbackend.service.NotificationMessage;
import leaveflow.leaveflowbackend.service.NotificationService;
import leaveflow.leaveflowbackend.service.OrgDirectoryService;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigProvider;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigSnapshot;
import leaveflow.leaveflowbackend.service.oracle.DecisionOracleClient;
import leaveflow.leaveflowbackend.service.oracle.OracleRecommendation;
import leaveflow.leaveflowbackend.service.oracle.OracleRequestFacts;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * HR 미응답 대응 스윕
 *  - 자격 부여: 일반 모드 대기 건이 hr_response_timeout_hours 동안 미열람 → 우선순위 설정 허용
 *  - 재평가: RED 배지 후 priority_escalation_timeout_hours 동안 미열람 → 오라클 재평가 (자동 승인 or 매니저)
 *  - HR 리마인더, 알림 정리
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriorityEscalationService {

    private final LeaveRequestRepository leaveRequestRepository;
    private final PriorityBadgeRepository priorityBadgeRepository;
    private final LeaveTransitionService transitionService;
    private final LeaveConfigProvider configProvider;
    private final DecisionOracleClient oracleClient;
    private final OrgDirectoryService orgDirectoryService;
    private final NotificationService notificationService;
    private final AuditService auditService;
    private final LeaveSchedulerProperties schedulerProperties;
    private final LeaveNotificationProperties notificationProperties;

    /**
     * 관리자 수동 실행: 자격 부여 후 재평가
     */
    public EscalationRunResponseDto runAll(LocalDateTime now) {
        SweepResult eligibility = runEligibilitySweep(now);
        SweepResult escalations = runEscalationSweep(now);
        return new EscalationRunResponseDto(eligibility, escalations);
    }

    /**
     * 우선순위 설정 자격 부여. 두 번 연속 실행해도 두 번째는 쓰기 없음
     */
    public SweepResult runEligibilitySweep(LocalDateTime now) {
        LeaveConfigSnapshot config = configProvider.current();
        LocalDateTime cutoff = now.minusHours(config.getHrResponseTimeoutHours());
        List<LeaveRequest> candidates = leaveRequestRepository.findPriorityEligibilityCandidates(
                LeaveRequestStatus.PENDING, LeaveMode.NORMAL, cutoff);

        SweepResult result = SweepResult.empty();
        result.setCandidateCount(candidates.size());

        for (LeaveRequest request : candidates) {
            try {
                boolean hasBadge = priorityBadgeRepository.findByRequestId(request.getRequestId())
                        .map(b -> b.getPriorityLevel().isSet())
                        .orElse(false);
                if (!PriorityRules.qualifiesForEligibility(request, hasBadge, config.getHrResponseTimeoutHours(), now)) {
                    result.incrementSkipped();
                    continue;
                }
                if (leaveRequestRepository.flipPriorityEligible(request.getRequestId(), now) == 0) {
                    result.incrementSkipped();
                    continue;
                }
                result.incrementUpdated();
                notificationService.dispatch(NotificationMessage.toEmployee(request.getEmployeeId(),
                                NotificationEvent.PRIORITY_ELIGIBLE, request.getRequestId())
                        .variable("requestId", request.getRequestId())
                        .variable("hours", String.valueOf(config.getHrResponseTimeoutHours()))
                        .build());
            } catch (Exception e) {
                result.incrementErrors();
                log.error("우선순위 자격 부여 실패: requestId={}", request.getRequestId(), e);
            }
        }
        return result;
    }

    /**
     * RED 배지 타임아웃 재평가. 오라클 호출은 트랜잭션 밖
     */
    public SweepResult runEscalationSweep(LocalDateTime now) {
        LeaveConfigSnapshot config = configProvider.current();
        int timeout = config.getPriorityEscalationTimeoutHours();
        List<LeaveRequest> candidates = leaveRequestRepository.findPriorityEscalationCandidates(
                PriorityLevel.RED, now.minusHours(timeout));

        SweepResult result = SweepResult.empty();
        result.setCandidateCount(candidates.size());

        for (LeaveRequest request : candidates) {
            try {
                escalateOne(request, config, now, result);
            } catch (Exception e) {
                result.incrementErrors();
                log.error("우선순위 에스컬레이션 처리 실패: requestId={}", request.getRequestId(), e);
            }
        }
        return result;
    }

    private void escalateOne(LeaveRequest request, LeaveConfigSnapshot config, LocalDateTime now, SweepResult result) {
        int timeout = config.getPriorityEscalationTimeoutHours();
        LocalDateTime badgeSetAt = priorityBadgeRepository.findByRequestId(request.getRequestId())
                .map(PriorityBadge::getBadgeSetAt)
                .orElse(null);
        if (!PriorityRules.qualifiesForEscalation(request, badgeSetAt, timeout, now)) {
            result.incrementSkipped();
            return;
        }

        // 1. 선점 (미해결 ORACLE 항목은 하나만)
        try {
            transitionService.claimOracleEscalation(request, timeout, now);
        } catch (DataIntegrityViolationException e) {
            log.debug("이미 다른 실행에서 에스컬레이션 중: requestId={}", request.getRequestId());
            result.incrementSkipped();
            return;
        }

        // 2. 오라클 재평가 (실패 시 폴백: 3일 이하 승인, 초과 에스컬레이션)
        OracleRecommendation recommendation = oracleClient.analyze(OracleRequestFacts.builder()
                .requestId(request.getRequestId())
                .employeeId(request.getEmployeeId())
                .leaveType(request.getLeaveType())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .totalDays(request.getTotalDays())
                .halfDay(request.getHalfDayType() != null && request.getHalfDayType().isHalfDay())
                .reason(request.getReason())
                .mode(request.getModeAtSubmission())
                .forceEscalationCheck(true)
                .build());

        // 3. 결과 반영
        if (recommendation.approvesAutomatically()) {
            TransitionResult applied = transitionService.autoApproveByEscalation(request.getRequestId(), recommendation, timeout, now);
            if (!applied.isApplied()) {
                result.incrementSkipped();
                return;
            }
            result.incrementAutoApproved();
            log.info("에스컬레이션 자동 승인: requestId={}, confidence={}, offline={}",
                    request.getRequestId(), recommendation.getConfidence(), recommendation.isOffline());
            auditService.record(request.getRequestId(), "ESCALATION_AUTO_APPROVED", LeaveRequestStatus.PENDING,
                    LeaveRequestStatus.APPROVED, LeaveTransitionService.SYSTEM_ESCALATION, recommendation.getReasonText());
            notificationService.dispatch(NotificationMessage.toEmployee(request.getEmployeeId(),
                            NotificationEvent.ESCALATION_AUTO_APPROVED, request.getRequestId())
                    .variable("requestId", request.getRequestId())
                    .variable("confidence", String.valueOf(recommendation.getConfidence()))
                    .build());
            return;
        }

        Optional<String> manager = orgDirectoryService.managerOf(request.getEmployeeId());
        boolean escalated = transitionService.escalateToManager(request.getRequestId(), manager.orElse(null), recommendation, timeout, now);
        if (!escalated) {
            result.incrementSkipped();
            return;
        }
        result.incrementEscalated();
        log.info("매니저 에스컬레이션: requestId={}, manager={}, recommendation={}",
                request.getRequestId(), manager.orElse("-"), recommendation.getRecommendation());

        NotificationMessage.NotificationMessageBuilder message = manager
                .map(id -> NotificationMessage.toEmployee(id, NotificationEvent.ESCALATION_TO_MANAGER, request.getRequestId()))
                .orElseGet(() -> NotificationMessage.toRole(Role.HR, NotificationEvent.ESCALATION_TO_MANAGER, request.getRequestId()));
        notificationService.dispatch(message
                .priority("urgent")
                .variable("employeeId", request.getEmployeeId())
                .variable("requestId", request.getRequestId())
                .variable("recommendation", recommendation.getRecommendation().getValue())
                .build());
    }

    /**
     * 우선순위가 설정된 미열람 건을 HR 에 한 번에 알린다
     */
    public int sendHrReminders(LocalDateTime now) {
        List<LeaveRequest> pending = leaveRequestRepository.findUnviewedWithBadge(
                EnumSet.of(PriorityLevel.YELLOW, PriorityLevel.RED),
                LeaveRequestStatus.DECIDABLE,
                PageRequest.of(0, schedulerProperties.getReminderBatchSize()));
        if (pending.isEmpty()) {
            return 0;
        }

        String items = pending.stream()
                .map(r -> "- " + r.getRequestId() + " (" + r.getEmployeeId() + ", " + r.getLeaveType().getCode()
                        + ", " + r.getTotalDays() + "일)")
                .collect(Collectors.joining("\n"));
        notificationService.dispatch(NotificationMessage.toRole(Role.HR, NotificationEvent.HR_REMINDER, null)
                .priority("high")
                .variable("count", String.valueOf(pending.size()))
                .variable("items", items)
                .build());
        log.info("HR 리마인더 발송: {}건 (at {})", pending.size(), now);
        return pending.size();
    }

    public int cleanupNotifications(LocalDateTime now) {
        int deleted = notificationService.purgeReadOlderThan(now.minusDays(notificationProperties.getRetentionDays()));
        log.info("읽은 알림 정리: {}건 삭제", deleted);
        return deleted;
    }
}
