package leaveflow.leaveflowbackend.service.approval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import leaveflow.leaveflowbackend.dto.response.LeaveRequestResponseDto;
import leaveflow.leaveflowbackend.dto.response.SweepResult;
import leaveflow.leaveflowbackend.dto.response.TransitionResponseDto;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;
import leaveflow.leaveflowbackend.enums.NotificationEvent;
import leaveflow.leaveflowbackend.enums.Role;
import leaveflow.leaveflowbackend.enums.TransitionResult;
import leaveflow.leaveflowbackend.repository.mysql.LeaveRequestRepository;
import leaveflow.leaveflowbackend.service.*;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigProvider;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigSnapshot;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 다단계 결재 (매니저 → 매니저의 매니저 → HR 파트너) 진행과 SLA 에스컬레이션
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalChainService {

    private final LeaveRequestRepository leaveRequestRepository;
    private final LeaveRequestService leaveRequestService;
    private final LeaveTransitionService transitionService;
    private final ApprovalChainPlanner planner;
    private final LeaveConfigProvider configProvider;
    private final OrgDirectoryService orgDirectoryService;
    private final AuditService auditService;
    private final NotificationService notificationService;

    /**
     * 현재 단계 승인. 다음 PENDING 단계가 있으면 넘기고, 없으면 최종 승인
     */
    public TransitionResponseDto approve(String requestId, String actorId, String comment) {
        LeaveRequest request = leaveRequestService.getEntity(requestId);
        if (actorId.equals(request.getEmployeeId())) {
            throw new AccessDeniedException("본인 신청은 결재할 수 없습니다.");
        }
        if (!request.usesApprovalChain()) {
            throw new IllegalStateException("결재 단계가 없는 신청입니다: " + requestId);
        }
        if (!actorId.equals(request.getCurrentApprover()) && !orgDirectoryService.isHrOrAdmin(actorId)) {
            throw new AccessDeniedException("현재 결재자만 승인할 수 있습니다.");
        }
        if (request.getStatus() != LeaveRequestStatus.PENDING) {
            // 이미 다른 쪽에서 끝난 건
            if (request.getStatus().isTerminal()) {
                return TransitionResponseDto.of(requestId, TransitionResult.ALREADY_HANDLED, request.getStatus());
            }
            throw new IllegalStateException("결재 진행 중인 신청이 아닙니다: " + request.getStatus());
        }

        LocalDateTime now = LocalDateTime.now();
        int level = request.getCurrentLevel();
        Optional<ChainStep> next = planner.nextPendingLevel(request, level);

        if (next.isPresent()) {
            LeaveConfigSnapshot config = configProvider.current();
            LocalDateTime deadline = ApprovalChainPlanner.deadline(now, config.getApprovalSlaHours());
            TransitionResult result = transitionService.advanceChainLevel(requestId, level, next.get().getLevel(),
                    next.get().getApprover(), actorId, comment, deadline, now);
            LeaveRequest after = leaveRequestService.getEntity(requestId);
            if (result.isApplied()) {
                log.info("결재 단계 진행: requestId={}, {} → {}단계({})", requestId, level,
                        next.get().getLevel(), next.get().getApprover());
                auditService.record(requestId, "LEVEL" + level + "_APPROVED", LeaveRequestStatus.PENDING,
                        LeaveRequestStatus.PENDING, actorId, comment);
                notificationService.dispatch(NotificationMessage.toEmployee(next.get().getApprover(),
                                NotificationEvent.APPROVAL_PENDING, requestId)
                        .variables(LeaveRequestService.leaveVariables(after))
                        .variable("level", String.valueOf(next.get().getLevel()))
                        .variable("deadline", String.valueOf(deadline))
                        .build());
            }
            return TransitionResponseDto.of(requestId, result, after.getStatus());
        }

        TransitionResult result = transitionService.completeChain(requestId, level, actorId, comment, now);
        LeaveRequest after = leaveRequestService.getEntity(requestId);
        if (result.isApplied()) {
            log.info("결재 완료 (최종 승인): requestId={}, lastLevel={}, actor={}", requestId, level, actorId);
            auditService.record(requestId, "APPROVED", LeaveRequestStatus.PENDING, LeaveRequestStatus.APPROVED, actorId, comment);
            notificationService.dispatch(NotificationMessage.toEmployee(after.getEmployeeId(),
                            NotificationEvent.LEAVE_APPROVED, requestId)
                    .variables(LeaveRequestService.leaveVariables(after))
                    .variable("actor", actorId)
                    .variable("comment", comment)
                    .build());
        }
        return TransitionResponseDto.of(requestId, result, after.getStatus());
    }

    /**
     * 어느 단계에서든 반려하면 신청 전체가 반려된다
     */
    public TransitionResponseDto reject(String requestId, String actorId, String comment) {
        return leaveRequestService.decide(requestId, actorId, false, comment);
    }

    @Transactional(readOnly = true)
    public Page<LeaveRequestResponseDto> getPendingForApprover(String approverId, Pageable pageable) {
        return leaveRequestRepository.findByCurrentApproverAndStatus(approverId, LeaveRequestStatus.PENDING, pageable)
                .map(r -> LeaveRequestResponseDto.fromEntity(r, null));
    }

    /**
     * 기한이 지난 결재 단계를 다음 결재자에게 넘긴다. 더 올릴 곳이 없으면 인사팀에 한 번 알린다
     */
    public SweepResult runSlaSweep(LocalDateTime now) {
        LeaveConfigSnapshot config = configProvider.current();
        List<LeaveRequest> breached = leaveRequestRepository.findSlaBreached(now);

        SweepResult result = SweepResult.empty();
        result.setCandidateCount(breached.size());

        for (LeaveRequest request : breached) {
            try {
                Optional<ChainStep> step = planner.nextSlaStep(request);
                if (step.isPresent()) {
                    LocalDateTime deadline = ApprovalChainPlanner.deadline(now, config.getApprovalSlaEscalatedHours());
                    TransitionResult applied = transitionService.slaEscalate(request, step.get().getLevel(),
                            step.get().getApprover(), deadline, now);
                    if (!applied.isApplied()) {
                        result.incrementSkipped();
                        continue;
                    }
                    result.incrementEscalated();
                    log.warn("결재 기한 초과 에스컬레이션: requestId={}, {}({}) → {}단계({})", request.getRequestId(),
                            request.getCurrentLevel(), request.getCurrentApprover(), step.get().getLevel(), step.get().getApprover());
                    auditService.record(request.getRequestId(), "SLA_ESCALATED", request.getStatus(), request.getStatus(),
                            LeaveTransitionService.SYSTEM_ESCALATION, "level " + request.getCurrentLevel() + " → " + step.get().getLevel());
                    notificationService.dispatch(NotificationMessage.toEmployee(step.get().getApprover(),
                                    NotificationEvent.SLA_ESCALATED, request.getRequestId())
                            .priority("high")
                            .variable("requestId", request.getRequestId())
                            .variable("fromApprover", String.valueOf(request.getCurrentApprover()))
                            .variable("level", String.valueOf(step.get().getLevel()))
                            .variable("deadline", String.valueOf(deadline))
                            .build());
                } else {
                    if (!transitionService.markSlaExhausted(request, now)) {
                        result.incrementSkipped();
                        continue;
                    }
                    result.incrementUpdated();
                    log.warn("결재 기한 초과, 더 올릴 결재자 없음: requestId={}, level={}",
                            request.getRequestId(), request.getCurrentLevel());
                    notificationService.dispatch(NotificationMessage.toRole(Role.HR, NotificationEvent.SLA_EXHAUSTED, request.getRequestId())
                            .priority("urgent")
                            .variable("requestId", request.getRequestId())
                            .build());
                }
            } catch (Exception e) {
                result.incrementErrors();
                log.error("SLA 에스컬레이션 실패: requestId={}", request.getRequestId(), e);
            }
        }
        return result;
    }
}
