package leaveflow.leaveflowbackend.service;

import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import leaveflow.leaveflowbackend.dto.request.LeaveSubmitRequestDto;
import leaveflow.leaveflowbackend.dto.response.AuditEntryResponseDto;
import leaveflow.leaveflowbackend.dto.response.EscalationHistoryResponseDto;
import leaveflow.leaveflowbackend.dto.response.LeaveRequestResponseDto;
import leaveflow.leaveflowbackend.dto.response.TransitionResponseDto;
import leaveflow.leaveflowbackend.entity.mysql.EmployeeEntity;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.entity.mysql.PriorityBadge;
import leaveflow.leaveflowbackend.enums.*;
import leaveflow.leaveflowbackend.repository.mysql.LeaveRequestRepository;
import leaveflow.leaveflowbackend.repository.mysql.PriorityBadgeRepository;
import leaveflow.leaveflowbackend.repository.mysql.escalation.EscalationHistoryRepository;
import leaveflow.leaveflowbackend.service.approval.ApprovalChainPlanner;
import leaveflow.leaveflowbackend.service.mode.InitialDisposition;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigProvider;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigSnapshot;
import leaveflow.leaveflowbackend.service.mode.ModePolicy;
import leaveflow.leaveflowbackend.service.oracle.DecisionOracleClient;
import leaveflow.leaveflowbackend.service.oracle.OracleRecommendation;
import leaveflow.leaveflowbackend.service.oracle.OracleRequestFacts;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 휴가 신청 생명주기 (제출, 결정, 취소, 열람 표시, 조회).
 * 오라클 호출은 트랜잭션 밖에서 하고 상태 변경은 LeaveTransitionService 에 맡긴다
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaveRequestService {

    static final int MAX_REASON_LENGTH = 1000;

    private final LeaveRequestRepository leaveRequestRepository;
    private final PriorityBadgeRepository priorityBadgeRepository;
    private final EscalationHistoryRepository escalationHistoryRepository;
    private final LeaveTransitionService transitionService;
    private final LeaveConfigProvider configProvider;
    private final DecisionOracleClient oracleClient;
    private final OrgDirectoryService orgDirectoryService;
    private final ApprovalChainPlanner approvalChainPlanner;
    private final AuditService auditService;
    private final NotificationService notificationService;

    // ------------------------------------------------------------------
    // 제출
    // ------------------------------------------------------------------

    public LeaveRequestResponseDto submit(String employeeId, LeaveSubmitRequestDto dto) {
        LocalDateTime now = LocalDateTime.now();

        // 1. 검증 (실패 시 아무것도 저장하지 않음)
        EmployeeEntity employee = orgDirectoryService.getActiveEmployee(employeeId);
        LeaveType leaveType = LeaveType.fromCode(dto.getLeaveType());
        HalfDayType halfDayType = dto.getHalfDayType() != null ? dto.getHalfDayType() : HalfDayType.ALL_DAY;
        validateDates(dto.getStartDate(), dto.getEndDate(), halfDayType);
        if (dto.getReason() != null && dto.getReason().length() > MAX_REASON_LENGTH) {
            throw new IllegalArgumentException("사유는 " + MAX_REASON_LENGTH + "자 이하로 입력해 주세요.");
        }

        // 2. 일수 계산
        double totalDays = computeDays(dto.getStartDate(), dto.getEndDate(), halfDayType);

        // 3. 설정은 매번 새로 읽는다
        LeaveConfigSnapshot config = configProvider.current();
        String requestId = newRequestId();

        // 4. 필요한 경우에만 오라클 (트랜잭션 밖)
        OracleRecommendation recommendation = null;
        if (ModePolicy.requiresOracle(config, leaveType)) {
            recommendation = oracleClient.analyze(OracleRequestFacts.builder()
                    .requestId(requestId)
                    .employeeId(employeeId)
                    .leaveType(leaveType)
                    .startDate(dto.getStartDate())
                    .endDate(dto.getEndDate())
                    .totalDays(totalDays)
                    .halfDay(halfDayType.isHalfDay())
                    .reason(dto.getReason())
                    .mode(config.getMode())
                    .forceEscalationCheck(false)
                    .build());
        }

        InitialDisposition disposition = ModePolicy.decideInitialDisposition(
                leaveType, config.getMode(), config.getNormalModeAutoApproveTypes(), recommendation, now);

        // 5. 엔티티 구성
        LeaveRequest request = new LeaveRequest();
        request.setRequestId(requestId);
        request.setEmployeeId(employeeId);
        request.setLeaveType(leaveType);
        request.setStartDate(dto.getStartDate());
        request.setEndDate(dto.getEndDate());
        request.setTotalDays(totalDays);
        request.setHalfDayType(halfDayType);
        request.setReason(dto.getReason());
        request.setSubmittedAt(now);
        request.setModeAtSubmission(config.getMode());
        request.setStatus(disposition.getStatus());
        request.setHrAssignedAt(disposition.getHrAssignedAt());
        request.appendNote(now, disposition.getProcessingNotes());
        if (recommendation != null) {
            request.setOracleRecommendation(recommendation.getRecommendation());
            request.setOracleConfidence(recommendation.getConfidence());
            request.setOracleOffline(recommendation.isOffline());
        }
        if (disposition.isApproved()) {
            request.setDecidedBy(LeaveTransitionService.SYSTEM);
            request.setDecidedAt(now);
        } else if (disposition.getStatus() == LeaveRequestStatus.PENDING) {
            // PENDING_HR 은 인사팀 단독 처리, 결재 체인 없음
            approvalChainPlanner.initializeChain(request, employee, config, now);
        }

        // 6. 저장 (+ 승인이면 원장 차감)
        LeaveRequest saved = transitionService.persistSubmission(request);
        log.info("휴가 신청 접수: requestId={}, employeeId={}, type={}, days={}, mode={}, status={}",
                requestId, employeeId, leaveType, totalDays, config.getMode(), saved.getStatus());

        auditService.record(requestId, "SUBMITTED", null, saved.getStatus(), employeeId, disposition.getProcessingNotes());
        notifyAfterSubmit(saved, disposition);

        return LeaveRequestResponseDto.fromEntity(saved, null);
    }

    private void validateDates(LocalDate start, LocalDate end, HalfDayType halfDayType) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("시작일과 종료일은 필수입니다.");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("종료일은 시작일보다 빠를 수 없습니다.");
        }
        if (halfDayType.isHalfDay() && !start.equals(end)) {
            throw new IllegalArgumentException("반차는 하루짜리 신청에만 사용할 수 있습니다.");
        }
    }

    /**
     * 반차는 0.5일. 그 외에는 오라클 근무일 계산, 실패하면 시작/종료 포함 달력 일수
     */
    double computeDays(LocalDate start, LocalDate end, HalfDayType halfDayType) {
        if (halfDayType.isHalfDay()) {
            return halfDayType.getDayValue();
        }
        double days = oracleClient.calculateWorkingDays(start, end, false)
                .orElseGet(() -> (double) (ChronoUnit.DAYS.between(start, end) + 1));
        if (days <= 0) {
            throw new IllegalArgumentException("신청 기간에 근무일이 없습니다.");
        }
        return days;
    }

    static String newRequestId() {
        return "LR-" + UUID.randomUUID();
    }

    private void notifyAfterSubmit(LeaveRequest saved, InitialDisposition disposition) {
        Map<String, String> vars = leaveVariables(saved);

        notificationService.dispatch(NotificationMessage.toEmployee(saved.getEmployeeId(),
                        saved.getStatus() == LeaveRequestStatus.APPROVED ? NotificationEvent.LEAVE_APPROVED : NotificationEvent.LEAVE_SUBMITTED,
                        saved.getRequestId())
                .variables(vars)
                .variable("actor", LeaveTransitionService.SYSTEM)
                .build());

        if (disposition.getHrAssignedAt() != null) {
            notificationService.dispatch(NotificationMessage.toRole(Role.HR, NotificationEvent.PENDING_REVIEW, saved.getRequestId())
                    .variables(vars)
                    .variable("notes", disposition.getProcessingNotes())
                    .build());
        }

        if (saved.getCurrentApprover() != null) {
            notificationService.dispatch(NotificationMessage.toEmployee(saved.getCurrentApprover(), NotificationEvent.APPROVAL_PENDING, saved.getRequestId())
                    .variables(vars)
                    .variable("level", String.valueOf(saved.getCurrentLevel()))
                    .variable("deadline", String.valueOf(saved.getSlaDeadline()))
                    .build());
        }
    }

    // ------------------------------------------------------------------
    // HR / 결재자 결정
    // ------------------------------------------------------------------

    public TransitionResponseDto decide(String requestId, String actorId, boolean approve, String comment) {
        LeaveRequest request = getEntity(requestId);
        if (actorId.equals(request.getEmployeeId())) {
            throw new AccessDeniedException("본인 신청은 결정할 수 없습니다.");
        }
        if (!orgDirectoryService.isHrOrAdmin(actorId) && !actorId.equals(request.getCurrentApprover())) {
            throw new AccessDeniedException("인사팀 또는 현재 결재자만 처리할 수 있습니다.");
        }

        LeaveRequestStatus target = approve ? LeaveRequestStatus.APPROVED : LeaveRequestStatus.REJECTED;
        if (request.getStatus().isTerminal()) {
            log.info("이미 처리된 신청: requestId={}, actor={}, status={}", requestId, actorId, request.getStatus());
            return TransitionResponseDto.of(requestId, TransitionResult.ALREADY_HANDLED, request.getStatus());
        }
        LeaveStateMachine.assertTransition(request.getStatus(), target);

        LocalDateTime now = LocalDateTime.now();
        TransitionResult result = transitionService.decide(requestId, target, actorId, comment, now);
        LeaveRequest after = getEntity(requestId);

        if (result.isApplied()) {
            log.info("휴가 신청 {}: requestId={}, actor={}", target, requestId, actorId);
            auditService.record(requestId, approve ? "APPROVED" : "REJECTED", request.getStatus(), target, actorId, comment);
            notificationService.dispatch(NotificationMessage.toEmployee(after.getEmployeeId(),
                            approve ? NotificationEvent.LEAVE_APPROVED : NotificationEvent.LEAVE_REJECTED, requestId)
                    .variables(leaveVariables(after))
                    .variable("actor", actorId)
                    .variable("comment", comment)
                    .build());
        } else {
            log.info("이미 처리된 신청: requestId={}, actor={}, status={}", requestId, actorId, after.getStatus());
        }
        return TransitionResponseDto.of(requestId, result, after.getStatus());
    }

    // ------------------------------------------------------------------
    // 취소
    // ------------------------------------------------------------------

    public TransitionResponseDto cancel(String requestId, String employeeId) {
        LeaveRequest request = getEntity(requestId);
        if (!request.getEmployeeId().equals(employeeId)) {
            throw new AccessDeniedException("본인 신청만 취소할 수 있습니다.");
        }
        LeaveStateMachine.assertTransition(request.getStatus(), LeaveRequestStatus.CANCELLED);

        TransitionResult result = transitionService.cancel(requestId, employeeId, LocalDateTime.now());
        LeaveRequest after = getEntity(requestId);

        if (result.isApplied()) {
            log.info("휴가 신청 취소: requestId={}, previous={}", requestId, request.getStatus());
            auditService.record(requestId, "CANCELLED", request.getStatus(), LeaveRequestStatus.CANCELLED, employeeId, null);
            notificationService.dispatch(NotificationMessage.toEmployee(employeeId, NotificationEvent.LEAVE_CANCELLED, requestId)
                    .variables(leaveVariables(after))
                    .build());
            if (request.getCurrentApprover() != null && request.getStatus().isPending()) {
                notificationService.dispatch(NotificationMessage.toEmployee(request.getCurrentApprover(), NotificationEvent.LEAVE_CANCELLED, requestId)
                        .variables(leaveVariables(after))
                        .build());
            }
        }
        return TransitionResponseDto.of(requestId, result, after.getStatus());
    }

    // ------------------------------------------------------------------
    // 열람 표시 (HR)
    // ------------------------------------------------------------------

    public boolean markViewed(String requestId, String hrId) {
        if (!orgDirectoryService.isHrOrAdmin(hrId)) {
            throw new AccessDeniedException("인사팀만 열람 표시를 할 수 있습니다.");
        }
        LeaveRequest request = getEntity(requestId);
        boolean first = transitionService.markViewed(requestId, LocalDateTime.now());
        if (first) {
            auditService.record(requestId, "HR_VIEWED", request.getStatus(), request.getStatus(), hrId, null);
        }
        return first;
    }

    // ------------------------------------------------------------------
    // 조회
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public LeaveRequest getEntity(String requestId) {
        return leaveRequestRepository.findById(requestId)
                .orElseThrow(() -> new EntityNotFoundException("휴가 신청을 찾을 수 없습니다: " + requestId));
    }

    @Transactional(readOnly = true)
    public LeaveRequestResponseDto getDetail(String requestId, String viewerId) {
        LeaveRequest request = getEntity(requestId);
        assertCanView(request, viewerId);
        PriorityBadge badge = priorityBadgeRepository.findByRequestId(requestId).orElse(null);
        return LeaveRequestResponseDto.fromEntity(request, badge);
    }

    @Transactional(readOnly = true)
    public Page<LeaveRequestResponseDto> getMyRequests(String employeeId, Pageable pageable) {
        Page<LeaveRequest> page = leaveRequestRepository.findByEmployeeId(employeeId, pageable);
        Map<String, PriorityBadge> badges = badgesFor(page.getContent());
        return page.map(r -> LeaveRequestResponseDto.fromEntity(r, badges.get(r.getRequestId())));
    }

    /**
     * HR 대기 목록: RED → YELLOW → 없음, 같은 등급은 오래된 순
     */
    @Transactional(readOnly = true)
    public List<LeaveRequestResponseDto> getHrQueue(String hrId, int page, int size) {
        if (!orgDirectoryService.isHrOrAdmin(hrId)) {
            throw new AccessDeniedException("인사팀만 조회할 수 있습니다.");
        }
        int safeSize = Math.max(1, Math.min(size, 100));
        List<LeaveRequest> rows = leaveRequestRepository.findHrQueue(LeaveRequestStatus.DECIDABLE,
                PageRequest.of(Math.max(0, page), safeSize));
        Map<String, PriorityBadge> badges = badgesFor(rows);
        return rows.stream()
                .map(r -> LeaveRequestResponseDto.fromEntity(r, badges.get(r.getRequestId())))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<AuditEntryResponseDto> getAuditTrail(String requestId, String viewerId) {
        assertCanView(getEntity(requestId), viewerId);
        return auditService.getTrail(requestId).stream()
                .map(AuditEntryResponseDto::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<EscalationHistoryResponseDto> getEscalationHistory(String requestId, String viewerId) {
        assertCanView(getEntity(requestId), viewerId);
        return escalationHistoryRepository.findByRequestIdOrderByCreatedAtAsc(requestId).stream()
                .map(EscalationHistoryResponseDto::fromEntity)
                .collect(Collectors.toList());
    }

    private void assertCanView(LeaveRequest request, String viewerId) {
        boolean allowed = viewerId.equals(request.getEmployeeId())
                || viewerId.equals(request.getLevel1Approver())
                || viewerId.equals(request.getLevel2Approver())
                || viewerId.equals(request.getLevel3Approver())
                || viewerId.equals(request.getCurrentApprover())
                || orgDirectoryService.isHrOrAdmin(viewerId);
        if (!allowed) {
            throw new AccessDeniedException("이 휴가 신청을 조회할 권한이 없습니다.");
        }
    }

    private Map<String, PriorityBadge> badgesFor(List<LeaveRequest> requests) {
        if (requests.isEmpty()) {
            return Collections.emptyMap();
        }
        List<String> ids = requests.stream().map(LeaveRequest::getRequestId).collect(Collectors.toList());
        return priorityBadgeRepository.findByRequestIdIn(ids).stream()
                .collect(Collectors.toMap(PriorityBadge::getRequestId, Function.identity(), (a, b) -> a));
    }

    public static Map<String, String> leaveVariables(LeaveRequest r) {
        Map<String, String> vars = new HashMap<>();
        vars.put("requestId", r.getRequestId());
        vars.put("employeeId", r.getEmployeeId());
        vars.put("leaveType", r.getLeaveType() != null ? r.getLeaveType().getDisplayName() : "");
        vars.put("totalDays", String.valueOf(r.getTotalDays()));
        vars.put("startDate", String.valueOf(r.getStartDate()));
        vars.put("endDate", String.valueOf(r.getEndDate()));
        vars.put("status", String.valueOf(r.getStatus()));
        return vars;
    }
}
