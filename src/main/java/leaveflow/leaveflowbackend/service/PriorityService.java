package leaveflow.leaveflowbackend.service;

import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import leaveflow.leaveflowbackend.dto.response.PriorityEligibilityResponseDto;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequest;
import leaveflow.leaveflowbackend.entity.mysql.PriorityBadge;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;
import leaveflow.leaveflowbackend.enums.NotificationEvent;
import leaveflow.leaveflowbackend.enums.PriorityLevel;
import leaveflow.leaveflowbackend.enums.Role;
import leaveflow.leaveflowbackend.repository.mysql.LeaveRequestRepository;
import leaveflow.leaveflowbackend.repository.mysql.PriorityBadgeRepository;
import leaveflow.leaveflowbackend.service.escalation.PriorityRules;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigProvider;
import leaveflow.leaveflowbackend.service.mode.LeaveConfigSnapshot;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 직원이 직접 설정하는 우선순위 배지 (YELLOW / RED). 신청당 한 번
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriorityService {

    private final LeaveRequestRepository leaveRequestRepository;
    private final PriorityBadgeRepository priorityBadgeRepository;
    private final LeaveConfigProvider configProvider;
    private final NotificationService notificationService;
    private final AuditService auditService;

    @Transactional(readOnly = true)
    public PriorityEligibilityResponseDto checkEligibility(String requestId, String employeeId) {
        LeaveRequest request = getOwned(requestId, employeeId);
        LeaveConfigSnapshot config = configProvider.current();
        LocalDateTime now = LocalDateTime.now();

        PriorityLevel current = priorityBadgeRepository.findByRequestId(requestId)
                .map(PriorityBadge::getPriorityLevel)
                .orElse(PriorityLevel.NONE);

        if (current.isSet()) {
            return new PriorityEligibilityResponseDto(requestId, false, current, 0, "이미 우선순위가 설정되었습니다.");
        }
        if (request.getStatus() != LeaveRequestStatus.PENDING) {
            return new PriorityEligibilityResponseDto(requestId, false, current, 0, "대기 중인 신청만 우선순위를 설정할 수 있습니다.");
        }
        long remaining = PriorityRules.hoursRemaining(request.getSubmittedAt(), config.getHrResponseTimeoutHours(), now);
        if (remaining > 0) {
            return new PriorityEligibilityResponseDto(requestId, false, current, remaining,
                    config.getHrResponseTimeoutHours() + "시간이 지나야 설정할 수 있습니다.");
        }
        return new PriorityEligibilityResponseDto(requestId, true, current, 0, "우선순위를 설정할 수 있습니다.");
    }

    /**
     * 배지 설정. 조건 불충족은 IllegalArgumentException
     */
    @Transactional
    public PriorityBadge setPriority(String requestId, String employeeId, PriorityLevel level, String reason) {
        if (level == null || !level.isSet()) {
            throw new IllegalArgumentException("우선순위는 YELLOW 또는 RED 만 가능합니다.");
        }
        LeaveRequest request = getOwned(requestId, employeeId);
        LeaveConfigSnapshot config = configProvider.current();
        LocalDateTime now = LocalDateTime.now();

        if (request.getStatus() != LeaveRequestStatus.PENDING) {
            throw new IllegalArgumentException("대기 중인 신청만 우선순위를 설정할 수 있습니다.");
        }
        if (!PriorityRules.elapsed(request.getSubmittedAt(), config.getHrResponseTimeoutHours(), now)) {
            throw new IllegalArgumentException(config.getHrResponseTimeoutHours() + "시간이 지나야 우선순위를 설정할 수 있습니다.");
        }

        Optional<PriorityBadge> existing = priorityBadgeRepository.findByRequestId(requestId);
        if (existing.isPresent() && existing.get().getPriorityLevel().isSet()) {
            throw new IllegalArgumentException("우선순위는 한 번만 설정할 수 있습니다.");
        }

        PriorityBadge badge = existing.orElseGet(PriorityBadge::new);
        badge.setRequestId(requestId);
        badge.setEmployeeId(employeeId);
        badge.setPriorityLevel(level);
        badge.setPriorityReason(reason);
        badge.setBadgeSetAt(now);
        badge.setHrNotifiedAt(now);
        if (config.isPriorityEmailEnabled()) {
            badge.setHrEmailSentAt(now);
        }
        try {
            badge = priorityBadgeRepository.saveAndFlush(badge);
        } catch (DataIntegrityViolationException e) {
            // 동시에 두 번 설정한 경우 (unique request_id)
            throw new IllegalArgumentException("우선순위는 한 번만 설정할 수 있습니다.", e);
        }
        leaveRequestRepository.consumePriorityFlag(requestId);

        log.info("우선순위 설정: requestId={}, level={}, employeeId={}", requestId, level, employeeId);
        auditService.record(requestId, "PRIORITY_" + level.name(), request.getStatus(), request.getStatus(), employeeId, reason);

        notificationService.dispatch(NotificationMessage.toRole(Role.HR, NotificationEvent.PRIORITY_REQUEST, requestId)
                .priority(level == PriorityLevel.RED ? "urgent" : "high")
                .email(config.isPriorityEmailEnabled())
                .variable("badge", level == PriorityLevel.RED ? "🔴" : "🟡")
                .variable("priority", level.name())
                .variable("employeeId", employeeId)
                .variable("requestId", requestId)
                .variable("reason", reason != null ? reason : "")
                .build());
        return badge;
    }

    private LeaveRequest getOwned(String requestId, String employeeId) {
        LeaveRequest request = leaveRequestRepository.findById(requestId)
                .orElseThrow(() -> new EntityNotFoundException("휴가 신청을 찾을 수 없습니다: " + requestId));
        if (!request.getEmployeeId().equals(employeeId)) {
            throw new AccessDeniedException("본인 신청만 우선순위를 설정할 수 있습니다.");
        }
        return request;
    }
}
