package leaveflow.leaveflowbackend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.annotation.Async;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.client.RestTemplate;
import leaveflow.leaveflowbackend.config.LeaveNotificationProperties;
import leaveflow.leaveflowbackend.entity.mysql.EmployeeEntity;
import leaveflow.leaveflowbackend.entity.mysql.HrNotification;
import leaveflow.leaveflowbackend.enums.Role;
import leaveflow.leaveflowbackend.repository.mysql.HrNotificationRepository;
import leaveflow.leaveflowbackend.template.NotificationTemplate;

import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 알림 발송: 앱 내 알림 저장 + (선택) 메일 릴레이.
 * 발송 실패는 로그만 남기고 호출 측으로 전파하지 않는다
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final RestTemplate restTemplate = new RestTemplate();

    private final HrNotificationRepository notificationRepository;
    private final OrgDirectoryService orgDirectoryService;
    private final LeaveNotificationProperties properties;
    private final ObjectMapper objectMapper;

    @Async
    public void dispatch(NotificationMessage message) {
        try {
            deliver(message);
        } catch (Exception e) {
            log.error("알림 발송 실패: event={}, requestId={}, recipient={}",
                    message.getEvent(), message.getRequestId(),
                    message.getRecipientId() != null ? message.getRecipientId() : message.getRecipientRole(), e);
        }
    }

    /**
     * 동기 발송. 저장된 알림 반환
     */
    public HrNotification deliver(NotificationMessage message) {
        if (message.getRecipientId() == null && message.getRecipientRole() == null) {
            throw new IllegalArgumentException("수신자 정보가 비어있습니다.");
        }
        NotificationTemplate template = NotificationTemplate.of(message.getEvent());
        String body = template.render(message.getVariables());

        HrNotification notification = new HrNotification();
        notification.setNotificationType(message.getEvent());
        notification.setRequestId(message.getRequestId());
        notification.setRecipientId(message.getRecipientId());
        notification.setRecipientRole(message.getRecipientId() == null ? message.getRecipientRole() : null);
        notification.setPriorityLevel(message.getPriority());
        notification.setTitle(template.getTitle());
        notification.setMessage(body);
        notification.setPayloadJson(toJson(message.getVariables()));
        HrNotification saved = notificationRepository.save(notification);

        if (message.isEmail() && message.getEvent().isEmailEligible()) {
            sendEmail(message, template.getTitle(), body);
        }
        return saved;
    }

    private void sendEmail(NotificationMessage message, String subject, String body) {
        String relayUrl = properties.getEmailRelayUrl();
        if (relayUrl == null || relayUrl.isBlank()) {
            log.debug("메일 릴레이 미설정, 메일 발송 생략: event={}", message.getEvent());
            return;
        }

        List<String> recipients = resolveEmails(message);
        if (recipients.isEmpty()) {
            log.warn("메일 수신자 없음: event={}, requestId={}", message.getEvent(), message.getRequestId());
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("to", recipients);
        payload.put("subject", "[LeaveFlow] " + subject);
        payload.put("body", body);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(relayUrl, payload, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.error("메일 릴레이 응답 오류: status={}, event={}", response.getStatusCode(), message.getEvent());
            }
        } catch (Exception e) {
            log.error("메일 발송 중 예외 발생: event={}, requestId={}", message.getEvent(), message.getRequestId(), e);
        }
    }

    private List<String> resolveEmails(NotificationMessage message) {
        if (message.getRecipientId() != null) {
            return orgDirectoryService.findEmployee(message.getRecipientId())
                    .map(EmployeeEntity::getEmail)
                    .filter(Objects::nonNull)
                    .map(List::of)
                    .orElse(Collections.emptyList());
        }
        return orgDirectoryService.findActiveHrStaff().stream()
                .map(EmployeeEntity::getEmail)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    private String toJson(Map<String, String> variables) {
        try {
            return objectMapper.writeValueAsString(variables);
        } catch (JsonProcessingException e) {
            log.warn("알림 데이터 직렬화 실패: {}", e.getMessage());
            return null;
        }
    }

    // ------------------------------------------------------------------
    // 알림함
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public List<HrNotification> getUnread(String userId, int limit) {
        return notificationRepository.findUnread(userId, visibleRoles(userId), PageRequest.of(0, Math.max(1, Math.min(limit, 100))));
    }

    @Transactional
    public void markRead(Long notificationId, String userId) {
        HrNotification notification = getOwned(notificationId, userId);
        if (!notification.isRead()) {
            notification.setRead(true);
            notification.setReadAt(LocalDateTime.now());
        }
    }

    @Transactional
    public int markAllRead(String userId) {
        return notificationRepository.markAllRead(userId, visibleRoles(userId), LocalDateTime.now());
    }

    @Transactional
    public void dismiss(Long notificationId, String userId) {
        HrNotification notification = getOwned(notificationId, userId);
        notification.setDismissed(true);
    }

    @Transactional
    public int purgeReadOlderThan(LocalDateTime cutoff) {
        return notificationRepository.deleteReadBefore(cutoff);
    }

    private HrNotification getOwned(Long notificationId, String userId) {
        HrNotification notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> new EntityNotFoundException("알림을 찾을 수 없습니다: " + notificationId));
        boolean mine = userId.equals(notification.getRecipientId())
                || (notification.getRecipientRole() != null && visibleRoles(userId).contains(notification.getRecipientRole()));
        if (!mine) {
            throw new AccessDeniedException("본인 알림만 처리할 수 있습니다.");
        }
        return notification;
    }

    // 관리자는 HR 역할 알림도 함께 본다
    private List<Role> visibleRoles(String userId) {
        Role role = orgDirectoryService.roleOf(userId);
        if (role == Role.ADMIN) {
            return List.of(Role.HR, Role.ADMIN);
        }
        return List.of(role);
    }
}
