package leaveflow.leaveflowbackend.controller;

import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import leaveflow.leaveflowbackend.dto.request.LeaveDecisionRequestDto;
import leaveflow.leaveflowbackend.dto.response.LeaveRequestResponseDto;
import leaveflow.leaveflowbackend.dto.response.TransitionResponseDto;
import leaveflow.leaveflowbackend.entity.mysql.HrNotification;
import leaveflow.leaveflowbackend.service.LeaveRequestService;
import leaveflow.leaveflowbackend.service.NotificationService;

import java.util.List;
import java.util.Map;

/**
 * 인사팀 전용: 대기 목록, 승인/반려, 열람 표시, 알림함
 */
@RestController
@RequestMapping("/api/v1/hr")
@RequiredArgsConstructor
@Slf4j
public class HrLeaveController {

    private final LeaveRequestService leaveRequestService;
    private final NotificationService notificationService;

    /**
     * 처리 대기 목록. RED → YELLOW → 일반, 같은 등급은 오래된 순
     */
    @GetMapping("/leave-requests/pending")
    public ResponseEntity<?> getPendingQueue(
            Authentication auth,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        try {
            List<LeaveRequestResponseDto> queue = leaveRequestService.getHrQueue(auth.getName(), page, size);
            return ResponseEntity.ok(queue);
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("HR 대기 목록 조회 실패: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "대기 목록 조회 중 오류가 발생했습니다."));
        }
    }

    /**
     * 승인/반려. 이미 다른 쪽에서 처리된 경우 alreadyHandled=true 로 200
     */
    @PutMapping("/leave-requests/{id}/decision")
    public ResponseEntity<?> decide(@PathVariable String id,
                                    @RequestBody @Valid LeaveDecisionRequestDto request,
                                    Authentication auth) {
        String hrId = auth.getName();
        try {
            TransitionResponseDto result = leaveRequestService.decide(id, hrId, request.getApprove(), request.getComment());
            return ResponseEntity.ok(result);
        } catch (EntityNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("휴가 신청 결정 실패: id={}, hrId={}", id, hrId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "휴가 신청 처리 중 오류가 발생했습니다."));
        }
    }

    @PostMapping("/leave-requests/{id}/viewed")
    public ResponseEntity<?> markViewed(@PathVariable String id, Authentication auth) {
        try {
            boolean first = leaveRequestService.markViewed(id, auth.getName());
            return ResponseEntity.ok(Map.of("requestId", id, "firstView", first));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("열람 표시 실패: id={}", id, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "열람 표시 중 오류가 발생했습니다."));
        }
    }

    // ------------------------------------------------------------------
    // 알림함
    // ------------------------------------------------------------------

    @GetMapping("/notifications")
    public ResponseEntity<List<HrNotification>> getUnreadNotifications(
            Authentication auth,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(notificationService.getUnread(auth.getName(), limit));
    }

    @PutMapping("/notifications/{notificationId}/read")
    public ResponseEntity<?> markNotificationRead(@PathVariable Long notificationId, Authentication auth) {
        try {
            notificationService.markRead(notificationId, auth.getName());
            return ResponseEntity.ok().build();
        } catch (EntityNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        }
    }

    @PutMapping("/notifications/read-all")
    public ResponseEntity<?> markAllNotificationsRead(Authentication auth) {
        int updated = notificationService.markAllRead(auth.getName());
        return ResponseEntity.ok(Map.of("updated", updated));
    }

    @DeleteMapping("/notifications/{notificationId}")
    public ResponseEntity<?> dismissNotification(@PathVariable Long notificationId, Authentication auth) {
        try {
            notificationService.dismiss(notificationId, auth.getName());
            return ResponseEntity.noContent().build();
        } catch (EntityNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        }
    }
}
