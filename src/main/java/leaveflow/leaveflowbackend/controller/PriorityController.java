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
import leaveflow.leaveflowbackend.dto.request.PrioritySetRequestDto;
import leaveflow.leaveflowbackend.entity.mysql.PriorityBadge;
import leaveflow.leaveflowbackend.service.PriorityService;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/priority")
@RequiredArgsConstructor
@Slf4j
public class PriorityController {

    private final PriorityService priorityService;

    @GetMapping("/{id}/eligibility")
    public ResponseEntity<?> checkEligibility(@PathVariable String id, Authentication auth) {
        try {
            return ResponseEntity.ok(priorityService.checkEligibility(id, auth.getName()));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("우선순위 자격 조회 실패: id={}", id, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "우선순위 자격 조회 중 오류가 발생했습니다."));
        }
    }

    /**
     * 우선순위 배지 설정 (신청당 1회)
     */
    @PostMapping("/{id}")
    public ResponseEntity<?> setPriority(@PathVariable String id,
                                         @RequestBody @Valid PrioritySetRequestDto request,
                                         Authentication auth) {
        String employeeId = auth.getName();
        try {
            PriorityBadge badge = priorityService.setPriority(id, employeeId, request.getPriorityLevel(), request.getReason());
            return ResponseEntity.ok(Map.of(
                    "requestId", badge.getRequestId(),
                    "priorityLevel", badge.getPriorityLevel(),
                    "badgeSetAt", badge.getBadgeSetAt()));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("우선순위 설정 실패: id={}, employeeId={}", id, employeeId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "우선순위 설정 중 오류가 발생했습니다."));
        }
    }
}
