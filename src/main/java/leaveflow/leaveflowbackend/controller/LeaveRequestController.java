package leaveflow.leaveflowbackend.controller;

import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import leaveflow.leaveflowbackend.dto.request.LeaveSubmitRequestDto;
import leaveflow.leaveflowbackend.dto.response.LeaveRequestResponseDto;
import leaveflow.leaveflowbackend.dto.response.TransitionResponseDto;
import leaveflow.leaveflowbackend.service.LeaveRequestService;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/leave-requests")
@RequiredArgsConstructor
@Slf4j
public class LeaveRequestController {

    private final LeaveRequestService leaveRequestService;

    /**
     * 휴가 신청 제출. 모드/오라클 판단에 따라 즉시 승인되거나 대기 상태로 저장된다
     */
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody @Valid LeaveSubmitRequestDto request, Authentication auth) {
        String employeeId = auth.getName();
        try {
            LeaveRequestResponseDto created = leaveRequestService.submit(employeeId, request);
            return ResponseEntity.status(HttpStatus.CREATED).body(created);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("휴가 신청 제출 실패: employeeId={}", employeeId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "휴가 신청 중 오류가 발생했습니다."));
        }
    }

    /**
     * 내 신청 목록 (최신순, size 최대 100)
     */
    @GetMapping("/my")
    public ResponseEntity<List<LeaveRequestResponseDto>> getMyRequests(
            Authentication auth,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int size
    ) {
        String employeeId = auth.getName();
        try {
            int safeSize = Math.max(1, Math.min(size, 100));
            Pageable pageable = PageRequest.of(Math.max(0, page), safeSize, Sort.by(Sort.Direction.DESC, "submittedAt"));

            Page<LeaveRequestResponseDto> result = leaveRequestService.getMyRequests(employeeId, pageable);

            HttpHeaders headers = new HttpHeaders();
            headers.add("X-Total-Count", String.valueOf(result.getTotalElements()));
            return new ResponseEntity<>(result.getContent(), headers, HttpStatus.OK);
        } catch (Exception e) {
            log.error("내 휴가 신청 목록 조회 실패: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getDetail(@PathVariable String id, Authentication auth) {
        try {
            return ResponseEntity.ok(leaveRequestService.getDetail(id, auth.getName()));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("휴가 신청 상세 조회 실패: id={}", id, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "휴가 신청 조회 중 오류가 발생했습니다."));
        }
    }

    /**
     * 본인 신청 취소 (대기 중 또는 승인된 건)
     */
    @PutMapping("/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String id, Authentication auth) {
        try {
            TransitionResponseDto result = leaveRequestService.cancel(id, auth.getName());
            return ResponseEntity.ok(result);
        } catch (EntityNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("휴가 신청 취소 실패: id={}", id, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "휴가 신청 취소 중 오류가 발생했습니다."));
        }
    }

    @GetMapping("/{id}/audit")
    public ResponseEntity<?> getAuditTrail(@PathVariable String id, Authentication auth) {
        try {
            return ResponseEntity.ok(leaveRequestService.getAuditTrail(id, auth.getName()));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("감사 이력 조회 실패: id={}", id, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "감사 이력 조회 중 오류가 발생했습니다."));
        }
    }

    @GetMapping("/{id}/escalations")
    public ResponseEntity<?> getEscalationHistory(@PathVariable String id, Authentication auth) {
        try {
            return ResponseEntity.ok(leaveRequestService.getEscalationHistory(id, auth.getName()));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("에스컬레이션 이력 조회 실패: id={}", id, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "에스컬레이션 이력 조회 중 오류가 발생했습니다."));
        }
    }
}
