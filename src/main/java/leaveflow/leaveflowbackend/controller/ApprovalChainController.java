package leaveflow.leaveflowbackend.controller;

import jakarta.persistence.EntityNotFoundException;
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
import leaveflow.leaveflowbackend.dto.request.ApprovalActionRequestDto;
import leaveflow.leaveflowbackend.dto.response.LeaveRequestResponseDto;
import leaveflow.leaveflowbackend.service.approval.ApprovalChainService;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/approval-chain")
@RequiredArgsConstructor
@Slf4j
public class ApprovalChainController {

    private final ApprovalChainService approvalChainService;

    /**
     * 내가 결재할 차례인 신청 목록
     */
    @GetMapping("/pending/me")
    public ResponseEntity<List<LeaveRequestResponseDto>> getPendingForMe(
            Authentication auth,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int size
    ) {
        String approverId = auth.getName();
        try {
            int safeSize = Math.max(1, Math.min(size, 100));
            Pageable pageable = PageRequest.of(Math.max(0, page), safeSize, Sort.by(Sort.Direction.ASC, "slaDeadline"));

            Page<LeaveRequestResponseDto> result = approvalChainService.getPendingForApprover(approverId, pageable);

            HttpHeaders headers = new HttpHeaders();
            headers.add("X-Total-Count", String.valueOf(result.getTotalElements()));
            return new ResponseEntity<>(result.getContent(), headers, HttpStatus.OK);
        } catch (Exception e) {
            log.error("결재 대기 목록 조회 실패: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<?> approve(@PathVariable String id,
                                     @RequestBody(required = false) ApprovalActionRequestDto request,
                                     Authentication auth) {
        String approverId = auth.getName();
        try {
            String comment = request != null ? request.getComment() : null;
            return ResponseEntity.ok(approvalChainService.approve(id, approverId, comment));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("결재 승인 실패: id={}, approver={}", id, approverId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "결재 승인 중 오류가 발생했습니다."));
        }
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<?> reject(@PathVariable String id,
                                    @RequestBody ApprovalActionRequestDto request,
                                    Authentication auth) {
        String approverId = auth.getName();
        if (request.getComment() == null || request.getComment().trim().isEmpty()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", "반려 사유는 필수입니다."));
        }
        try {
            return ResponseEntity.ok(approvalChainService.reject(id, approverId, request.getComment()));
        } catch (EntityNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (AccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("결재 반려 실패: id={}, approver={}", id, approverId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "결재 반려 중 오류가 발생했습니다."));
        }
    }
}
