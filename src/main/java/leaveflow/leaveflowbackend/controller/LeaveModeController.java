package leaveflow.leaveflowbackend.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import leaveflow.leaveflowbackend.dto.request.ConfigUpdateRequestDto;
import leaveflow.leaveflowbackend.dto.request.ModeToggleRequestDto;
import leaveflow.leaveflowbackend.dto.response.EscalationRunResponseDto;
import leaveflow.leaveflowbackend.dto.response.ModeStatusResponseDto;
import leaveflow.leaveflowbackend.entity.mysql.AiModeHistory;
import leaveflow.leaveflowbackend.enums.LeaveMode;
import leaveflow.leaveflowbackend.service.escalation.PriorityEscalationService;
import leaveflow.leaveflowbackend.service.mode.SystemConfigService;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/leave-mode")
@RequiredArgsConstructor
@Slf4j
public class LeaveModeController {

    private final SystemConfigService systemConfigService;
    private final PriorityEscalationService priorityEscalationService;

    /**
     * 현재 모드와 설정값 (로그인 사용자 누구나)
     */
    @GetMapping
    public ResponseEntity<ModeStatusResponseDto> getStatus() {
        LeaveMode mode = systemConfigService.current().getMode();
        return ResponseEntity.ok(new ModeStatusResponseDto(mode, describe(mode), systemConfigService.getRawConfig()));
    }

    // ------------------------------------------------------------------
    // 관리자
    // ------------------------------------------------------------------

    @PostMapping("/admin/mode/toggle")
    public ResponseEntity<?> toggleMode(@RequestBody @Valid ModeToggleRequestDto request, Authentication auth) {
        String adminId = auth.getName();
        try {
            LeaveMode mode = systemConfigService.toggleMode(LeaveMode.fromValue(request.getMode()), adminId, request.getReason());
            return ResponseEntity.ok(new ModeStatusResponseDto(mode, describe(mode), systemConfigService.getRawConfig()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("모드 전환 실패: adminId={}", adminId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "모드 전환 중 오류가 발생했습니다."));
        }
    }

    @PutMapping("/admin/config")
    public ResponseEntity<?> updateConfig(@RequestBody @Valid ConfigUpdateRequestDto request, Authentication auth) {
        String adminId = auth.getName();
        try {
            systemConfigService.updateConfig(request.getKey(), request.getValue(), adminId);
            return ResponseEntity.ok(systemConfigService.getRawConfig());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("설정 변경 실패: key={}, adminId={}", request.getKey(), adminId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "설정 변경 중 오류가 발생했습니다."));
        }
    }

    @GetMapping("/admin/mode/history")
    public ResponseEntity<List<AiModeHistory>> getModeHistory(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        int safeSize = Math.max(1, Math.min(size, 100));
        Page<AiModeHistory> result = systemConfigService.getModeHistory(PageRequest.of(Math.max(0, page), safeSize));

        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Total-Count", String.valueOf(result.getTotalElements()));
        return new ResponseEntity<>(result.getContent(), headers, HttpStatus.OK);
    }

    /**
     * 우선순위 자격 부여 + RED 재평가 수동 실행
     */
    @PostMapping("/admin/escalations/run")
    public ResponseEntity<?> runEscalations(Authentication auth) {
        try {
            log.info("에스컬레이션 수동 실행: adminId={}", auth.getName());
            EscalationRunResponseDto result = priorityEscalationService.runAll(LocalDateTime.now());
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            log.error("에스컬레이션 수동 실행 실패", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "에스컬레이션 실행 중 오류가 발생했습니다."));
        }
    }

    private String describe(LeaveMode mode) {
        return mode == LeaveMode.AUTOMATIC
                ? "모든 휴가 유형을 자동 판단합니다."
                : "허용 목록의 휴가 유형만 자동 처리하고 나머지는 인사팀이 검토합니다.";
    }
}
