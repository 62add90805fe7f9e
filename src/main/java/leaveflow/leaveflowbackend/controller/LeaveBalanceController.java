package leaveflow.leaveflowbackend.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import leaveflow.leaveflowbackend.entity.mysql.LeaveBalance;
import leaveflow.leaveflowbackend.service.LeaveBalanceService;
import leaveflow.leaveflowbackend.service.OrgDirectoryService;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/leave-balances")
@RequiredArgsConstructor
@Slf4j
public class LeaveBalanceController {

    private final LeaveBalanceService leaveBalanceService;
    private final OrgDirectoryService orgDirectoryService;

    /**
     * 연도별 잔여 휴가. 본인 또는 인사팀만
     */
    @GetMapping("/{employeeId}")
    public ResponseEntity<?> getBalances(@PathVariable String employeeId,
                                         @RequestParam(required = false) Integer year,
                                         Authentication auth) {
        String viewerId = auth.getName();
        if (!viewerId.equals(employeeId) && !orgDirectoryService.isHrOrAdmin(viewerId)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", "본인 또는 인사팀만 조회할 수 있습니다."));
        }
        int targetYear = year != null ? year : LocalDate.now().getYear();
        List<LeaveBalance> balances = leaveBalanceService.getBalances(employeeId, targetYear);
        return ResponseEntity.ok(balances);
    }

    /**
     * 연초 잔여 생성 (인사팀). 이미 있는 유형은 건너뛴다
     */
    @PostMapping("/initialize")
    public ResponseEntity<?> initialize(@RequestBody Map<String, Object> requestBody, Authentication auth) {
        if (!orgDirectoryService.isHrOrAdmin(auth.getName())) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", "인사팀만 초기화할 수 있습니다."));
        }
        Object employeeId = requestBody.get("employeeId");
        if (employeeId == null || employeeId.toString().isBlank()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", "employeeId 는 필수입니다."));
        }
        try {
            Object yearObj = requestBody.get("year");
            int year = yearObj != null ? Integer.parseInt(yearObj.toString()) : LocalDate.now().getYear();
            int created = leaveBalanceService.initializeBalances(employeeId.toString(), year);
            return ResponseEntity.ok(Map.of("employeeId", employeeId, "year", year, "created", created));
        } catch (NumberFormatException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", "year 형식이 올바르지 않습니다."));
        } catch (Exception e) {
            log.error("휴가 잔여 초기화 실패: employeeId={}", employeeId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "잔여 초기화 중 오류가 발생했습니다."));
        }
    }
}
