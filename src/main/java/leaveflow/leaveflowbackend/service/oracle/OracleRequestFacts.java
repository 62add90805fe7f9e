package leaveflow.leaveflowbackend.service.oracle;

import lombok.Builder;
import lombok.Value;
import leaveflow.leaveflowbackend.enums.LeaveMode;
import leaveflow.leaveflowbackend.enums.LeaveType;

import java.time.LocalDate;

/**
 * 오라클 판단 및 폴백 규칙 입력값
 */
@Value
@Builder(toBuilder = true)
public class OracleRequestFacts {
    String requestId;
    String employeeId;
    LeaveType leaveType;
    LocalDate startDate;
    LocalDate endDate;
    double totalDays;
    boolean halfDay;
    String reason;
    LeaveMode mode;
    // RED 배지 타임아웃 재평가 경로
    boolean forceEscalationCheck;
}
