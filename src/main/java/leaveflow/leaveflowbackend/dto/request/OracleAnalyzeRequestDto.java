package leaveflow.leaveflowbackend.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OracleAnalyzeRequestDto {
    @JsonProperty("request_id")
    private String requestId;
    @JsonProperty("emp_id")
    private String employeeId;
    @JsonProperty("leave_type")
    private String leaveType;
    @JsonProperty("start_date")
    private LocalDate startDate;
    @JsonProperty("end_date")
    private LocalDate endDate;
    @JsonProperty("total_days")
    private double totalDays;
    @JsonProperty("is_half_day")
    private boolean halfDay;
    @JsonProperty("reason")
    private String reason;
    @JsonProperty("force_escalation_check")
    private boolean forceEscalationCheck;
}
