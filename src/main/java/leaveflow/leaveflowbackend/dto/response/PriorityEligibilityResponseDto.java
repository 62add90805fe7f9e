package leaveflow.leaveflowbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import leaveflow.leaveflowbackend.enums.PriorityLevel;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class PriorityEligibilityResponseDto {
    private String requestId;
    private boolean eligible;
    private PriorityLevel currentLevel;
    // 설정 가능까지 남은 시간 (가능하면 0)
    private long hoursRemaining;
    private String reason;
}
