package leaveflow.leaveflowbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;
import leaveflow.leaveflowbackend.enums.TransitionResult;

/**
 * 상태 변경 결과. 다른 쪽이 먼저 처리했으면 alreadyHandled=true (오류 아님)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class TransitionResponseDto {
    private String requestId;
    private LeaveRequestStatus status;
    private boolean alreadyHandled;
    private String message;

    public static TransitionResponseDto of(String requestId, TransitionResult result, LeaveRequestStatus currentStatus) {
        return new TransitionResponseDto(requestId, currentStatus, !result.isApplied(),
                result.isApplied() ? "처리되었습니다." : "이미 처리된 요청입니다.");
    }
}
