package leaveflow.leaveflowbackend.service.mode;

import lombok.Value;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;

import java.time.LocalDateTime;

@Value
public class InitialDisposition {
    LeaveRequestStatus status;
    String processingNotes;
    // null 이면 HR 배정 없음
    LocalDateTime hrAssignedAt;

    public boolean isApproved() {
        return status == LeaveRequestStatus.APPROVED;
    }
}
