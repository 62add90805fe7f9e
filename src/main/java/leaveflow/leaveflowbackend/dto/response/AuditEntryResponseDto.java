package leaveflow.leaveflowbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import leaveflow.leaveflowbackend.entity.mysql.LeaveRequestAudit;
import leaveflow.leaveflowbackend.enums.LeaveRequestStatus;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntryResponseDto {
    private String action;
    private LeaveRequestStatus oldStatus;
    private LeaveRequestStatus newStatus;
    private String actorId;
    private String reason;
    private LocalDateTime createdAt;

    public static AuditEntryResponseDto fromEntity(LeaveRequestAudit a) {
        return new AuditEntryResponseDto(a.getAction(), a.getOldStatus(), a.getNewStatus(),
                a.getActorId(), a.getReason(), a.getCreatedAt());
    }
}
