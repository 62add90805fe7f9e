package leaveflow.leaveflowbackend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import leaveflow.leaveflowbackend.entity.mysql.escalation.EscalationHistory;
import leaveflow.leaveflowbackend.enums.approval.EscalationKind;
import leaveflow.leaveflowbackend.enums.approval.EscalationTrigger;
import leaveflow.leaveflowbackend.enums.approval.ResolutionAction;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class EscalationHistoryResponseDto {
    private Long id;
    private EscalationKind kind;
    private Integer level;
    private String escalatedFrom;
    private String escalatedTo;
    private String reason;
    private EscalationTrigger triggeredBy;
    private boolean resolved;
    private LocalDateTime resolvedAt;
    private String resolvedBy;
    private ResolutionAction resolutionAction;
    private LocalDateTime createdAt;

    public static EscalationHistoryResponseDto fromEntity(EscalationHistory e) {
        return new EscalationHistoryResponseDto(e.getId(), e.getEscalationKind(), e.getEscalationLevel(),
                e.getEscalatedFrom(), e.getEscalatedTo(), e.getEscalationReason(), e.getTriggeredBy(),
                e.isResolved(), e.getResolvedAt(), e.getResolvedBy(), e.getResolutionAction(), e.getCreatedAt());
    }
}
