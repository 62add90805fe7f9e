package leaveflow.leaveflowbackend.service.mode;

import lombok.Builder;
import lombok.Value;
import leaveflow.leaveflowbackend.enums.LeaveMode;
import leaveflow.leaveflowbackend.enums.LeaveType;

import java.util.Set;

/**
 * 판단 시점마다 새로 읽는 설정 값. 트랜잭션 경계를 넘어 재사용하지 않는다
 */
@Value
@Builder
public class LeaveConfigSnapshot {
    LeaveMode mode;
    int hrResponseTimeoutHours;
    int priorityEscalationTimeoutHours;
    Set<LeaveType> normalModeAutoApproveTypes;
    boolean priorityEmailEnabled;
    int approvalSlaHours;
    int approvalSlaEscalatedHours;

    public boolean isAutoApproveType(LeaveType type) {
        return normalModeAutoApproveTypes != null && normalModeAutoApproveTypes.contains(type);
    }

    public static LeaveConfigSnapshot defaults() {
        return LeaveConfigSnapshot.builder()
                .mode(LeaveMode.AUTOMATIC)
                .hrResponseTimeoutHours(7)
                .priorityEscalationTimeoutHours(24)
                .normalModeAutoApproveTypes(Set.of(LeaveType.SICK_LEAVE))
                .priorityEmailEnabled(true)
                .approvalSlaHours(48)
                .approvalSlaEscalatedHours(24)
                .build();
    }
}
