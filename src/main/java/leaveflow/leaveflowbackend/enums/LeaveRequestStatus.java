package leaveflow.leaveflowbackend.enums;

import java.util.EnumSet;
import java.util.Set;

public enum LeaveRequestStatus {
    PENDING,            // 승인 대기 (결재라인 진행 중)
    PENDING_HR,         // 정책 위반 등으로 인사팀 확인 필요
    APPROVED,           // 최종 승인
    REJECTED,           // 반려
    CANCELLED;          // 신청자 취소

    /**
     * 사람이 결정할 수 있는 대기 상태들
     */
    public static final Set<LeaveRequestStatus> DECIDABLE = EnumSet.of(PENDING, PENDING_HR);

    public boolean isPending() {
        return this == PENDING || this == PENDING_HR;
    }

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED || this == CANCELLED;
    }
}
