package leaveflow.leaveflowbackend.enums.approval;

public enum LevelStatus {
    NOT_REQUIRED,
    PENDING,
    APPROVED,
    REJECTED,
    // 결재 기한 초과로 다음 단계에 넘어감
    ESCALATED
}
