package leaveflow.leaveflowbackend.enums.approval;

public enum ResolutionAction {
    APPROVED,
    REJECTED,
    CANCELLED,
    REASSIGNED
}
