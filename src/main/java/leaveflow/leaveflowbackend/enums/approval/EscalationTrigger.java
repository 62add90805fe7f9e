package leaveflow.leaveflowbackend.enums.approval;

public enum EscalationTrigger {
    TIMEOUT,
    POLICY,
    SLA
}
