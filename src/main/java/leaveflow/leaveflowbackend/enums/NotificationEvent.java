package leaveflow.leaveflowbackend.enums;

public enum NotificationEvent {
    LEAVE_SUBMITTED(false),
    LEAVE_APPROVED(false),
    LEAVE_REJECTED(false),
    LEAVE_CANCELLED(false),
    PENDING_REVIEW(false),          // 인사팀 배정 알림
    PRIORITY_ELIGIBLE(false),       // 우선순위 설정 가능
    PRIORITY_REQUEST(true),         // 직원이 우선순위 배지를 설정함
    ESCALATION_AUTO_APPROVED(true),
    ESCALATION_TO_MANAGER(true),
    APPROVAL_PENDING(false),        // 결재 차례 알림
    SLA_ESCALATED(true),
    SLA_EXHAUSTED(true),
    HR_REMINDER(true);

    // 이메일 릴레이 대상 여부
    private final boolean emailEligible;

    NotificationEvent(boolean emailEligible) {
        this.emailEligible = emailEligible;
    }

    public boolean isEmailEligible() {
        return emailEligible;
    }
}
