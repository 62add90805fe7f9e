package leaveflow.leaveflowbackend.enums.approval;

public enum EscalationKind {
    PRIORITY_TIMEOUT,   // 레드 배지 + 인사팀 무응답 → 오라클 재평가
    SLA_BREACH          // 결재 단계 SLA 초과 → 다음 결재자
}
