package leaveflow.leaveflowbackend.enums;

/**
 * 조건부 상태 전이의 결과. ALREADY_HANDLED는 다른 주체가 먼저 처리했음을 뜻하며 오류가 아니다.
 */
public enum TransitionResult {
    APPLIED,
    ALREADY_HANDLED;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
