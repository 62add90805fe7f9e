package leaveflow.leaveflowbackend.enums;

public enum PriorityLevel {
    NONE(3),
    YELLOW(2),
    RED(1);

    // 인사팀 목록 정렬 순서 (작을수록 먼저)
    private final int sortOrder;

    PriorityLevel(int sortOrder) {
        this.sortOrder = sortOrder;
    }

    public int getSortOrder() {
        return sortOrder;
    }

    public boolean isSet() {
        return this != NONE;
    }
}
