package leaveflow.leaveflowbackend.enums;

public enum LedgerEntryType {
    BOOK,       // 차감
    REVERSE     // 복원
}
