package leaveflow.leaveflowbackend.enums;

import java.util.Locale;

/**
 * 전역 휴가 처리 모드 (ai_system_config.leave_ai_mode)
 */
public enum LeaveMode {
    AUTOMATIC,  // 오라클이 모든 휴가 종류를 처리
    NORMAL;     // 허용 목록(기본: 병가)만 자동 처리, 나머지는 인사팀 배정

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LeaveMode fromValue(String value) {
        for (LeaveMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value == null ? "" : value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown leave mode: " + value);
    }
}
