package leaveflow.leaveflowbackend.enums.approval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 오라클 권고 값. 알 수 없는 값은 REVIEW로 취급 (사람이 보게 함)
 */
public enum Recommendation {
    APPROVE,
    REJECT,
    REVIEW,
    ESCALATE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Recommendation fromValue(String value) {
        if (value == null) {
            return REVIEW;
        }
        for (Recommendation r : values()) {
            if (r.name().equalsIgnoreCase(value.trim())) {
                return r;
            }
        }
        return REVIEW;
    }
}
