package leaveflow.leaveflowbackend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum LeaveType {
    VACATION("vacation", "Vacation", 15.0),
    SICK_LEAVE("sick_leave", "Sick leave", 10.0),
    PERSONAL_LEAVE("personal_leave", "Personal leave", 3.0),
    UNPAID_LEAVE("unpaid_leave", "Unpaid leave", 30.0),
    EMERGENCY_LEAVE("emergency_leave", "Emergency leave", 3.0),
    MATERNITY_LEAVE("maternity_leave", "Maternity leave", 90.0),
    PATERNITY_LEAVE("paternity_leave", "Paternity leave", 10.0),
    BEREAVEMENT_LEAVE("bereavement_leave", "Bereavement leave", 5.0),
    COMP_OFF("comp_off", "Compensatory off", 0.0);

    private final String code;
    private final String displayName;
    private final Double defaultEntitlement;

    LeaveType(String code, String displayName, Double defaultEntitlement) {
        this.code = code;
        this.displayName = displayName;
        this.defaultEntitlement = defaultEntitlement;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Double getDefaultEntitlement() {
        return defaultEntitlement;
    }

    /**
     * "sick_leave", "SICK_LEAVE", "Sick_Leave" 모두 허용. 알 수 없는 값이면 IllegalArgumentException
     */
    @JsonCreator
    public static LeaveType fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("휴가 종류가 비어있습니다.");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 휴가 종류입니다: " + value));
    }
}
