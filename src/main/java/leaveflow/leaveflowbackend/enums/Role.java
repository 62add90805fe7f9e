package leaveflow.leaveflowbackend.enums;

import lombok.Getter;

@Getter
public enum Role {
    EMPLOYEE("0"),
    MANAGER("1"),
    HR("2"),
    ADMIN("9");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    public static Role fromValue(String value) {
        for (Role role : Role.values()) {
            if (role.value.equals(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role value: " + value);
    }

    public boolean isHrOrAdmin() {
        return this == HR || this == ADMIN;
    }
}
