package leaveflow.leaveflowbackend.enums;

public enum HalfDayType {
    ALL_DAY("All day", 1.0),
    MORNING("Morning", 0.5),
    AFTERNOON("Afternoon", 0.5);

    private final String displayName;
    private final Double dayValue;

    HalfDayType(String displayName, Double dayValue) {
        this.displayName = displayName;
        this.dayValue = dayValue;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Double getDayValue() {
        return dayValue;
    }

    public boolean isHalfDay() {
        return this != ALL_DAY;
    }
}
