package com.company.dashboard.domain.enums;

public enum AlarmPriority {
    CRITICAL(1),
    HIGH(2),
    MEDIUM(3),
    LOW(4),
    INFO(5);

    private final int level;

    AlarmPriority(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Unknown or missing priorities are treated as informational.
     */
    public static AlarmPriority fromLevel(Integer level) {
        if (level == null) {
            return INFO;
        }
        for (AlarmPriority priority : values()) {
            if (priority.level == level) {
                return priority;
            }
        }
        return INFO;
    }
}
