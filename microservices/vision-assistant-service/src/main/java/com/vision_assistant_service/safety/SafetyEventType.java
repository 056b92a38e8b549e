package com.vision_assistant_service.safety;

public enum SafetyEventType {
    FALL("fall", "Fall", 10),
    EMERGENCY("emergency", "Emergency", 10),
    ASSISTANCE("assistance", "Assistance", 20);

    private final String key;
    private final String displayName;
    private final int historySize;

    SafetyEventType(String key, String displayName, int historySize) {
        this.key = key;
        this.displayName = displayName;
        this.historySize = historySize;
    }

    /** Lower-case name used in endpoint paths and log lines. */
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getHistorySize() {
        return historySize;
    }
}
