package com.vision_assistant_service.alert;

public enum AlertSeverity {
    SAFETY(true),
    CRITICAL(true),
    WARNING(true),
    FAR(false);

    private final boolean announceable;

    AlertSeverity(boolean announceable) {
        this.announceable = announceable;
    }

    public boolean isAnnounceable() {
        return announceable;
    }

    public static AlertSeverity of(ProximityZone zone) {
        switch (zone) {
            case CRITICAL:
                return CRITICAL;
            case WARNING:
                return WARNING;
            default:
                return FAR;
        }
    }
}
