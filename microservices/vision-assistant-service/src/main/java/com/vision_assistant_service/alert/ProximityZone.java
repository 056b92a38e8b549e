package com.vision_assistant_service.alert;

// most to least severe
public enum ProximityZone {
    CRITICAL("critical"),
    WARNING("warning"),
    FAR("far");

    private final String label;

    ProximityZone(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isMoreSevereThan(ProximityZone other) {
        return ordinal() < other.ordinal();
    }
}
