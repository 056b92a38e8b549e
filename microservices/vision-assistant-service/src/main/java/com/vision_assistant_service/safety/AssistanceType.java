package com.vision_assistant_service.safety;

import java.util.Optional;

/**
 * What kind of help an assistance request asks for. Labels match the ones the sensor
 * board reports.
 */
public enum AssistanceType {
    GENERAL("General Help", "general assistance"),
    BATHROOM("Bathroom", "bathroom assistance"),
    FOOD_WATER("Food/Water", "food or water"),
    MEDICATION("Medication", "medication");

    private final String label;
    private final String spoken;

    AssistanceType(String label, String spoken) {
        this.label = label;
        this.spoken = spoken;
    }

    public String getLabel() {
        return label;
    }

    public String getSpoken() {
        return spoken;
    }

    public static Optional<AssistanceType> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (AssistanceType type : values()) {
            if (type.label.equalsIgnoreCase(label.trim()) || type.name().equalsIgnoreCase(label.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
