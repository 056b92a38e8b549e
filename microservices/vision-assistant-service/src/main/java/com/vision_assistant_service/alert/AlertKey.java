package com.vision_assistant_service.alert;

/** Cooldown bucket. Zone is not part of the key. */
public record AlertKey(String objectType, Direction direction) {

    @Override
    public String toString() {
        return objectType + "/" + direction.getLabel();
    }
}
