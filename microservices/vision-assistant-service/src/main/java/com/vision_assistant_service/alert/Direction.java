package com.vision_assistant_service.alert;

public enum Direction {
    LEFT("left", "on the left"),
    AHEAD("ahead", "ahead"),
    RIGHT("right", "on the right");

    private final String label;
    private final String phrase;

    Direction(String label, String phrase) {
        this.label = label;
        this.phrase = phrase;
    }

    public String getLabel() {
        return label;
    }

    /** Wording used when the direction is spoken. */
    public String getPhrase() {
        return phrase;
    }
}
