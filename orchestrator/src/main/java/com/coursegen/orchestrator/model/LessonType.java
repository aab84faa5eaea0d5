package com.coursegen.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of lesson. Only hands-on lessons carry coding work, and only those
 * get a notebook.
 */
public enum LessonType {
    THEORY("theory"),
    HANDS_ON("hands-on"),
    MIXED("mixed");

    private final String label;

    LessonType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean hasCoding() {
        return this == HANDS_ON;
    }

    /**
     * Lenient parse of provider output ("Hands-On", "hands_on", "theory" ...).
     * Unknown labels map to MIXED.
     */
    @JsonCreator
    public static LessonType fromLabel(String raw) {
        if (raw == null) return MIXED;
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (LessonType t : values()) {
            if (t.label.equals(normalized)) return t;
        }
        return MIXED;
    }
}
