package com.eldplanner.model;

import com.eldplanner.exception.InvalidInputException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Weekly on-duty cycle a carrier operates under.
 */
public enum WeeklyMode {
    SEVENTY_EIGHT("70/8", 70.0, 8),
    SIXTY_SEVEN("60/7", 60.0, 7);

    private final String label;
    private final double maxHours;
    private final int days;

    WeeklyMode(String label, double maxHours, int days) {
        this.label = label;
        this.maxHours = maxHours;
        this.days = days;
    }

    @JsonValue
    public String getLabel() { return label; }
    public double getMaxHours() { return maxHours; }
    public int getDays() { return days; }

    @JsonCreator
    public static WeeklyMode fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return SEVENTY_EIGHT;
        }
        for (WeeklyMode mode : values()) {
            if (mode.label.equals(label.trim()) || mode.name().equalsIgnoreCase(label.trim())) {
                return mode;
            }
        }
        throw new InvalidInputException("Unsupported weekly mode: " + label + " (expected 70/8 or 60/7)");
    }
}
