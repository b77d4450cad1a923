package com.example.records.enums;

import java.util.Optional;

/**
 * Letter grades, highest first. Each grade is awarded from its lower bound
 * (inclusive) up to the next grade's bound.
 */
public enum Grade {
    A_PLUS("A+", 90.0),
    A("A", 80.0),
    B("B", 70.0),
    C("C", 60.0),
    D("D", 50.0),
    F("F", Double.NEGATIVE_INFINITY);

    private final String label;
    private final double lowerBound;

    Grade(String label, double lowerBound) {
        this.label = label;
        this.lowerBound = lowerBound;
    }

    public String getLabel() {
        return label;
    }

    public static Grade forPercentage(double percentage) {
        for (Grade g : values()) {
            if (percentage >= g.lowerBound) return g;
        }
        return F;
    }

    public static Optional<Grade> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String t = label.trim();
        for (Grade g : values()) {
            if (g.label.equalsIgnoreCase(t)) return Optional.of(g);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
