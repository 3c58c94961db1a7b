package org.neuralchilli.gantt.domain;

/**
 * Kind of constraint a dependency edge places between two tasks.
 * Each type has the two-letter code the Gantt chart uses and the long label
 * stored with the dependency record.
 */
public enum DependencyType {
    FINISH_TO_START("FS", "Finish to Start"),
    START_TO_START("SS", "Start to Start"),
    FINISH_TO_FINISH("FF", "Finish to Finish"),
    START_TO_FINISH("SF", "Start to Finish");

    private final String code;
    private final String label;

    DependencyType(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    /**
     * Parse a dependency type from its code ("FS"), label ("Finish to Start")
     * or constant name, case-insensitively.
     */
    public static DependencyType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Dependency type cannot be null or empty");
        }

        String normalized = value.trim();
        for (DependencyType type : values()) {
            if (type.code.equalsIgnoreCase(normalized)
                    || type.label.equalsIgnoreCase(normalized)
                    || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }

        throw new IllegalArgumentException(
                "Invalid dependency type: " + value + ". Must be one of: FS, SS, FF, SF"
        );
    }
}
