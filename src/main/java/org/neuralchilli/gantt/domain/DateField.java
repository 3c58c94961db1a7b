package org.neuralchilli.gantt.domain;

/**
 * Task date fields a cascade can change.
 */
public enum DateField {
    START_DATE("start_date"),
    DUE_DATE("due_date");

    private final String key;

    DateField(String key) {
        this.key = key;
    }

    /**
     * Field name as stored by the task record
     */
    public String key() {
        return key;
    }
}
