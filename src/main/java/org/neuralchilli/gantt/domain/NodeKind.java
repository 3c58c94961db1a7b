package org.neuralchilli.gantt.domain;

/**
 * Kind of item placed on the Gantt chart.
 */
public enum NodeKind {
    TASK,
    MILESTONE
}
