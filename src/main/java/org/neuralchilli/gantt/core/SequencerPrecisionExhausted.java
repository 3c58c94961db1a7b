package org.neuralchilli.gantt.core;

/**
 * Two neighbouring sort keys are too close for a distinct midpoint at the
 * configured precision. Always handled inside {@link Sequencer} by renormalizing.
 */
class SequencerPrecisionExhausted extends Exception {

    SequencerPrecisionExhausted(double lower, double upper) {
        super("No distinct sort key between " + lower + " and " + upper);
    }
}
