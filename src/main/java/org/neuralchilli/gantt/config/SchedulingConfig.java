package org.neuralchilli.gantt.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import org.neuralchilli.gantt.domain.DependencyMode;

/**
 * Tunables of the scheduling engine, read from {@code schedule.*}.
 */
@ConfigMapping(prefix = "schedule")
public interface SchedulingConfig {

    /**
     * Duration assumed for tasks without dates in the critical path analysis
     */
    @WithName("unscheduled-duration-days")
    @WithDefault("1")
    int unscheduledDurationDays();

    /**
     * Mode used for projects created without an explicit dependency mode
     */
    @WithName("default-mode")
    @WithDefault("FLEXIBLE")
    DependencyMode defaultMode();

    Cascade cascade();

    Sequencer sequencer();

    interface Cascade {

        /**
         * Also move dependents earlier when an upstream change loosens their constraints
         */
        @WithName("pull-back")
        @WithDefault("false")
        boolean pullBack();
    }

    interface Sequencer {

        @WithName("gap")
        @WithDefault("1")
        int gap();

        /**
         * Decimal places kept on a sort key
         */
        @WithName("scale")
        @WithDefault("6")
        int scale();
    }
}
