package com.jobrelay;

import java.util.EnumSet;
import java.util.Set;

public enum JobState {
    PENDING,
    LEASED,
    RETRYING,
    COMPLETED,
    DEAD_LETTERED,
    CANCELLED;

    /**
     * States a job can be dispatched from.
     */
    public static final Set<JobState> DISPATCHABLE = EnumSet.of(PENDING, RETRYING);

    public static final Set<JobState> TERMINAL = EnumSet.of(COMPLETED, DEAD_LETTERED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
