package com.cbcluster.orchestrator.state;

import java.util.EnumSet;
import java.util.Set;

public enum ResourceState {
    NOT_STARTED,
    STARTING,
    RUNNING,
    FAILED_TO_START,
    STOPPING,
    EXITED;

    public static final Set<ResourceState> TERMINAL = Set.copyOf(EnumSet.of(FAILED_TO_START, EXITED));

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
