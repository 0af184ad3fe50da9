package com.libragraph.relay.types;

/**
 * Lifecycle of a broker job: {@code QUEUED -> RUNNING -> DONE | ERROR}.
 * QUEUED is the only initial state; DONE and ERROR are terminal.
 */
public enum JobStatus {
    QUEUED("queued"),
    RUNNING("running"),
    DONE("done"),
    ERROR("error");

    private final String label;

    JobStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    /** Whether {@code next} is a legal single step from this state. */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == RUNNING;
            case RUNNING -> next == DONE || next == ERROR;
            case DONE, ERROR -> false;
        };
    }

    public static JobStatus fromLabel(String label) {
        for (JobStatus s : values()) {
            if (s.label.equalsIgnoreCase(label)) return s;
        }
        throw new IllegalArgumentException("Unknown JobStatus label: " + label);
    }
}
