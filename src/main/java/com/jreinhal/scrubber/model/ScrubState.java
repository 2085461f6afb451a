package com.jreinhal.scrubber.model;

public enum ScrubState {
    RECEIVED,
    DETECTING,
    FUSING,
    POLICY_APPLYING,
    SUBSTITUTING,
    PERSISTING,
    LOGGED,
    FAILED;

    public boolean isTerminal() {
        return this == LOGGED || this == FAILED;
    }
}
