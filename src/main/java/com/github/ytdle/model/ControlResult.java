package com.github.ytdle.model;

public enum ControlResult {
    ACCEPTED,
    NOT_FOUND,
    INVALID_TRANSITION;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
