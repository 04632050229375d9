package com.postflow.debounce;

public enum DebounceState {
    /** No pending fire for the key */
    IDLE,
    /** Quiet period running; further events reset it */
    WAITING
}
