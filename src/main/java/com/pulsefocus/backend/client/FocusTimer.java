package com.pulsefocus.backend.client;

import java.time.Instant;

/** The productivity timer, as seen by the biofeedback poller. */
public interface FocusTimer {

    /** True while the timer is in its work interval and running. */
    boolean isFocusRunActive();

    /** Start of the current focus run, or {@code null} when none is active. */
    Instant focusRunStartedAt();

    /** Pause the running focus interval. */
    void autoPause();
}
