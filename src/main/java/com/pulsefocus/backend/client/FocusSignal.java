package com.pulsefocus.backend.client;

public enum FocusSignal {
    STEADY,
    SLOW_DOWN,
    TAKE_BREAK
}
