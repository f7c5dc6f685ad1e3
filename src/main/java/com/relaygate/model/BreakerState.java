package com.relaygate.model;

public enum BreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
