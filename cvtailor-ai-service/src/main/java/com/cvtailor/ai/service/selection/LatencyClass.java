package com.cvtailor.ai.service.selection;

public enum LatencyClass {
    FAST,
    MEDIUM,
    SLOW
}
