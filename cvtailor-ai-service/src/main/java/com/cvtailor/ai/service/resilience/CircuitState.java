package com.cvtailor.ai.service.resilience;

public enum CircuitState {
    CLOSED, // Normal operation
    OPEN, // Rejecting calls until the cooldown elapses
    HALF_OPEN // One trial call decides CLOSED vs OPEN
}
