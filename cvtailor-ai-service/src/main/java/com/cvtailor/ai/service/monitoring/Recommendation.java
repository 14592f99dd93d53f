package com.cvtailor.ai.service.monitoring;

public record Recommendation(String model, Kind kind, String suggestion) {

    public enum Kind {
        LATENCY,
        COST,
        RELIABILITY
    }
}
