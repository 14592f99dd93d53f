package com.cvtailor.ai.service.selection;

public enum QualityTier {

    STANDARD(1),
    MEDIUM(1),
    HIGH(2),
    PREMIUM(3);

    private final int rank;

    QualityTier(int rank) {
        this.rank = rank;
    }

    // Higher is better
    public int rank() {
        return rank;
    }
}
