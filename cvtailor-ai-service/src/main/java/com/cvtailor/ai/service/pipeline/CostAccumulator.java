package com.cvtailor.ai.service.pipeline;

import java.util.concurrent.atomic.DoubleAdder;

/**
 * Running total of what one request has been charged, including calls that
 * failed after the provider billed them.
 */
public class CostAccumulator {

    private final DoubleAdder total = new DoubleAdder();

    public void add(double costUsd) {
        if (costUsd > 0) {
            total.add(costUsd);
        }
    }

    /**
     * Takes back a charge that turned out to be a duplicate of work already
     * paid for.
     */
    public void refund(double costUsd) {
        if (costUsd > 0) {
            total.add(-costUsd);
        }
    }

    public double total() {
        return total.sum();
    }
}
