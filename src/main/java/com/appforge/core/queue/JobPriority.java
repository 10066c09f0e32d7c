package com.appforge.core.queue;

/**
 * Sweep order within one operation type: lower rank first, then FIFO.
 */
public enum JobPriority {
    HIGH(0),
    NORMAL(1),
    LOW(2);

    private final int rank;

    JobPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static JobPriority fromRank(int rank) {
        for (JobPriority p : values()) {
            if (p.rank == rank) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown job priority rank " + rank);
    }
}
