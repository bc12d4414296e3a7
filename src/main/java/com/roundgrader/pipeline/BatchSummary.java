package com.roundgrader.pipeline;

/**
 * Counts reported at the end of a batch run.
 */
public record BatchSummary(int processed, int skipped, int failed, int total) {

    @Override
    public String toString() {
        return String.format("processed=%d skipped=%d failed=%d total=%d", processed, skipped, failed, total);
    }

    static final class Counter {
        private int processed;
        private int skipped;
        private int failed;
        private int total;

        void processed() {
            processed++;
            total++;
        }

        void skipped() {
            skipped++;
            total++;
        }

        void failed() {
            failed++;
            total++;
        }

        BatchSummary summary() {
            return new BatchSummary(processed, skipped, failed, total);
        }
    }
}
