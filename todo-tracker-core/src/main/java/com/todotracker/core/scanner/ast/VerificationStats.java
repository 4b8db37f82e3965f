package com.todotracker.core.scanner.ast;

import java.util.concurrent.atomic.LongAdder;

/**
 * Running precision counters of the AST verification layer.
 *
 * <p>Updated concurrently by scan workers.
 */
public final class VerificationStats {

    private final LongAdder candidates = new LongAdder();
    private final LongAdder verified = new LongAdder();
    private final LongAdder discarded = new LongAdder();
    private final LongAdder fallbacks = new LongAdder();

    public void recordVerified(int kept, int dropped) {
        candidates.add((long) kept + dropped);
        verified.add(kept);
        discarded.add(dropped);
    }

    /**
     * Records candidates kept unverified because no grammar could process the file.
     */
    public void recordFallback(int kept) {
        candidates.add(kept);
        verified.add(kept);
        fallbacks.increment();
    }

    public long getCandidates() {
        return candidates.sum();
    }

    public long getVerified() {
        return verified.sum();
    }

    public long getDiscarded() {
        return discarded.sum();
    }

    public long getFallbacks() {
        return fallbacks.sum();
    }

    /**
     * Share of candidates that survived verification, in percent (100 when there were none).
     */
    public double accuracyPercentage() {
        long total = getCandidates();
        if (total == 0) {
            return 100.0;
        }
        return getVerified() * 100.0 / total;
    }

    public String getSummary() {
        return String.format("Filtered %d false positives from %d candidates (%.1f%% accuracy, %d fallbacks)",
            getDiscarded(), getCandidates(), accuracyPercentage(), getFallbacks());
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
