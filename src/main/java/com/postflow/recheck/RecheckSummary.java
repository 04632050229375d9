package com.postflow.recheck;

/**
 * Counts from one recheck pass.
 *
 * @param checked   Due deferred jobs whose guardrails were re-run
 * @param promoted  Jobs moved to the queue
 * @param redeferred Jobs still blocked
 * @param skipped   Jobs that left DEFERRED while their probe was running
 * @param failed    Jobs whose recheck threw; they stay DEFERRED for the next pass
 */
public record RecheckSummary(int checked, int promoted, int redeferred, int skipped, int failed) {

    public static RecheckSummary empty() {
        return new RecheckSummary(0, 0, 0, 0, 0);
    }
}
