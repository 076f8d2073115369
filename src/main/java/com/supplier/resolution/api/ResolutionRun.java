package com.supplier.resolution.api;

import com.supplier.resolution.core.model.Decision;
import com.supplier.resolution.core.model.DecisionRecord;
import com.supplier.resolution.report.RunSummary;

import java.time.Duration;
import java.util.List;

/**
 * Result of one pass over the input records.
 *
 * @param runId   identifier used in log context
 * @param records one decision record per input row, in input order
 * @param summary counts derived from {@code records}
 * @param elapsed wall-clock duration of the pass
 */
public record ResolutionRun(
        String runId,
        List<DecisionRecord> records,
        RunSummary summary,
        Duration elapsed
) {
    public ResolutionRun {
        records = records != null ? List.copyOf(records) : List.of();
    }

    /**
     * Records with the given decision, in input order.
     */
    public List<DecisionRecord> withDecision(Decision decision) {
        return records.stream()
                .filter(r -> r.decision() == decision)
                .toList();
    }

    @Override
    public String toString() {
        return "ResolutionRun{" +
                "runId=" + runId +
                ", rows=" + records.size() +
                ", matched=" + summary.count(Decision.MATCHED) +
                ", needsReview=" + summary.count(Decision.NEEDS_REVIEW) +
                ", unmatched=" + summary.count(Decision.UNMATCHED) +
                ", elapsed=" + elapsed.toMillis() + "ms" +
                '}';
    }
}
