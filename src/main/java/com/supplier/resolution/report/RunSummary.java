package com.supplier.resolution.report;

import com.supplier.resolution.core.model.Decision;
import com.supplier.resolution.core.model.DecisionRecord;
import com.supplier.resolution.core.model.QualityFlag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counts derived from the decision records of a run.
 *
 * @param totalRows      number of decision records
 * @param decisionCounts rows per decision (every decision present, possibly 0)
 * @param cleanRows      rows without quality flags
 * @param flaggedRows    rows with at least one quality flag
 * @param flagCounts     rows per quality flag (every flag present, possibly 0)
 * @param qcBreakdown    rows per (decision, clean/has_flags) pair, non-empty groups only
 */
public record RunSummary(
        int totalRows,
        Map<Decision, Integer> decisionCounts,
        int cleanRows,
        int flaggedRows,
        Map<QualityFlag, Integer> flagCounts,
        List<QcGroup> qcBreakdown
) {
    public static final String CLEAN = "clean";
    public static final String HAS_FLAGS = "has_flags";

    public RunSummary {
        decisionCounts = Collections.unmodifiableMap(new EnumMap<>(decisionCounts));
        flagCounts = Collections.unmodifiableMap(new EnumMap<>(flagCounts));
        qcBreakdown = List.copyOf(qcBreakdown);
    }

    public static RunSummary of(List<DecisionRecord> records) {
        Map<Decision, Integer> decisions = new EnumMap<>(Decision.class);
        Map<QualityFlag, Integer> flags = new EnumMap<>(QualityFlag.class);
        Map<Decision, int[]> qc = new EnumMap<>(Decision.class);
        for (Decision decision : Decision.values()) {
            decisions.put(decision, 0);
            qc.put(decision, new int[2]);
        }
        for (QualityFlag flag : QualityFlag.values()) {
            flags.put(flag, 0);
        }

        int clean = 0;
        for (DecisionRecord record : records) {
            decisions.merge(record.decision(), 1, Integer::sum);
            record.flags().forEach(flag -> flags.merge(flag, 1, Integer::sum));
            if (record.isClean()) {
                clean++;
                qc.get(record.decision())[0]++;
            } else {
                qc.get(record.decision())[1]++;
            }
        }

        List<QcGroup> breakdown = new ArrayList<>();
        qc.forEach((decision, counts) -> {
            if (counts[0] > 0) {
                breakdown.add(new QcGroup(decision, CLEAN, counts[0]));
            }
            if (counts[1] > 0) {
                breakdown.add(new QcGroup(decision, HAS_FLAGS, counts[1]));
            }
        });

        return new RunSummary(records.size(), decisions, clean, records.size() - clean, flags, breakdown);
    }

    public int count(Decision decision) {
        return decisionCounts.getOrDefault(decision, 0);
    }

    /**
     * One row of the QC summary.
     *
     * @param decision the decision group
     * @param status   {@link #CLEAN} or {@link #HAS_FLAGS}
     * @param rows     number of records in the group
     */
    public record QcGroup(Decision decision, String status, int rows) {}
}
