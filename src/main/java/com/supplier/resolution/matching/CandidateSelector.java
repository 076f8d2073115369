package com.supplier.resolution.matching;

import com.supplier.resolution.core.model.EntityRecord;
import com.supplier.resolution.core.model.ReferenceSet;
import com.supplier.resolution.similarity.BlockingKeyStrategy;
import com.supplier.resolution.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the reference record whose name is most similar to the input's name.
 *
 * <p>Ties go to the record that appears first in the reference set. Without a blocking
 * strategy every reference record is compared. With one, the input's block is compared
 * first and the remaining records are compared only if their length-based upper bound
 * can still beat the best candidate found so far; the selected candidate is the same in
 * both modes.</p>
 *
 * <p>Instances are immutable and safe to share between worker threads.</p>
 */
public class CandidateSelector {
    private static final Logger log = LoggerFactory.getLogger(CandidateSelector.class);

    private final SimilarityAlgorithm similarity;
    private final ReferenceSet referenceSet;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final Map<String, List<Integer>> blockIndex;

    public CandidateSelector(SimilarityAlgorithm similarity, ReferenceSet referenceSet) {
        this(similarity, referenceSet, null);
    }

    /**
     * @param similarity          name similarity routine
     * @param referenceSet        candidates to choose from
     * @param blockingKeyStrategy optional strategy; null means exhaustive scan
     */
    public CandidateSelector(SimilarityAlgorithm similarity, ReferenceSet referenceSet,
                             BlockingKeyStrategy blockingKeyStrategy) {
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.referenceSet = Objects.requireNonNull(referenceSet, "referenceSet is required");
        this.blockingKeyStrategy = blockingKeyStrategy;
        this.blockIndex = blockingKeyStrategy != null
                ? referenceSet.indexBy(blockingKeyStrategy::blockingKey)
                : Map.of();
        if (blockingKeyStrategy != null) {
            log.debug("selector.blocking blocks={} referenceSize={}", blockIndex.size(), referenceSet.size());
        }
    }

    /**
     * Selects the best candidate for the input record.
     *
     * @return the best candidate, or empty when the reference set is empty
     */
    public Optional<CandidateMatch> select(EntityRecord input) {
        if (referenceSet.isEmpty()) {
            return Optional.empty();
        }
        Best best = blockingKeyStrategy == null ? exhaustiveScan(input) : blockedScan(input);
        return Optional.of(new CandidateMatch(referenceSet.get(best.position), best.position, best.similarity));
    }

    private Best exhaustiveScan(EntityRecord input) {
        Best best = new Best();
        for (int pos = 0; pos < referenceSet.size(); pos++) {
            best.offer(pos, similarity.compute(input.getName(), referenceSet.get(pos).getName()));
        }
        return best;
    }

    private Best blockedScan(EntityRecord input) {
        Best best = new Best();
        String key = blockingKeyStrategy.blockingKey(input);
        List<Integer> block = key != null ? blockIndex.getOrDefault(key, List.of()) : List.of();
        boolean[] visited = new boolean[referenceSet.size()];

        for (int pos : block) {
            visited[pos] = true;
            best.offer(pos, similarity.compute(input.getName(), referenceSet.get(pos).getName()));
        }

        int compared = block.size();
        for (int pos = 0; pos < referenceSet.size(); pos++) {
            if (visited[pos]) {
                continue;
            }
            String candidateName = referenceSet.get(pos).getName();
            if (!best.canBeBeatenBy(pos, similarity.upperBound(input.getName(), candidateName))) {
                continue;
            }
            compared++;
            best.offer(pos, similarity.compute(input.getName(), candidateName));
        }

        log.trace("selector.scan key={} blockSize={} compared={} referenceSize={}",
                key, block.size(), compared, referenceSet.size());
        return best;
    }

    public ReferenceSet getReferenceSet() {
        return referenceSet;
    }

    /**
     * Running best: highest similarity, then lowest position.
     */
    private static final class Best {
        private int position = -1;
        private double similarity = -1.0;

        void offer(int pos, double score) {
            if (score > similarity || (score == similarity && pos < position)) {
                position = pos;
                similarity = score;
            }
        }

        boolean canBeBeatenBy(int pos, double upperBound) {
            return position < 0 || upperBound > similarity || (upperBound == similarity && pos < position);
        }
    }
}
