package com.supplier.resolution.api;

import com.supplier.resolution.bulk.ProgressCallback;
import com.supplier.resolution.core.model.Decision;
import com.supplier.resolution.core.model.DecisionRecord;
import com.supplier.resolution.core.model.EntityRecord;
import com.supplier.resolution.core.model.FeatureVector;
import com.supplier.resolution.core.model.QualityFlag;
import com.supplier.resolution.core.model.ReferenceSet;
import com.supplier.resolution.logging.LogContext;
import com.supplier.resolution.matching.CandidateMatch;
import com.supplier.resolution.matching.CandidateSelector;
import com.supplier.resolution.metrics.MetricsService;
import com.supplier.resolution.metrics.NoOpMetricsService;
import com.supplier.resolution.quality.QualityFlagger;
import com.supplier.resolution.report.RunSummary;
import com.supplier.resolution.scoring.DecisionClassifier;
import com.supplier.resolution.scoring.FeatureExtractor;
import com.supplier.resolution.scoring.MatchScorer;
import com.supplier.resolution.similarity.BlockingKeyStrategy;
import com.supplier.resolution.similarity.CountryBlockingKeyStrategy;
import com.supplier.resolution.similarity.SequenceSimilarity;
import com.supplier.resolution.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for linking supplier records against a reference set.
 *
 * <p>For each input record: select the best candidate by name similarity, extract features,
 * score them, classify the score, and flag quality problems. Each row depends only on itself,
 * the read-only reference set and the options, so rows can be processed in any order or in
 * parallel with identical results.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (SupplierResolver resolver = SupplierResolver.builder()
 *         .referenceSet(ReferenceSet.of(referenceRecords))
 *         .options(ResolutionOptions.defaults())
 *         .build()) {
 *     ResolutionRun run = resolver.run(inputRecords);
 * }
 * </pre>
 */
public class SupplierResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SupplierResolver.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final ResolutionOptions options;
    private final ReferenceSet referenceSet;
    private final FeatureExtractor featureExtractor;
    private final CandidateSelector candidateSelector;
    private final MatchScorer scorer;
    private final DecisionClassifier classifier;
    private final QualityFlagger qualityFlagger;
    private final MetricsService metricsService;
    private final ExecutorService executor;

    private SupplierResolver(Builder builder) {
        this.options = builder.options;
        this.referenceSet = builder.referenceSet;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();

        SimilarityAlgorithm similarity = builder.similarityAlgorithm != null
                ? builder.similarityAlgorithm
                : new SequenceSimilarity();
        BlockingKeyStrategy blocking = null;
        if (options.isBlockingEnabled()) {
            blocking = builder.blockingKeyStrategy != null
                    ? builder.blockingKeyStrategy
                    : new CountryBlockingKeyStrategy();
        }

        this.featureExtractor = new FeatureExtractor(similarity, options.getFreshnessCurve(), options.getNow());
        this.candidateSelector = new CandidateSelector(similarity, referenceSet, blocking);
        this.scorer = new MatchScorer(options.getWeights());
        this.classifier = new DecisionClassifier(options.getThresholds());
        this.qualityFlagger = new QualityFlagger(options.getNow(), options.getStalenessDays());
        this.executor = options.getParallelism() > 1
                ? Executors.newFixedThreadPool(options.getParallelism())
                : null;

        log.info("SupplierResolver initialized: referenceRows={} options={}", referenceSet.size(), options);
    }

    /**
     * Resolves a single input record. Never throws for a bad row: malformed input yields an
     * {@link Decision#UNMATCHED} record carrying {@link QualityFlag#MALFORMED_INPUT}.
     */
    public DecisionRecord resolve(EntityRecord input) {
        Objects.requireNonNull(input, "input is required");
        DecisionRecord result;
        String problem = input.validationProblem();
        if (problem != null) {
            log.warn("resolve.malformed rowKey={} reason={}", input.getKey(), problem);
            result = malformed(input, problem);
        } else {
            try {
                result = resolveWellFormed(input);
            } catch (RuntimeException e) {
                log.warn("resolve.failed rowKey={} error={}", input.getKey(), e.getMessage(), e);
                result = malformed(input, "resolution failed: " + e.getMessage());
            }
        }
        recordMetrics(result);
        return result;
    }

    /**
     * Resolves every input record, preserving input order.
     */
    public List<DecisionRecord> resolveAll(List<EntityRecord> inputs) {
        return run(inputs).records();
    }

    public ResolutionRun run(List<EntityRecord> inputs) {
        return run(inputs, ProgressCallback.NOOP);
    }

    /**
     * Runs one pass over the input records and summarizes the outcome.
     *
     * @param inputs   input records; each produces exactly one decision record
     * @param callback progress callback, may be null
     * @throws IllegalArgumentException if {@code inputs} contains a null element; nothing is resolved
     */
    public ResolutionRun run(List<EntityRecord> inputs, ProgressCallback callback) {
        Objects.requireNonNull(inputs, "inputs is required");
        for (int i = 0; i < inputs.size(); i++) {
            if (inputs.get(i) == null) {
                throw new IllegalArgumentException("inputs contains a null record at index " + i);
            }
        }
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        String runId = LogContext.generateRunId();
        Instant start = Instant.now();

        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("run.started inputRows={} referenceRows={} parallelism={}",
                    inputs.size(), referenceSet.size(), options.getParallelism());
            if (referenceSet.isEmpty()) {
                log.warn("run.emptyReferenceSet every row will be Unmatched");
            }

            List<DecisionRecord> records = executor == null || inputs.size() < 2
                    ? resolveSequential(runId, inputs, cb)
                    : resolveParallel(runId, inputs, cb);

            Duration elapsed = Duration.between(start, Instant.now());
            metricsService.recordRunDuration(elapsed, records.size());
            RunSummary summary = RunSummary.of(records);
            cb.onProgress(records.size(), inputs.size(), "Resolution completed");
            log.info("run.completed rows={} matched={} needsReview={} unmatched={} flagged={} elapsedMs={}",
                    summary.totalRows(), summary.count(Decision.MATCHED), summary.count(Decision.NEEDS_REVIEW),
                    summary.count(Decision.UNMATCHED), summary.flaggedRows(), elapsed.toMillis());
            return new ResolutionRun(runId, records, summary, elapsed);
        }
    }

    private List<DecisionRecord> resolveSequential(String runId, List<EntityRecord> inputs, ProgressCallback cb) {
        List<DecisionRecord> results = new ArrayList<>(inputs.size());
        for (EntityRecord input : inputs) {
            results.add(resolveInContext(runId, input));
            if (results.size() % PROGRESS_INTERVAL == 0) {
                cb.onProgress(results.size(), inputs.size(), "Resolved " + results.size() + " records");
            }
        }
        return results;
    }

    /**
     * Splits the input into contiguous chunks, one task per chunk, and concatenates
     * the chunk results in input order.
     */
    private List<DecisionRecord> resolveParallel(String runId, List<EntityRecord> inputs, ProgressCallback cb) {
        int chunkCount = Math.min(options.getParallelism(), inputs.size());
        int chunkSize = (inputs.size() + chunkCount - 1) / chunkCount;
        AtomicInteger processed = new AtomicInteger();

        List<CompletableFuture<List<DecisionRecord>>> futures = new ArrayList<>();
        for (int from = 0; from < inputs.size(); from += chunkSize) {
            List<EntityRecord> chunk = inputs.subList(from, Math.min(from + chunkSize, inputs.size()));
            futures.add(CompletableFuture.supplyAsync(() -> {
                List<DecisionRecord> chunkResults = new ArrayList<>(chunk.size());
                for (EntityRecord input : chunk) {
                    chunkResults.add(resolveInContext(runId, input));
                    int done = processed.incrementAndGet();
                    if (done % PROGRESS_INTERVAL == 0) {
                        cb.onProgress(done, inputs.size(), "Resolved " + done + " records");
                    }
                }
                return chunkResults;
            }, executor));
        }

        List<DecisionRecord> results = new ArrayList<>(inputs.size());
        try {
            for (CompletableFuture<List<DecisionRecord>> future : futures) {
                results.addAll(future.join());
            }
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Parallel resolution failed", cause);
        }
        return results;
    }

    private DecisionRecord resolveInContext(String runId, EntityRecord input) {
        try (LogContext ctx = LogContext.forRow(runId, input.getKey())) {
            return resolve(input);
        }
    }

    private DecisionRecord resolveWellFormed(EntityRecord input) {
        Optional<CandidateMatch> match = candidateSelector.select(input);
        if (match.isEmpty()) {
            return new DecisionRecord(input.getKey(), input.getName(), null, null,
                    FeatureVector.EMPTY, 0.0, Decision.UNMATCHED,
                    qualityFlagger.flag(input), "no reference candidates");
        }

        EntityRecord candidate = match.get().candidate();
        FeatureVector features = featureExtractor.extract(input, candidate);
        double score = scorer.score(features);
        Decision decision = classifier.classify(features.nameSimilarity(), score);

        // Quality is judged on the selected candidate whatever the decision.
        Set<QualityFlag> flags = qualityFlagger.flag(candidate);

        String notes = decisionNotes(features, score);
        if (classifier.belowNameFloor(features.nameSimilarity())) {
            notes += "; below name floor";
        }

        log.debug("resolve.row rowKey={} candidateKey={} nameSimilarity={} score={} decision={} flags={}",
                input.getKey(), candidate.getKey(), features.nameSimilarity(), score, decision, flags);

        return new DecisionRecord(input.getKey(), input.getName(), candidate.getKey(), candidate.getName(),
                features, score, decision, flags, notes);
    }

    private DecisionRecord malformed(EntityRecord input, String reason) {
        return new DecisionRecord(input.getKey(), input.getName(), null, null,
                FeatureVector.EMPTY, 0.0, Decision.UNMATCHED,
                EnumSet.of(QualityFlag.MALFORMED_INPUT), "malformed input: " + reason);
    }

    /**
     * Short audit trail, e.g. {@code name_sim=0.72; country=match; city=match; website=present; fresh=1.00; score=0.83}.
     */
    static String decisionNotes(FeatureVector features, double score) {
        List<String> bits = new ArrayList<>();
        bits.add(String.format(Locale.ROOT, "name_sim=%.2f", features.nameSimilarity()));
        bits.add(features.countryMatch() == 1 ? "country=match" : "country=mismatch");
        if (features.cityMatch() == 1) {
            bits.add("city=match");
        }
        if (features.websitePresent() == 1) {
            bits.add("website=present");
        }
        bits.add(String.format(Locale.ROOT, "fresh=%.2f", features.freshness()));
        bits.add(String.format(Locale.ROOT, "score=%.2f", score));
        return String.join("; ", bits);
    }

    private void recordMetrics(DecisionRecord record) {
        metricsService.recordDecision(record.decision());
        metricsService.recordMatchScore(record.matchScore());
        record.flags().forEach(metricsService::recordQualityFlag);
        if (record.flags().contains(QualityFlag.MALFORMED_INPUT)) {
            metricsService.recordMalformedRow();
        }
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    public ReferenceSet getReferenceSet() {
        return referenceSet;
    }

    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReferenceSet referenceSet = ReferenceSet.empty();
        private ResolutionOptions options;
        private MetricsService metricsService;
        private SimilarityAlgorithm similarityAlgorithm;
        private BlockingKeyStrategy blockingKeyStrategy;

        public Builder referenceSet(ReferenceSet referenceSet) {
            this.referenceSet = Objects.requireNonNull(referenceSet, "referenceSet is required");
            return this;
        }

        public Builder referenceRecords(List<EntityRecord> records) {
            return referenceSet(ReferenceSet.of(records));
        }

        public Builder options(ResolutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Overrides the name similarity routine. Must be symmetric and bounded by its
         * {@link SimilarityAlgorithm#upperBound}.
         */
        public Builder similarityAlgorithm(SimilarityAlgorithm similarityAlgorithm) {
            this.similarityAlgorithm = similarityAlgorithm;
            return this;
        }

        /**
         * Strategy used when blocking is enabled in the options. Defaults to country blocking.
         */
        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        public SupplierResolver build() {
            if (options == null) {
                options = ResolutionOptions.defaults();
            }
            return new SupplierResolver(this);
        }
    }
}
