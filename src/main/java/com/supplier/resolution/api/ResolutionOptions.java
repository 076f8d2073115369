package com.supplier.resolution.api;

import com.supplier.resolution.config.InvalidConfigurationException;
import com.supplier.resolution.quality.QualityFlagger;
import com.supplier.resolution.scoring.DecisionThresholds;
import com.supplier.resolution.scoring.FreshnessCurve;
import com.supplier.resolution.scoring.ScoringWeights;

import java.time.Instant;
import java.util.Objects;

/**
 * Options for a resolution run.
 * Configures weights, thresholds, staleness window, the reference "now" and scheduling.
 * Immutable; every value is validated when {@link Builder#build()} is called.
 */
public class ResolutionOptions {

    private static final int DEFAULT_PARALLELISM = 1;

    private final ScoringWeights weights;
    private final DecisionThresholds thresholds;
    private final int stalenessDays;
    private final Instant now;
    private final FreshnessCurve freshnessCurve;
    private final boolean blockingEnabled;
    private final int parallelism;

    private ResolutionOptions(Builder builder, DecisionThresholds thresholds) {
        this.weights = builder.weights;
        this.thresholds = thresholds;
        this.stalenessDays = builder.stalenessDays;
        this.now = builder.now != null ? builder.now : Instant.now();
        this.freshnessCurve = builder.freshnessCurve;
        this.blockingEnabled = builder.blockingEnabled;
        this.parallelism = builder.parallelism;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public DecisionThresholds getThresholds() {
        return thresholds;
    }

    public int getStalenessDays() {
        return stalenessDays;
    }

    /**
     * Reference time for freshness and staleness. Fixed for the lifetime of the options.
     */
    public Instant getNow() {
        return now;
    }

    public FreshnessCurve getFreshnessCurve() {
        return freshnessCurve;
    }

    public boolean isBlockingEnabled() {
        return blockingEnabled;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Creates default options with "now" set to the current time.
     */
    public static ResolutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with the values of existing options, for applying overrides.
     */
    public static Builder builder(ResolutionOptions options) {
        return new Builder()
                .weights(options.weights)
                .strongThreshold(options.thresholds.strong())
                .reviewThreshold(options.thresholds.review())
                .nameFloor(options.thresholds.nameFloor())
                .stalenessDays(options.stalenessDays)
                .now(options.now)
                .freshnessCurve(options.freshnessCurve)
                .blockingEnabled(options.blockingEnabled)
                .parallelism(options.parallelism);
    }

    public static class Builder {
        private ScoringWeights weights = ScoringWeights.defaultWeights();
        private double strongThreshold = DecisionThresholds.DEFAULT_STRONG;
        private double reviewThreshold = DecisionThresholds.DEFAULT_REVIEW;
        private double nameFloor = DecisionThresholds.DEFAULT_NAME_FLOOR;
        private int stalenessDays = QualityFlagger.DEFAULT_STALENESS_DAYS;
        private Instant now;
        private FreshnessCurve freshnessCurve = FreshnessCurve.TIERED;
        private boolean blockingEnabled = false;
        private int parallelism = DEFAULT_PARALLELISM;

        public Builder weights(ScoringWeights weights) {
            this.weights = Objects.requireNonNull(weights, "weights is required");
            return this;
        }

        public Builder strongThreshold(double strongThreshold) {
            this.strongThreshold = strongThreshold;
            return this;
        }

        public Builder reviewThreshold(double reviewThreshold) {
            this.reviewThreshold = reviewThreshold;
            return this;
        }

        public Builder nameFloor(double nameFloor) {
            this.nameFloor = nameFloor;
            return this;
        }

        public Builder stalenessDays(int stalenessDays) {
            this.stalenessDays = stalenessDays;
            return this;
        }

        public Builder now(Instant now) {
            this.now = now;
            return this;
        }

        public Builder freshnessCurve(FreshnessCurve freshnessCurve) {
            this.freshnessCurve = Objects.requireNonNull(freshnessCurve, "freshnessCurve is required");
            return this;
        }

        public Builder blockingEnabled(boolean blockingEnabled) {
            this.blockingEnabled = blockingEnabled;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        /**
         * @throws InvalidConfigurationException if any value is out of range
         */
        public ResolutionOptions build() {
            DecisionThresholds thresholds = new DecisionThresholds(strongThreshold, reviewThreshold, nameFloor);
            if (stalenessDays < 0) {
                throw new InvalidConfigurationException("stalenessDays must be non-negative, got " + stalenessDays);
            }
            if (parallelism <= 0) {
                throw new InvalidConfigurationException("parallelism must be positive, got " + parallelism);
            }
            return new ResolutionOptions(this, thresholds);
        }
    }

    @Override
    public String toString() {
        return "ResolutionOptions{" +
                "weights=" + weights +
                ", thresholds=" + thresholds +
                ", stalenessDays=" + stalenessDays +
                ", now=" + now +
                ", freshnessCurve=" + freshnessCurve +
                ", blockingEnabled=" + blockingEnabled +
                ", parallelism=" + parallelism +
                '}';
    }
}
