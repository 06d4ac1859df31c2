package com.texture.dedup.api;

import com.texture.dedup.bulk.CancellationToken;
import com.texture.dedup.bulk.ParallelSweep;
import com.texture.dedup.bulk.ProgressCallback;
import com.texture.dedup.cache.CacheConfig;
import com.texture.dedup.cache.CacheStats;
import com.texture.dedup.core.model.SimilarityDimension;
import com.texture.dedup.equivalence.DifferenceCollection;
import com.texture.dedup.equivalence.EquivalenceCollection;
import com.texture.dedup.equivalence.UnorderedPair;
import com.texture.dedup.ledger.LedgerLayout;
import com.texture.dedup.ledger.LedgerStore;
import com.texture.dedup.ledger.TriStateLedger;
import com.texture.dedup.logging.LogContext;
import com.texture.dedup.metrics.MetricsService;
import com.texture.dedup.metrics.NoOpMetricsService;
import com.texture.dedup.refinement.IdenticalPairDetector;
import com.texture.dedup.refinement.IdenticalityTolerance;
import com.texture.dedup.refinement.RefinementOptions;
import com.texture.dedup.refinement.RefinementResult;
import com.texture.dedup.refinement.RefinementWorkflow;
import com.texture.dedup.representative.RepresentativeSelector;
import com.texture.dedup.representative.TextureCatalog;
import com.texture.dedup.review.ReviewCandidate;
import com.texture.dedup.review.ReviewService;
import com.texture.dedup.source.CachingPixelSource;
import com.texture.dedup.source.PixelSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point: finds copies among textures per similarity dimension and keeps
 * the certain, uncertain and rejected ledgers of each dimension up to date.
 *
 * <p>Ledger files are only written once a run has fully completed. A cancelled run
 * throws {@link com.texture.dedup.bulk.OperationCancelledException} and leaves all
 * files untouched.</p>
 *
 * <pre>
 * try (TextureEquivalenceService service = TextureEquivalenceService.builder()
 *         .pixelSource(new ImageIoPixelSource(textureDir))
 *         .ledgerDirectory(dataDir)
 *         .catalog(catalog)
 *         .build()) {
 *     service.refine(SimilarityDimension.GENERAL, ids, ProgressCallback.NOOP, token);
 * }
 * </pre>
 */
public class TextureEquivalenceService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TextureEquivalenceService.class);

    private final PixelSource source;
    private final LedgerStore store;
    private final ParallelSweep sweep;
    private final RefinementOptions options;
    private final RefinementWorkflow workflow;
    private final IdenticalPairDetector identicalPairDetector;
    private final ReviewService reviewService;
    private final Map<SimilarityDimension, IdenticalityTolerance> tolerances;

    private TextureEquivalenceService(Builder builder) {
        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.source = CachingPixelSource.wrap(builder.pixelSource, builder.cacheConfig, metrics);
        this.store = new LedgerStore(builder.ledgerLayout);
        this.sweep = new ParallelSweep(builder.parallelism);
        this.options = builder.options;
        this.workflow = new RefinementWorkflow(source, sweep, metrics);
        this.identicalPairDetector = new IdenticalPairDetector(source, sweep);
        this.reviewService = new ReviewService(store, new RepresentativeSelector(builder.catalog), metrics,
                builder.reviewLimit);
        this.tolerances = Map.copyOf(builder.tolerances);
    }

    /**
     * Runs the multi-pass copy detection for one dimension, promotes identical pairs to
     * the certain ledger and writes the suggested classes to the uncertain ledger.
     */
    public RefinementReport refine(SimilarityDimension dimension, Collection<String> ids,
                                   ProgressCallback callback, CancellationToken token) {
        try (LogContext ignored = LogContext.forRefinement(LogContext.generateRunId(), dimension.getKey())) {
            EquivalenceCollection<String> certain = store.readCertain(dimension);
            RefinementResult result = workflow.run(dimension, ids, certain, options, callback, token);

            List<UnorderedPair<String>> identical = identicalPairDetector.detect(
                    result.uncertain().getClasses(), toleranceFor(dimension), callback, token);

            // Nothing is written before this point.
            store.writeUncertain(dimension, result.uncertain());
            if (!identical.isEmpty()) {
                EquivalenceCollection<String> proven = new EquivalenceCollection<>();
                for (UnorderedPair<String> pair : identical) {
                    proven.set(pair.first(), pair.second());
                }
                reviewService.addCertain(dimension, proven);
            }

            log.info("service.refined dimension={} classes={} identicalPairs={}",
                    dimension.getKey(), result.uncertain().getClassCount(), identical.size());
            return new RefinementReport(result, identical);
        }
    }

    public List<ReviewCandidate> getPendingClasses(SimilarityDimension dimension) {
        return reviewService.getPendingClasses(dimension);
    }

    public TriStateLedger acceptCertain(SimilarityDimension dimension, EquivalenceCollection<String> confirmed) {
        return reviewService.acceptCertain(dimension, confirmed);
    }

    public DifferenceCollection<String> updateRejected(SimilarityDimension dimension) {
        return reviewService.updateRejected(dimension);
    }

    public Map<String, String> regenerateRepresentatives(SimilarityDimension dimension) {
        return reviewService.regenerateRepresentatives(dimension);
    }

    public TriStateLedger getLedger(SimilarityDimension dimension) {
        return store.load(dimension);
    }

    /**
     * Returns the representative of {@code id} in the certain ledger, or {@code id} itself.
     */
    public String getRepresentative(SimilarityDimension dimension, String id) {
        return store.readRepresentatives(dimension).getOrDefault(id, id);
    }

    public IdenticalityTolerance toleranceFor(SimilarityDimension dimension) {
        return tolerances.getOrDefault(dimension, IdenticalityTolerance.forDimension(dimension));
    }

    /**
     * Statistics of the decoded image cache, or empty if caching is disabled.
     */
    public Optional<CacheStats> getCacheStats() {
        if (source instanceof CachingPixelSource cached) {
            return Optional.of(cached.getStats());
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        sweep.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PixelSource pixelSource;
        private LedgerLayout ledgerLayout;
        private TextureCatalog catalog = TextureCatalog.empty();
        private MetricsService metricsService;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private RefinementOptions options = RefinementOptions.defaults();
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private int reviewLimit = ReviewService.DEFAULT_REVIEW_LIMIT;
        private final Map<SimilarityDimension, IdenticalityTolerance> tolerances =
                new EnumMap<>(SimilarityDimension.class);

        public Builder pixelSource(PixelSource pixelSource) {
            this.pixelSource = pixelSource;
            return this;
        }

        public Builder ledgerDirectory(Path directory) {
            this.ledgerLayout = new LedgerLayout(directory);
            return this;
        }

        public Builder ledgerLayout(LedgerLayout ledgerLayout) {
            this.ledgerLayout = ledgerLayout;
            return this;
        }

        /**
         * Sets the texture metadata used to pick representatives.
         */
        public Builder catalog(TextureCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder options(RefinementOptions options) {
            this.options = options;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder reviewLimit(int reviewLimit) {
            if (reviewLimit <= 0) {
                throw new IllegalArgumentException("reviewLimit must be positive");
            }
            this.reviewLimit = reviewLimit;
            return this;
        }

        public Builder tolerance(SimilarityDimension dimension, IdenticalityTolerance tolerance) {
            this.tolerances.put(dimension, tolerance);
            return this;
        }

        public TextureEquivalenceService build() {
            Objects.requireNonNull(pixelSource, "pixelSource is required");
            Objects.requireNonNull(ledgerLayout, "ledgerDirectory is required");
            Objects.requireNonNull(catalog, "catalog is required");
            Objects.requireNonNull(options, "options is required");
            return new TextureEquivalenceService(this);
        }
    }
}
