package com.platform.prioritizer.service;

import com.platform.prioritizer.domain.AggregationSpec;
import com.platform.prioritizer.domain.EvaluationResult;
import com.platform.prioritizer.domain.FeatureGroupStrategy;
import com.platform.prioritizer.domain.FeatureMatrix;
import com.platform.prioritizer.domain.ModelConfiguration;
import com.platform.prioritizer.domain.ModelGroupKey;
import com.platform.prioritizer.domain.RunManifest;
import com.platform.prioritizer.domain.Split;
import com.platform.prioritizer.domain.WorkUnit;
import com.platform.prioritizer.error.PrioritizerException;
import com.platform.prioritizer.error.ResolutionException;
import com.platform.prioritizer.experiment.ExperimentConfig;
import com.platform.prioritizer.service.FeatureMatrixAssembler.MatrixRequest;
import com.platform.prioritizer.service.ModelGridExpander.Expansion;
import com.platform.prioritizer.service.ModelGridExpander.KeyContext;
import com.platform.prioritizer.store.ManifestWriter;
import com.platform.prioritizer.store.ResultSink;
import com.platform.prioritizer.temporal.TemporalGridBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an experiment end to end: splits, matrices, one work unit per
 * (split, feature group selection, model configuration), and the run manifest.
 * <p>
 * Matrices are built on the calling thread; fitting and evaluation run on a fixed
 * worker pool sized by {@code prioritizer.workers} (0 means one per core). A split's
 * units are submitted only once both of its matrices are complete.
 */
@Service
public class ExperimentService {

    private static final Logger log = LoggerFactory.getLogger(ExperimentService.class);

    private static final int HISTORY_LIMIT = 20;

    private final TemporalGridBuilder gridBuilder;
    private final FeatureAggregationService aggregationService;
    private final FeatureMatrixAssembler matrixAssembler;
    private final ModelGridExpander gridExpander;
    private final ModelTrainingService trainingService;
    private final ResultSink resultSink;
    private final ManifestWriter manifestWriter;
    private final int workers;
    private final double defaultTieTolerance;

    private final Map<String, RunContext> activeRuns = new ConcurrentHashMap<>();
    private final List<RunManifest> runHistory = new CopyOnWriteArrayList<>();

    public ExperimentService(TemporalGridBuilder gridBuilder,
                             FeatureAggregationService aggregationService,
                             FeatureMatrixAssembler matrixAssembler,
                             ModelGridExpander gridExpander,
                             ModelTrainingService trainingService,
                             ResultSink resultSink,
                             ManifestWriter manifestWriter,
                             @Value("${prioritizer.workers:0}") int workers,
                             @Value("${prioritizer.tie-tolerance:0.0}") double defaultTieTolerance) {
        this.gridBuilder = gridBuilder;
        this.aggregationService = aggregationService;
        this.matrixAssembler = matrixAssembler;
        this.gridExpander = gridExpander;
        this.trainingService = trainingService;
        this.resultSink = resultSink;
        this.manifestWriter = manifestWriter;
        this.workers = workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
        this.defaultTieTolerance = defaultTieTolerance;
    }

    public RunManifest run(ExperimentConfig config) {
        return run(UUID.randomUUID().toString().substring(0, 8), config);
    }

    public RunManifest run(String runId, ExperimentConfig config) {
        RunContext context = new RunContext(runId);
        if (activeRuns.putIfAbsent(runId, context) != null) {
            throw new IllegalStateException("Run " + runId + " is already in progress");
        }
        log.info("Run {} started: experiment '{}' with {} workers", runId, config.modelComment(), workers);

        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "prioritizer-" + runId + "-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        List<Future<?>> futures = new ArrayList<>();
        try {
            orchestrate(config, context, executor, futures);
        } catch (PrioritizerException e) {
            log.error("Run {} aborted: {}", runId, e.getMessage(), e);
            context.abort(e);
        } catch (RuntimeException e) {
            log.error("Run {} aborted by an unexpected error", runId, e);
            context.abort(e);
        } finally {
            awaitUnits(context, futures);
            executor.shutdown();
            activeRuns.remove(runId);
        }

        return finish(context);
    }

    /**
     * Records a run that failed before any split was generated, e.g. on an invalid
     * experiment file, so the abort cause still reaches a manifest.
     */
    public RunManifest abortBeforeStart(Throwable cause) {
        RunContext context = new RunContext(UUID.randomUUID().toString().substring(0, 8));
        log.error("Run {} aborted before start: {}", context.runId(), cause.getMessage());
        context.abort(cause);
        return finish(context);
    }

    private RunManifest finish(RunContext context) {
        RunManifest manifest = context.toManifest();
        manifestWriter.write(manifest);
        runHistory.add(0, manifest);
        while (runHistory.size() > HISTORY_LIMIT) runHistory.remove(runHistory.size() - 1);

        log.info("Run {} finished: {} ({} splits, {} units done, {} failed, {} splits skipped, {} results)",
                context.runId(), manifest.status(), manifest.splitCount(), manifest.completedUnits().size(),
                manifest.failedUnits().size(), manifest.skippedSplits().size(), manifest.resultCount());
        return manifest;
    }

    /**
     * Stop a running experiment: units not yet started never start, running units stop at
     * their next stage boundary. Returns false when no such run is active.
     */
    public boolean cancel(String runId) {
        RunContext context = activeRuns.get(runId);
        if (context == null) {
            return false;
        }
        log.info("Cancelling run {}", runId);
        context.cancel();
        return true;
    }

    public Optional<RunContext> activeRun(String runId) {
        return Optional.ofNullable(activeRuns.get(runId));
    }

    public List<RunManifest> getRunHistory() {
        return Collections.unmodifiableList(runHistory);
    }

    // --- Orchestration ---

    private void orchestrate(ExperimentConfig config, RunContext context, ExecutorService executor,
                             List<Future<?>> futures) {
        List<AggregationSpec> specs = aggregationService.resolveChoices(config.featureAggregations());

        Expansion expansion = gridExpander.expand(config.gridConfig());
        expansion.failedClasses().forEach(context::gridFailure);
        List<ModelConfiguration> configurations = expansion.configurations();

        List<Set<String>> selections = selections(config);
        double tieTolerance = config.scoring().tieTolerance() != null
                ? config.scoring().tieTolerance() : defaultTieTolerance;
        FeatureCache cache = new FeatureCache();

        for (Split split : gridBuilder.splits(config.temporalConfig())) {
            if (context.isStopped()) {
                log.info("Run {} stopped; no further splits", context.runId());
                break;
            }
            context.splitStarted();
            log.info("Split {}: {} train dates ending {}, {} test dates", split.id(),
                    split.asOfDatesTrain().size(), split.trainEnd(), split.asOfDatesTest().size());

            for (Set<String> selection : selections) {
                if (context.isStopped()) break;
                SplitMatrices matrices;
                try {
                    matrices = buildMatrices(config, specs, split, selection, cache);
                } catch (ResolutionException e) {
                    log.warn("Skipping split {}: {}", split.id(), e.getMessage());
                    context.skipSplit(split.id(), e.getMessage(), true);
                    break;
                }
                if (matrices.train().isEmpty() || matrices.test().isEmpty()) {
                    String reason = (matrices.train().isEmpty() ? "training" : "test")
                            + " matrix is empty for feature groups " + selection;
                    log.warn("Skipping split {}: {}", split.id(), reason);
                    context.skipSplit(split.id(), reason, false);
                    continue;
                }
                resultSink.cacheMatrix(split.id(), true, matrices.train());
                resultSink.cacheMatrix(split.id(), false, matrices.test());

                submitUnits(config, context, executor, futures, split, selection, matrices,
                        configurations, tieTolerance);
            }
        }
        log.debug("Feature cache: {} hits, {} misses", cache.hits(), cache.misses());
    }

    private record SplitMatrices(FeatureMatrix train, FeatureMatrix test) {}

    private SplitMatrices buildMatrices(ExperimentConfig config, List<AggregationSpec> specs, Split split,
                                        Set<String> selection, FeatureCache cache) {
        FeatureMatrix train = matrixAssembler.assemble(new MatrixRequest(specs, selection,
                config.cohortConfig(), config.labelConfig(), split.asOfDatesTrain(),
                split.labelTimespanTrain(), true), cache);
        FeatureMatrix test = matrixAssembler.assemble(new MatrixRequest(specs, selection,
                config.cohortConfig(), config.labelConfig(), split.asOfDatesTest(),
                split.labelTimespanTest(), false), cache);
        return new SplitMatrices(train, test);
    }

    private void submitUnits(ExperimentConfig config, RunContext context, ExecutorService executor,
                             List<Future<?>> futures, Split split, Set<String> selection,
                             SplitMatrices matrices, List<ModelConfiguration> configurations,
                             double tieTolerance) {
        KeyContext keyContext = new KeyContext(matrices.train().featureNames(), selection,
                config.cohortConfig().name(), ModelGridExpander.DEFAULT_STATE, config.labelConfig().name(),
                split.labelTimespanTrain(), split.trainingAsOfDateFrequency(), split.maxTrainingHistory(),
                config.randomSeed(), config.userMetadata());

        Set<ModelGroupKey> submitted = new HashSet<>();
        for (ModelConfiguration configuration : configurations) {
            ModelGroupKey key = gridExpander.modelGroupKey(configuration, keyContext, config.modelGroupKeys());
            if (!submitted.add(key)) {
                log.debug("Split {}: {} shares model group {} with an earlier configuration",
                        split.id(), configuration.describe(), key);
                continue;
            }
            WorkUnit unit = new WorkUnit(split, configuration, key);
            futures.add(executor.submit(() -> {
                try {
                    List<EvaluationResult> results = trainingService.run(unit, matrices.train(), matrices.test(),
                            config.scoring(), tieTolerance, config.randomSeed(), context::isStopped);
                    context.record(unit, results);
                } catch (PrioritizerException e) {
                    context.abort(e);
                    throw e;
                }
            }));
        }
    }

    private static List<Set<String>> selections(ExperimentConfig config) {
        Set<Set<String>> selections = new LinkedHashSet<>();
        for (FeatureGroupStrategy strategy : config.featureGroupStrategies()) {
            selections.addAll(strategy.select(config.featureGroupDefinition().prefix()));
        }
        return new ArrayList<>(selections);
    }

    private static void awaitUnits(RunContext context, List<Future<?>> futures) {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                log.error("Run {} aborted by a worker", context.runId(), cause);
                context.abort(cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.abort(e);
                break;
            }
        }
    }
}
