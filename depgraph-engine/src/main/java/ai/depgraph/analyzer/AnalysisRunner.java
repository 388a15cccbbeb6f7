package ai.depgraph.analyzer;

import ai.depgraph.config.AnalyzerConfig;
import ai.depgraph.config.ScopeExcludes;
import ai.depgraph.graph.DependencyGraphBuilder;
import ai.depgraph.graph.PackageResolutionCache;
import ai.depgraph.handler.DependencyHandler;
import ai.depgraph.handler.PackageResolver;
import ai.depgraph.model.Issue;
import ai.depgraph.model.Severity;
import ai.depgraph.util.ExecutorServiceUtil;
import ai.depgraph.util.Issues;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;

/**
 * Runs one package manager over many definition files in parallel, all sharing a single
 * {@link DependencyGraphBuilder} and {@link PackageResolutionCache}.
 *
 * <p>Each definition file is resolved on its own worker. A resolver that throws, or a project that is cancelled or
 * exceeds its time limit, only affects that definition file: it gets a result with one {@link Severity#ERROR}
 * issue, while everything the other projects interned stays in the graph. A runner performs a single run; create a
 * new one for the next analysis.
 *
 * @param <F> the definition file type
 * @param <D> the native dependency node type
 */
@NullMarked
public final class AnalysisRunner<F, D> implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(AnalysisRunner.class);

    private final ProjectResolver<F, D> resolver;
    private final DependencyGraphBuilder<D> builder;
    private final AnalyzerConfig config;
    private final ScopeExcludes excludes;
    private final ExecutorService executor;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);

    public AnalysisRunner(
            ProjectResolver<F, D> resolver,
            DependencyHandler<D> handler,
            PackageResolver packageResolver,
            AnalyzerConfig config) {
        this(resolver, new DependencyGraphBuilder<>(handler, new PackageResolutionCache(packageResolver)), config);
    }

    public AnalysisRunner(ProjectResolver<F, D> resolver, DependencyGraphBuilder<D> builder, AnalyzerConfig config) {
        this.resolver = resolver;
        this.builder = builder;
        this.config = config;
        this.excludes = config.scopeExcludes();
        this.executor = ExecutorServiceUtil.newFixedDaemonExecutor(
                "depgraph-" + resolver.managerName().toLowerCase(Locale.ROOT) + "-",
                config.effectiveParallelism());
    }

    public DependencyGraphBuilder<D> builder() {
        return builder;
    }

    /** Asks all running projects to stop at their next traversal step; projects not yet started are skipped. */
    public void cancel() {
        cancelled.set(true);
    }

    /**
     * Resolves all definition files, then builds the graph.
     *
     * @throws IllegalStateException if this runner has already been used
     */
    public PackageManagerResult<F> run(List<F> definitionFiles) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("AnalysisRunner can only be run once");
        }

        logger.info(
                "Resolving {} definition file(s) with {} using {} worker(s)",
                definitionFiles.size(),
                resolver.managerName(),
                config.effectiveParallelism());

        var futures = new LinkedHashMap<F, Future<List<ProjectAnalyzerResult>>>();
        for (var definitionFile : definitionFiles) {
            futures.put(definitionFile, executor.submit(() -> resolveOne(definitionFile)));
        }

        var results = new LinkedHashMap<F, List<ProjectAnalyzerResult>>();
        for (Map.Entry<F, Future<List<ProjectAnalyzerResult>>> e : futures.entrySet()) {
            results.put(e.getKey(), await(e.getKey(), e.getValue()));
        }

        var graph = builder.build();
        var packages = builder.packages();
        logger.info(
                "{} finished: {} project(s), {} graph node(s), {} package(s)",
                resolver.managerName(),
                results.values().stream().mapToInt(List::size).sum(),
                graph.nodes().size(),
                packages.size());
        return new PackageManagerResult<>(results, graph, packages);
    }

    private List<ProjectAnalyzerResult> resolveOne(F definitionFile) throws Exception {
        long deadline = config.projectTimeoutSeconds() > 0
                ? System.nanoTime() + TimeUnit.SECONDS.toNanos(config.projectTimeoutSeconds())
                : Long.MAX_VALUE;
        BooleanSupplier isCancelled = () -> cancelled.get() || System.nanoTime() > deadline;

        if (isCancelled.getAsBoolean()) {
            throw new CancellationException("Analysis cancelled before " + definitionFile + " was started");
        }

        logger.debug("Resolving {}", definitionFile);
        var context = new ResolutionContext<>(builder, excludes, isCancelled);
        return resolver.resolve(definitionFile, context);
    }

    private List<ProjectAnalyzerResult> await(F definitionFile, Future<List<ProjectAnalyzerResult>> future) {
        var projectId = resolver.fallbackProjectId(definitionFile);
        try {
            return List.copyOf(future.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return List.of(ProjectAnalyzerResult.failed(projectId, cancelledIssue(definitionFile)));
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CancellationException) {
                return List.of(ProjectAnalyzerResult.failed(projectId, cancelledIssue(definitionFile)));
            }
            logger.debug("Resolving {} failed", definitionFile, cause);
            var issue = Issues.createAndLog(
                    resolver.managerName(),
                    Issue.PROJECT_FAILED,
                    "Resolving dependencies for '" + definitionFile + "' failed with: "
                            + cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                    Severity.ERROR);
            return List.of(ProjectAnalyzerResult.failed(projectId, issue));
        }
    }

    private Issue cancelledIssue(F definitionFile) {
        return Issues.createAndLog(
                resolver.managerName(),
                Issue.PROJECT_CANCELLED,
                "Resolving dependencies for '" + definitionFile + "' was cancelled.",
                Severity.ERROR);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
