package ai.depgraph.graph;

import ai.depgraph.handler.PackageResolutionException;
import ai.depgraph.handler.PackageResolver;
import ai.depgraph.model.Identifier;
import ai.depgraph.model.Issue;
import ai.depgraph.model.Package;
import ai.depgraph.model.Severity;
import ai.depgraph.util.Issues;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;

/**
 * Memoizes package metadata lookups per {@link Identifier}.
 *
 * <p>The first caller for an identifier runs the {@link PackageResolver}; concurrent callers for the same identifier
 * block on the first caller's future and receive the same {@link Resolution} instance. Results, including failures,
 * are kept for the lifetime of the cache and never recomputed. Resolver failures never propagate: they become a
 * {@link Resolution} carrying an issue of kind {@link Issue#RESOLUTION_FAILED}. The exception is an {@link Error}
 * thrown by the resolver: it reaches the caller and any concurrent waiters, and nothing is cached for the identifier.
 */
@NullMarked
public final class PackageResolutionCache {
    private static final Logger logger = LogManager.getLogger(PackageResolutionCache.class);

    public static final String SOURCE = "PackageResolutionCache";

    private final PackageResolver resolver;
    private final ConcurrentHashMap<Identifier, CompletableFuture<Resolution>> results = new ConcurrentHashMap<>();
    private final AtomicInteger computations = new AtomicInteger();

    public PackageResolutionCache(PackageResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver);
    }

    /**
     * Returns the resolution for {@code id}, computing it if this is the first request. Blocks while another thread
     * is computing the same identifier.
     */
    public Resolution resolve(Identifier id) {
        var mine = new CompletableFuture<Resolution>();
        var existing = results.putIfAbsent(id, mine);
        if (existing != null) {
            try {
                return existing.join();
            } catch (CompletionException e) {
                throw unwrap(e);
            }
        }

        try {
            var resolution = compute(id);
            mine.complete(resolution);
            return resolution;
        } catch (Throwable t) {
            // not a resolution: the next request for this identifier runs the resolver again
            results.remove(id, mine);
            logger.warn("Resolver crashed for {} with {}; it will be retried on the next request", id, t.toString());
            mine.completeExceptionally(t);
            throw t;
        }
    }

    private static RuntimeException unwrap(CompletionException e) {
        var cause = e.getCause();
        if (cause instanceof Error error) {
            throw error;
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return e;
    }

    private Resolution compute(Identifier id) {
        computations.incrementAndGet();
        try {
            var pkg = resolver.resolve(id);
            if (pkg == null) {
                return failure(id, "Resolver returned no metadata for '" + id.toCoordinates() + "'.");
            }
            if (!pkg.id().equals(id)) {
                logger.warn("Resolver returned package {} for requested {}; keeping requested id", pkg.id(), id);
                pkg = new Package(
                        id,
                        pkg.declaredLicenses(),
                        pkg.authors(),
                        pkg.description(),
                        pkg.homepageUrl(),
                        pkg.binaryArtifact(),
                        pkg.sourceArtifact(),
                        pkg.vcs());
            }
            return Resolution.resolved(pkg);
        } catch (PackageResolutionException e) {
            return failure(id, "Could not resolve '" + id.toCoordinates() + "': " + e.getMessage());
        } catch (RuntimeException e) {
            logger.debug("Resolver crashed for {}", id, e);
            return failure(
                    id,
                    "Could not resolve '" + id.toCoordinates() + "': " + e.getClass().getSimpleName() + ": "
                            + e.getMessage());
        }
    }

    private static Resolution failure(Identifier id, String message) {
        return Resolution.failed(id, Issues.createAndLog(SOURCE, Issue.RESOLUTION_FAILED, message, Severity.WARNING));
    }

    /** Whether a resolution for {@code id} has completed, successfully or not. */
    public boolean isResolved(Identifier id) {
        var future = results.get(id);
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    /** How many times the underlying resolver has been invoked. */
    public int computationCount() {
        return computations.get();
    }

    /** All successfully resolved packages, sorted by identifier. */
    public Set<Package> packages() {
        return completed().values().stream()
                .map(Resolution::pkg)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(Package::id))
                .collect(ImmutableSet.toImmutableSet());
    }

    /** Successfully resolved packages restricted to {@code ids}, sorted by identifier. */
    public Set<Package> packages(Collection<Identifier> ids) {
        var wanted = Set.copyOf(ids);
        return packages().stream().filter(p -> wanted.contains(p.id())).collect(ImmutableSet.toImmutableSet());
    }

    /** Identifiers whose resolution definitively failed, with the issue describing the failure. */
    public Map<Identifier, Issue> failures() {
        var builder = ImmutableMap.<Identifier, Issue>builder();
        completed().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> e.getValue().failure().ifPresent(issue -> builder.put(e.getKey(), issue)));
        return builder.build();
    }

    private Map<Identifier, Resolution> completed() {
        var snapshot = new HashMap<Identifier, Resolution>();
        results.forEach((id, future) -> {
            if (future.isDone() && !future.isCompletedExceptionally()) {
                snapshot.put(id, future.join());
            }
        });
        return snapshot;
    }
}
