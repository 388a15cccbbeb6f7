package ai.depgraph.analyzer;

import ai.depgraph.config.ScopeExcludes;
import ai.depgraph.graph.DependencyGraph;
import ai.depgraph.graph.DependencyGraphBuilder;
import ai.depgraph.model.Identifier;
import ai.depgraph.model.Package;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * What a {@link ProjectResolver} sees of the running analysis for one definition file: the shared builder, wrapped
 * so that excluded scopes never reach it and the project's cancellation flag is honored.
 */
public final class ResolutionContext<D> {
    private static final Logger logger = LogManager.getLogger(ResolutionContext.class);

    private final DependencyGraphBuilder<D> builder;
    private final ScopeExcludes excludes;
    private final BooleanSupplier isCancelled;

    public ResolutionContext(DependencyGraphBuilder<D> builder, ScopeExcludes excludes, BooleanSupplier isCancelled) {
        this.builder = builder;
        this.excludes = excludes;
        this.isCancelled = isCancelled;
    }

    public boolean isScopeExcluded(String scopeName) {
        return excludes.isScopeExcluded(scopeName);
    }

    /**
     * Adds one direct dependency of a project scope. Does nothing if the scope is excluded.
     *
     * @return false if the scope was excluded
     */
    public boolean addDependency(Identifier projectId, String scopeName, D root) {
        if (skip(projectId, scopeName)) {
            return false;
        }
        builder.addDependency(DependencyGraph.qualifyScope(projectId, scopeName), root, isCancelled);
        return true;
    }

    /**
     * Registers a project scope with all its direct dependencies, even if there are none. Does nothing if the scope
     * is excluded.
     *
     * @return false if the scope was excluded
     */
    public boolean addDependencies(Identifier projectId, String scopeName, List<D> roots) {
        if (skip(projectId, scopeName)) {
            return false;
        }
        builder.addDependencies(projectId, scopeName, roots, isCancelled);
        return true;
    }

    public List<String> scopesFor(Identifier projectId) {
        return builder.scopesFor(projectId);
    }

    /** Packages resolved so far, e.g. to find the ones a project added. */
    public Set<Package> packages() {
        return builder.packages();
    }

    public boolean isCancelled() {
        return isCancelled.getAsBoolean();
    }

    /** Throws a {@link CancellationException} if this project has been cancelled. */
    public void checkCancelled() {
        if (isCancelled.getAsBoolean()) {
            throw new CancellationException("Project resolution cancelled");
        }
    }

    private boolean skip(Identifier projectId, String scopeName) {
        if (excludes.isScopeExcluded(scopeName)) {
            logger.debug("Skipping excluded scope '{}' of {}", scopeName, projectId);
            return true;
        }
        return false;
    }
}
