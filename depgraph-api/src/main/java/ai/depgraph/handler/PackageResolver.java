package ai.depgraph.handler;

import ai.depgraph.model.Identifier;
import ai.depgraph.model.Package;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Looks up the metadata of a single package, typically by reading a manifest or querying a registry. This is the
 * only place where an ecosystem plugin performs I/O on behalf of the graph engine.
 */
@NullMarked
@FunctionalInterface
public interface PackageResolver {

    /**
     * @return the package, or null if the resolver has nothing to say about {@code id}; the engine records that as
     *     a failed resolution
     * @throws PackageResolutionException if the metadata cannot be obtained
     */
    @Nullable
    Package resolve(Identifier id) throws PackageResolutionException;
}
