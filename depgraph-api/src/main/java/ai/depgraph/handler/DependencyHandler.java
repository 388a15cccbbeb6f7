package ai.depgraph.handler;

import ai.depgraph.model.Identifier;
import ai.depgraph.model.Issue;
import ai.depgraph.model.PackageLinkage;
import java.util.List;
import org.jspecify.annotations.NullMarked;

/**
 * Adapter between an ecosystem's native dependency tree and the graph builder. One implementation exists per
 * ecosystem (Maven's Aether nodes, pnpm module infos, ...); the builder never looks at a native node other than
 * through these methods.
 *
 * <p>Implementations must not perform I/O or mutate shared state here. Expensive metadata lookups belong in a
 * {@link PackageResolver}.
 *
 * @param <D> the native dependency node type
 */
@NullMarked
public interface DependencyHandler<D> {

    /** The identifier of the package or project represented by the node. */
    Identifier identifierFor(D dependency);

    /** How the node is linked to its parent. */
    PackageLinkage linkageFor(D dependency);

    /** The direct children of the node, in declaration order. */
    List<D> childrenFor(D dependency);

    /** Issues discovered while inspecting the node, e.g. an unresolvable version. */
    default List<Issue> issuesFor(D dependency) {
        return List.of();
    }
}
