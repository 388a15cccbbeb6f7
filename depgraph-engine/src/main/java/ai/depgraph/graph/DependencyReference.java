package ai.depgraph.graph;

import ai.depgraph.model.Identifier;
import ai.depgraph.model.Issue;
import ai.depgraph.model.PackageLinkage;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.NullMarked;
import org.pcollections.PSet;

/**
 * One occurrence of a graph node in a scope's reference tree.
 *
 * <p>Children are not materialized up front; {@link #dependencies()} derives them from the immutable graph on every
 * call. Each reference knows the node indices on its path from the scope root. A child that is already on that path
 * is returned as a cycle marker: it reports {@link #isCycle()} and has no dependencies.
 */
@NullMarked
public final class DependencyReference {
    private final DependencyGraph graph;
    private final int nodeIndex;
    private final PSet<Integer> ancestors;
    private final boolean cycle;

    DependencyReference(DependencyGraph graph, int nodeIndex, PSet<Integer> ancestors, boolean cycle) {
        this.graph = graph;
        this.nodeIndex = nodeIndex;
        this.ancestors = ancestors;
        this.cycle = cycle;
    }

    public int nodeIndex() {
        return nodeIndex;
    }

    public Identifier id() {
        return graph.node(nodeIndex).identifier();
    }

    public PackageLinkage linkage() {
        return graph.node(nodeIndex).linkage();
    }

    public List<Issue> issues() {
        return graph.node(nodeIndex).issues();
    }

    /** True if this occurrence closes a cycle, i.e. the same node already appears above it. */
    public boolean isCycle() {
        return cycle;
    }

    /** Number of ancestors between this reference and its scope. */
    public int depth() {
        return ancestors.size();
    }

    public List<DependencyReference> dependencies() {
        if (cycle) {
            return List.of();
        }

        var path = ancestors.plus(nodeIndex);
        return graph.node(nodeIndex).children().stream()
                .map(child -> new DependencyReference(graph, child, path, path.contains(child)))
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public String toString() {
        return id().toCoordinates() + (cycle ? " (cycle)" : "");
    }
}
