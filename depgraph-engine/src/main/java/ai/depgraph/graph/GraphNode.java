package ai.depgraph.graph;

import ai.depgraph.model.Identifier;
import ai.depgraph.model.Issue;
import ai.depgraph.model.PackageLinkage;
import java.util.List;

/**
 * One unique node of a {@link DependencyGraph}. Children are referenced by node index.
 *
 * @param index position of the node in the graph's node list; stable once assigned
 * @param identifier the package or project this node represents
 * @param linkage how the node is attached to its parents
 * @param issues distinct issues recorded for this node, in discovery order
 * @param children indices of the direct dependencies, in declaration order
 */
public record GraphNode(
        int index, Identifier identifier, PackageLinkage linkage, List<Issue> issues, List<Integer> children) {

    public GraphNode {
        if (index < 0) {
            throw new IllegalArgumentException("Negative node index " + index);
        }
        issues = List.copyOf(issues);
        children = List.copyOf(children);
    }
}
