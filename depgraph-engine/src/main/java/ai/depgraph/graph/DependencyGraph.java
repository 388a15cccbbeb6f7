package ai.depgraph.graph;

import ai.depgraph.model.Identifier;
import ai.depgraph.model.Issue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.NullMarked;
import org.pcollections.HashTreePSet;

/**
 * The immutable result of a {@link DependencyGraphBuilder}: a list of unique nodes plus a mapping from qualified
 * scope names to the indices of their direct dependencies.
 *
 * <p>Scope names are qualified with the owning project, see {@link #qualifyScope(Identifier, String)}. Nothing in
 * the graph refers back to native ecosystem types, so it can be serialized and read back by downstream consumers.
 */
@NullMarked
public final class DependencyGraph {
    private static final char SCOPE_SEPARATOR = ':';

    /** A parent-to-child relation between two nodes. */
    public record Edge(int from, int to) {}

    private final List<GraphNode> nodes;
    private final Map<String, List<Integer>> scopes;

    /**
     * @throws IllegalArgumentException if node indices do not match their positions, or any child or root index
     *     does not refer to a node
     */
    public DependencyGraph(List<GraphNode> nodes, Map<String, List<Integer>> scopes) {
        this.nodes = List.copyOf(nodes);
        var scopeCopy = new LinkedHashMap<String, List<Integer>>();
        scopes.forEach((name, roots) -> scopeCopy.put(name, List.copyOf(roots)));
        this.scopes = Collections.unmodifiableMap(scopeCopy);
        validate();
    }

    private void validate() {
        for (int i = 0; i < nodes.size(); i++) {
            var node = nodes.get(i);
            if (node.index() != i) {
                throw new IllegalArgumentException("Node at position " + i + " has index " + node.index());
            }
            node.children().forEach(c -> checkIndex(c, "child of node " + node.index()));
        }
        scopes.forEach((name, roots) -> roots.forEach(r -> checkIndex(r, "root of scope " + name)));
    }

    private void checkIndex(int index, String role) {
        if (index < 0 || index >= nodes.size()) {
            throw new IllegalArgumentException("Invalid node index " + index + " as " + role);
        }
    }

    /** Returns {@code namespace:name:version:scopeName}, which is unique across all projects of an analysis. */
    public static String qualifyScope(Identifier projectId, String scopeName) {
        return scopePrefix(projectId) + scopeName;
    }

    /**
     * Strips the project part from a qualified scope name; unqualified names are returned unchanged.
     *
     * <p>The project part is taken to end at the third colon, which is only right if the project's namespace, name
     * and version contain no colons. Use {@link #unqualifyScope(Identifier, String)} when the project is known.
     */
    public static String unqualifyScope(String qualifiedScope) {
        int separators = 0;
        for (int i = 0; i < qualifiedScope.length(); i++) {
            if (qualifiedScope.charAt(i) == SCOPE_SEPARATOR && ++separators == 3) {
                return qualifiedScope.substring(i + 1);
            }
        }
        return qualifiedScope;
    }

    /**
     * Strips the prefix of {@code projectId} from a qualified scope name. Works for any version, including ones with
     * colons such as Debian epochs.
     *
     * @throws IllegalArgumentException if the scope does not belong to {@code projectId}
     */
    public static String unqualifyScope(Identifier projectId, String qualifiedScope) {
        var prefix = scopePrefix(projectId);
        if (!qualifiedScope.startsWith(prefix)) {
            throw new IllegalArgumentException("Scope '" + qualifiedScope + "' does not belong to " + projectId);
        }
        return qualifiedScope.substring(prefix.length());
    }

    private static String scopePrefix(Identifier projectId) {
        return projectId.namespace() + SCOPE_SEPARATOR + projectId.name() + SCOPE_SEPARATOR + projectId.version()
                + SCOPE_SEPARATOR;
    }

    static List<String> scopesFor(Identifier projectId, Collection<String> qualifiedScopes) {
        var prefix = scopePrefix(projectId);
        return qualifiedScopes.stream()
                .filter(s -> s.startsWith(prefix))
                .map(s -> s.substring(prefix.length()))
                .collect(ImmutableList.toImmutableList());
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    public GraphNode node(int index) {
        return nodes.get(index);
    }

    public Map<String, List<Integer>> scopes() {
        return scopes;
    }

    public Set<String> scopeNames() {
        return scopes.keySet();
    }

    /** Root node indices of a qualified scope, in declaration order; empty for unknown scopes. */
    public List<Integer> scopeRoots(String qualifiedScope) {
        return scopes.getOrDefault(qualifiedScope, List.of());
    }

    /** Unqualified scope names of one project, in the order the scopes were created. */
    public List<String> scopesFor(Identifier projectId) {
        return scopesFor(projectId, scopes.keySet());
    }

    /** All parent-to-child relations, ordered by parent index and then child position. */
    public List<Edge> edges() {
        var edges = new ArrayList<Edge>();
        for (var node : nodes) {
            for (int child : node.children()) {
                edges.add(new Edge(node.index(), child));
            }
        }
        return Collections.unmodifiableList(edges);
    }

    /** Distinct identifiers in node order. */
    public Set<Identifier> identifiers() {
        return nodes.stream().map(GraphNode::identifier).collect(ImmutableSet.toImmutableSet());
    }

    /**
     * Returns the direct dependencies of a scope as lazily expanded references. Each reference computes its children
     * on demand from this graph, so the tree can be walked any number of times.
     *
     * @throws IllegalArgumentException if the scope does not exist
     */
    public List<DependencyReference> referenceTreeFor(String qualifiedScope) {
        var roots = scopes.get(qualifiedScope);
        if (roots == null) {
            throw new IllegalArgumentException("Unknown scope '" + qualifiedScope + "'");
        }
        return roots.stream()
                .map(r -> new DependencyReference(this, r, HashTreePSet.empty(), false))
                .collect(ImmutableList.toImmutableList());
    }

    /** Distinct issues of all nodes reachable from the given scopes, in breadth-first order. */
    public List<Issue> issuesFor(Collection<String> qualifiedScopes) {
        var seen = new BitSet(nodes.size());
        var queue = new ArrayDeque<Integer>();
        for (var scope : qualifiedScopes) {
            for (int root : scopeRoots(scope)) {
                if (!seen.get(root)) {
                    seen.set(root);
                    queue.add(root);
                }
            }
        }

        var issues = new LinkedHashSet<Issue>();
        while (!queue.isEmpty()) {
            var node = nodes.get(queue.poll());
            issues.addAll(node.issues());
            for (int child : node.children()) {
                if (!seen.get(child)) {
                    seen.set(child);
                    queue.add(child);
                }
            }
        }
        return List.copyOf(issues);
    }

    @Override
    public String toString() {
        return "DependencyGraph[nodes=" + nodes.size() + ", scopes=" + scopes.size() + "]";
    }
}
