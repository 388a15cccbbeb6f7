package ai.depgraph.graph;

import ai.depgraph.handler.DependencyHandler;
import ai.depgraph.handler.PackageResolver;
import ai.depgraph.model.Identifier;
import ai.depgraph.model.Issue;
import ai.depgraph.model.Package;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Fuses the native dependency trees of many projects into one {@link DependencyGraph}.
 *
 * <p>One builder is shared by all projects of an analysis run, possibly from several worker threads. Each call to
 * {@link #addDependency} walks one native subtree post-order through the {@link DependencyHandler}, interning
 * children before their parent so that structurally identical subtrees collapse into the same nodes. Every package
 * identifier met during the walk is resolved once through the shared {@link PackageResolutionCache}.
 *
 * <p>Lifecycle: {@code ACCUMULATING -> BUILT}. After {@link #build()} any attempt to add dependencies fails with an
 * {@link IllegalStateException}; the built graph stays unchanged.
 *
 * @param <D> the native dependency node type
 */
@NullMarked
public final class DependencyGraphBuilder<D> {
    private static final Logger logger = LogManager.getLogger(DependencyGraphBuilder.class);

    public enum State {
        ACCUMULATING,
        BUILT
    }

    private final DependencyHandler<D> handler;
    private final PackageResolutionCache cache;
    private final NodeTable table = new NodeTable();
    private final Set<Identifier> identifiers = ConcurrentHashMap.newKeySet();

    private final Object scopeLock = new Object();

    // guarded by scopeLock
    private final Map<String, List<Integer>> scopes = new LinkedHashMap<>();
    private volatile State state = State.ACCUMULATING;
    private @Nullable DependencyGraph graph;

    public DependencyGraphBuilder(DependencyHandler<D> handler, PackageResolutionCache cache) {
        this.handler = Objects.requireNonNull(handler);
        this.cache = Objects.requireNonNull(cache);
    }

    public DependencyGraphBuilder(DependencyHandler<D> handler, PackageResolver resolver) {
        this(handler, new PackageResolutionCache(resolver));
    }

    public State state() {
        return state;
    }

    /**
     * Adds the subtree rooted at {@code root} as the next direct dependency of {@code qualifiedScope}, creating the
     * scope if necessary.
     *
     * @throws IllegalStateException if {@link #build()} has already been called
     */
    public void addDependency(String qualifiedScope, D root) {
        addDependency(qualifiedScope, root, () -> false);
    }

    /**
     * Like {@link #addDependency(String, Object)}, but checks {@code isCancelled} before every visited node. On
     * cancellation the traversal stops with a {@link CancellationException}; nodes interned up to that point remain
     * valid but no root is added to the scope.
     */
    public void addDependency(String qualifiedScope, D root, BooleanSupplier isCancelled) {
        Objects.requireNonNull(qualifiedScope);
        Objects.requireNonNull(root);
        checkAccumulating();

        var traversal = new Traversal(isCancelled);
        int index = traversal.visitRoot(root);

        synchronized (scopeLock) {
            checkAccumulating();
            scopes.computeIfAbsent(qualifiedScope, k -> new ArrayList<>()).add(index);
        }

        if (logger.isTraceEnabled()) {
            logger.trace(
                    "Added {} to scope {} as node {} (visited={}, backEdges={})",
                    handler.identifierFor(root),
                    qualifiedScope,
                    index,
                    traversal.visited,
                    traversal.backEdges);
        }
    }

    /**
     * Registers the scope {@code scopeName} of project {@code projectId}, even if {@code roots} is empty, and adds
     * all roots to it in order.
     */
    public void addDependencies(Identifier projectId, String scopeName, List<D> roots) {
        addDependencies(projectId, scopeName, roots, () -> false);
    }

    public void addDependencies(Identifier projectId, String scopeName, List<D> roots, BooleanSupplier isCancelled) {
        if (isCancelled.getAsBoolean()) {
            throw new CancellationException("Dependency traversal cancelled");
        }
        var qualifiedScope = DependencyGraph.qualifyScope(projectId, scopeName);
        synchronized (scopeLock) {
            checkAccumulating();
            scopes.computeIfAbsent(qualifiedScope, k -> new ArrayList<>());
        }
        for (var root : roots) {
            addDependency(qualifiedScope, root, isCancelled);
        }
    }

    /** Unqualified names of the scopes registered for {@code projectId}, in the order they were first added. */
    public List<String> scopesFor(Identifier projectId) {
        synchronized (scopeLock) {
            return DependencyGraph.scopesFor(projectId, scopes.keySet());
        }
    }

    /** Number of distinct nodes interned so far. */
    public int nodeCount() {
        return table.size();
    }

    /**
     * The resolved packages of all identifiers present in the graph so far, sorted by identifier. Identifiers whose
     * resolution failed are not included. Can be called while accumulating and after {@link #build()}.
     */
    public Set<Package> packages() {
        return cache.packages(identifiers);
    }

    /** Identifiers present in the graph whose metadata could not be resolved. */
    public Map<Identifier, Issue> unresolvedPackages() {
        var failures = new LinkedHashMap<Identifier, Issue>();
        cache.failures().forEach((id, issue) -> {
            if (identifiers.contains(id)) {
                failures.put(id, issue);
            }
        });
        return Collections.unmodifiableMap(failures);
    }

    /**
     * Freezes the node table and scope map into an immutable graph. Calling this again returns the same graph.
     */
    public DependencyGraph build() {
        synchronized (scopeLock) {
            if (graph != null) {
                return graph;
            }

            state = State.BUILT;
            var nodes = table.freeze();
            var frozenScopes = new LinkedHashMap<String, List<Integer>>();
            scopes.forEach((name, roots) -> frozenScopes.put(name, List.copyOf(roots)));

            var built = new DependencyGraph(nodes, frozenScopes);
            graph = built;
            logger.debug(
                    "Built dependency graph with {} nodes, {} scopes and {} distinct identifiers",
                    nodes.size(),
                    frozenScopes.size(),
                    identifiers.size());
            return built;
        }
    }

    private void checkAccumulating() {
        if (state != State.ACCUMULATING) {
            throw new IllegalStateException(
                    "Dependency graph has already been built; no more dependencies can be added");
        }
    }

    /** Outcome of visiting one native node. */
    private sealed interface Visit permits Closed, BackEdge, Pending {}

    /** The node and its whole subtree are in the table. */
    private record Closed(int index) implements Visit {}

    /** The node is an ancestor on the current path, at {@code targetDepth}. */
    private record BackEdge(int targetDepth) implements Visit {}

    /**
     * The node is on a cycle whose topmost member is still being visited. {@code issues} and {@code identifiers}
     * follow the pre-order of {@code shape}; {@code reach} is the shallowest path depth its back edges point to.
     */
    private record Pending(
            NodeTable.CycleShape shape, List<List<Issue>> issues, List<Identifier> identifiers, int reach)
            implements Visit {}

    private static int reachOf(Visit visit) {
        if (visit instanceof BackEdge back) {
            return back.targetDepth();
        }
        if (visit instanceof Pending pending) {
            return pending.reach();
        }
        return Integer.MAX_VALUE;
    }

    /**
     * State of one {@link #addDependency} call. Native nodes are tracked by identity. Nodes that end up on a cycle
     * are interned together once the traversal returns to the topmost member of that cycle; until then they are not
     * in the table, so a cancelled traversal leaves no partial cycle behind.
     */
    private final class Traversal {
        private final BooleanSupplier isCancelled;
        private final Map<D, Integer> completed = new IdentityHashMap<>();
        private final Map<D, Integer> onPath = new IdentityHashMap<>();
        int visited;
        int backEdges;

        Traversal(BooleanSupplier isCancelled) {
            this.isCancelled = isCancelled;
        }

        int visitRoot(D root) {
            var visit = visit(root, 0);
            if (visit instanceof Closed closed) {
                return closed.index();
            }
            throw new IllegalStateException(
                    "Traversal of " + handler.identifierFor(root) + " ended inside an open cycle: " + visit);
        }

        private Visit visit(D node, int depth) {
            if (isCancelled.getAsBoolean()) {
                throw new CancellationException("Dependency traversal cancelled");
            }

            var done = completed.get(node);
            if (done != null) {
                return new Closed(done);
            }

            var ancestorDepth = onPath.get(node);
            if (ancestorDepth != null) {
                backEdges++;
                return new BackEdge(ancestorDepth);
            }

            var id = handler.identifierFor(node);
            var linkage = handler.linkageFor(node);

            visited++;
            onPath.put(node, depth);
            try {
                var children = new ArrayList<Visit>();
                int reach = Integer.MAX_VALUE;
                for (var child : handler.childrenFor(node)) {
                    var visit = visit(child, depth + 1);
                    children.add(visit);
                    reach = Math.min(reach, reachOf(visit));
                }

                List<Issue> issues = new ArrayList<>(handler.issuesFor(node));
                if (!linkage.isProjectLinkage()) {
                    cache.resolve(id).failure().ifPresent(issues::add);
                }

                if (reach == Integer.MAX_VALUE) {
                    var childIndices = children.stream().map(v -> ((Closed) v).index()).toList();
                    int index = table.intern(id, linkage, childIndices, issues);
                    identifiers.add(id);
                    completed.put(node, index);
                    return new Closed(index);
                }

                var links = new ArrayList<NodeTable.Link>(children.size());
                var cycleIssues = new ArrayList<List<Issue>>();
                var cycleIdentifiers = new ArrayList<Identifier>();
                cycleIssues.add(issues);
                cycleIdentifiers.add(id);
                for (var visit : children) {
                    if (visit instanceof Closed closed) {
                        links.add(new NodeTable.Interned(closed.index()));
                    } else if (visit instanceof BackEdge back) {
                        links.add(new NodeTable.Back(depth - back.targetDepth()));
                    } else if (visit instanceof Pending pending) {
                        links.add(new NodeTable.Open(pending.shape()));
                        cycleIssues.addAll(pending.issues());
                        cycleIdentifiers.addAll(pending.identifiers());
                    }
                }
                var shape = new NodeTable.CycleShape(id, linkage, links);

                if (reach < depth) {
                    return new Pending(shape, cycleIssues, cycleIdentifiers, reach);
                }

                // every back edge below points at this node or deeper: the cycle is complete
                int index = table.internCycle(shape, cycleIssues);
                identifiers.addAll(cycleIdentifiers);
                completed.put(node, index);
                return new Closed(index);
            } finally {
                onPath.remove(node);
            }
        }
    }
}
