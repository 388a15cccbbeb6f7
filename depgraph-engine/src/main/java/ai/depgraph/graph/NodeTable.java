package ai.depgraph.graph;

import ai.depgraph.model.Identifier;
import ai.depgraph.model.Issue;
import ai.depgraph.model.PackageLinkage;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;

/**
 * Deduplicating store of graph nodes, keyed by the structural fingerprint {@code (identifier, linkage, child
 * indices)}.
 *
 * <p>This is the only place node storage is mutated. Every operation runs under one table-wide lock, so the
 * check-and-insert in {@link #intern} is atomic: no two nodes are ever created for the same fingerprint. Indices are
 * handed out sequentially and never change or get reused.
 *
 * <p>Nodes on a dependency cycle cannot be fingerprinted by child indices, since at least one child is an ancestor
 * that has no index yet. Such a cycle is interned as a whole with {@link #internCycle}, keyed by a {@link CycleShape}
 * in which back edges are relative to the node that owns them.
 */
@NullMarked
final class NodeTable {
    private static final Logger logger = LogManager.getLogger(NodeTable.class);

    record Fingerprint(Identifier identifier, PackageLinkage linkage, List<Integer> children) {}

    /** A child link inside a {@link CycleShape}. */
    sealed interface Link permits Interned, Back, Open {}

    /** A child that is already in the table. */
    record Interned(int index) implements Link {}

    /** A back edge to the ancestor {@code up} levels above the owning node; {@code 0} is the owner itself. */
    record Back(int up) implements Link {
        Back {
            if (up < 0) {
                throw new IllegalArgumentException("Negative back edge distance: " + up);
            }
        }
    }

    /** A child that is itself part of the cycle. */
    record Open(CycleShape shape) implements Link {}

    /**
     * Position-independent structure of a cyclic subtree. Two occurrences of the same cycle produce equal shapes no
     * matter where in the table their acyclic children live or in which scope they were found.
     */
    record CycleShape(Identifier identifier, PackageLinkage linkage, List<Link> children) {
        CycleShape {
            children = List.copyOf(children);
        }

        /** Number of nodes in the shape, i.e. the length of its pre-order. */
        int size() {
            int size = 1;
            for (var link : children) {
                if (link instanceof Open open) {
                    size += open.shape().size();
                }
            }
            return size;
        }
    }

    private static final class Entry {
        final Identifier identifier;
        final PackageLinkage linkage;
        List<Integer> children;
        final LinkedHashSet<Issue> issues = new LinkedHashSet<>();

        Entry(Identifier identifier, PackageLinkage linkage, List<Integer> children) {
            this.identifier = identifier;
            this.linkage = linkage;
            this.children = children;
        }

        GraphNode toNode(int index) {
            return new GraphNode(index, identifier, linkage, List.copyOf(issues), children);
        }
    }

    private final Object lock = new Object();

    // guarded by lock
    private final List<Entry> entries = new ArrayList<>();
    private final Map<Fingerprint, Integer> byFingerprint = new HashMap<>();
    private final Map<CycleShape, List<Integer>> byCycle = new HashMap<>();
    private boolean frozen;

    /**
     * Returns the index of the node with the given fingerprint, inserting it if it does not exist yet. Issues that
     * are exact duplicates of issues already recorded for the node are dropped; all others are appended.
     *
     * @throws IllegalStateException if the table has been frozen
     * @throws IllegalArgumentException if a child index does not refer to an existing node
     */
    int intern(Identifier identifier, PackageLinkage linkage, List<Integer> children, Collection<Issue> issues) {
        var childIndices = List.copyOf(children);
        var fingerprint = new Fingerprint(identifier, linkage, childIndices);

        synchronized (lock) {
            checkNotFrozen();
            checkChildren(childIndices);

            var existing = byFingerprint.get(fingerprint);
            if (existing != null) {
                entries.get(existing).issues.addAll(issues);
                return existing;
            }

            int index = entries.size();
            var entry = new Entry(identifier, linkage, childIndices);
            entry.issues.addAll(issues);
            entries.add(entry);
            byFingerprint.put(fingerprint, index);
            return index;
        }
    }

    /**
     * Returns the index of the root of a cyclic subtree, inserting all of its nodes if an equal shape has not been
     * interned before. {@code issues} holds one collection per shape node in pre-order; they are merged with exact
     * duplicate suppression like in {@link #intern}.
     *
     * @throws IllegalStateException if the table has been frozen
     * @throws IllegalArgumentException if the shape refers to unknown nodes or to ancestors outside itself, or if
     *     the number of issue collections does not match the shape
     */
    int internCycle(CycleShape shape, List<? extends Collection<Issue>> issues) {
        if (issues.size() != shape.size()) {
            throw new IllegalArgumentException(
                    "Expected " + shape.size() + " issue lists for cycle of " + shape.identifier() + " but got "
                            + issues.size());
        }

        synchronized (lock) {
            checkNotFrozen();

            var indices = byCycle.get(shape);
            if (indices == null) {
                checkShape(shape, 0);
                var allocated = new ArrayList<Integer>(issues.size());
                allocate(shape, new ArrayList<>(), allocated);
                indices = List.copyOf(allocated);
                byCycle.put(shape, indices);
                registerRotations(indices);
                logger.trace("Interned cycle of {} as nodes {}", shape.identifier(), indices);
            }

            for (int i = 0; i < indices.size(); i++) {
                entries.get(indices.get(i)).issues.addAll(issues.get(i));
            }
            return indices.get(0);
        }
    }

    // guarded by lock
    private int allocate(CycleShape shape, List<Integer> path, List<Integer> preorder) {
        int index = entries.size();
        var entry = new Entry(shape.identifier(), shape.linkage(), List.of());
        entries.add(entry);
        preorder.add(index);

        path.add(index);
        var children = new ArrayList<Integer>(shape.children().size());
        for (var link : shape.children()) {
            if (link instanceof Interned interned) {
                children.add(interned.index());
            } else if (link instanceof Back back) {
                children.add(path.get(path.size() - 1 - back.up()));
            } else if (link instanceof Open open) {
                children.add(allocate(open.shape(), path, preorder));
            }
        }
        path.remove(path.size() - 1);

        entry.children = List.copyOf(children);
        byFingerprint.putIfAbsent(new Fingerprint(entry.identifier, entry.linkage, entry.children), index);
        return index;
    }

    private record Step(Link link, int reach) {}

    // guarded by lock
    /**
     * Registers the shape of the cycle as seen from each of its other members, so that a traversal entering the same
     * cycle at a different node finds the existing nodes.
     */
    private void registerRotations(List<Integer> members) {
        var memberSet = new HashSet<>(members);
        for (int member : members.subList(1, members.size())) {
            var preorder = new ArrayList<Integer>();
            var step = walk(member, memberSet, new HashMap<>(), preorder);
            if (step.link() instanceof Open open && step.reach() == 0) {
                byCycle.putIfAbsent(open.shape(), List.copyOf(preorder));
            }
        }
    }

    // guarded by lock
    /** Re-derives the link a traversal would produce for {@code index}, tracking the current path by depth. */
    private Step walk(int index, Set<Integer> members, Map<Integer, Integer> path, List<Integer> preorder) {
        int depth = path.size();
        int mark = preorder.size();
        var entry = entries.get(index);
        preorder.add(index);
        path.put(index, depth);

        var links = new ArrayList<Link>(entry.children.size());
        int reach = Integer.MAX_VALUE;
        for (int child : entry.children) {
            var ancestor = path.get(child);
            if (ancestor != null) {
                links.add(new Back(depth - ancestor));
                reach = Math.min(reach, ancestor);
            } else if (!members.contains(child)) {
                links.add(new Interned(child));
            } else {
                var step = walk(child, members, path, preorder);
                links.add(step.link());
                reach = Math.min(reach, step.reach());
            }
        }
        path.remove(index);

        if (reach == Integer.MAX_VALUE) {
            // no path back to an ancestor: a traversal would intern this node on its own
            preorder.subList(mark, preorder.size()).clear();
            return new Step(new Interned(index), reach);
        }
        return new Step(new Open(new CycleShape(entry.identifier, entry.linkage, links)), reach);
    }

    // guarded by lock
    private void checkShape(CycleShape shape, int depth) {
        for (var link : shape.children()) {
            if (link instanceof Interned interned) {
                checkChildren(List.of(interned.index()));
            } else if (link instanceof Back back && back.up() > depth) {
                throw new IllegalArgumentException(
                        "Back edge of " + shape.identifier() + " leaves the cycle (" + back.up() + " > " + depth + ")");
            } else if (link instanceof Open open) {
                checkShape(open.shape(), depth + 1);
            }
        }
    }

    int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    GraphNode node(int index) {
        synchronized (lock) {
            return entries.get(index).toNode(index);
        }
    }

    /** Stops accepting mutations and returns immutable copies of all nodes. */
    List<GraphNode> freeze() {
        synchronized (lock) {
            frozen = true;
            var nodes = new ArrayList<GraphNode>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                nodes.add(entries.get(i).toNode(i));
            }
            logger.debug(
                    "Froze node table with {} nodes, {} of them in {} cycles",
                    nodes.size(),
                    cycleNodeCount(),
                    byCycle.size());
            return List.copyOf(nodes);
        }
    }

    boolean isFrozen() {
        synchronized (lock) {
            return frozen;
        }
    }

    // guarded by lock
    private int cycleNodeCount() {
        return byCycle.values().stream().mapToInt(List::size).sum();
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Node table is frozen; the dependency graph has already been built");
        }
    }

    private void checkChildren(List<Integer> children) {
        for (int child : children) {
            if (child < 0 || child >= entries.size()) {
                throw new IllegalArgumentException("Unknown child node index " + child);
            }
        }
    }
}
