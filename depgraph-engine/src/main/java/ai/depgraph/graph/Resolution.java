package ai.depgraph.graph;

import ai.depgraph.model.Identifier;
import ai.depgraph.model.Issue;
import ai.depgraph.model.Package;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Outcome of resolving one identifier: either a package or the issue explaining why there is none. */
public record Resolution(Identifier id, @Nullable Package pkg, @Nullable Issue issue) {

    public Resolution {
        if ((pkg == null) == (issue == null)) {
            throw new IllegalArgumentException("Exactly one of package and issue must be set for " + id);
        }
    }

    public static Resolution resolved(Package pkg) {
        return new Resolution(pkg.id(), pkg, null);
    }

    public static Resolution failed(Identifier id, Issue issue) {
        return new Resolution(id, null, issue);
    }

    public boolean succeeded() {
        return pkg != null;
    }

    public Optional<Package> packageIfResolved() {
        return Optional.ofNullable(pkg);
    }

    public Optional<Issue> failure() {
        return Optional.ofNullable(issue);
    }
}
