package ai.depgraph.testutil;

import ai.depgraph.handler.PackageResolutionException;
import ai.depgraph.handler.PackageResolver;
import ai.depgraph.model.Identifier;
import ai.depgraph.model.Package;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Resolver that counts invocations per identifier and fails for a configured set of identifiers. */
public final class RecordingResolver implements PackageResolver {
    private final Set<Identifier> failing = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<Identifier, AtomicInteger> calls = new ConcurrentHashMap<>();

    public RecordingResolver failFor(Identifier id) {
        failing.add(id);
        return this;
    }

    @Override
    public Package resolve(Identifier id) throws PackageResolutionException {
        calls.computeIfAbsent(id, k -> new AtomicInteger()).incrementAndGet();
        if (failing.contains(id)) {
            throw new PackageResolutionException(id, "not found in repository");
        }
        return Package.of(id).withDeclaredLicenses(Set.of("Apache-2.0"));
    }

    public int callsFor(Identifier id) {
        var count = calls.get(id);
        return count == null ? 0 : count.get();
    }

    public int totalCalls() {
        return calls.values().stream().mapToInt(AtomicInteger::get).sum();
    }
}
