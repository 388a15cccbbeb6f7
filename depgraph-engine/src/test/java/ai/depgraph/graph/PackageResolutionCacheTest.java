package ai.depgraph.graph;

import static ai.depgraph.testutil.TestNode.id;
import static org.junit.jupiter.api.Assertions.*;

import ai.depgraph.model.Issue;
import ai.depgraph.model.Package;
import ai.depgraph.testutil.RecordingResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class PackageResolutionCacheTest {

    @Test
    void concurrentCallersShareOneComputation() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var calls = new AtomicInteger();
        var cache = new PackageResolutionCache(id -> {
            calls.incrementAndGet();
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Package.of(id);
        });

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            var first = pool.submit(() -> cache.resolve(id("lib:slow:1.0")));
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            var others = new ArrayList<Future<Resolution>>();
            for (int i = 1; i < threads; i++) {
                others.add(pool.submit(() -> cache.resolve(id("lib:slow:1.0"))));
            }
            release.countDown();

            var expected = first.get(10, TimeUnit.SECONDS);
            for (var f : others) {
                assertSame(expected, f.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, calls.get());
        assertEquals(1, cache.computationCount());
        assertTrue(cache.isResolved(id("lib:slow:1.0")));
    }

    @Test
    void failureIsRetainedAndNotRecomputed() {
        var resolver = new RecordingResolver().failFor(id("lib:missing:1.0"));
        var cache = new PackageResolutionCache(resolver);

        var first = cache.resolve(id("lib:missing:1.0"));
        var second = cache.resolve(id("lib:missing:1.0"));

        assertSame(first, second);
        assertFalse(first.succeeded());
        assertEquals(Issue.RESOLUTION_FAILED, first.failure().orElseThrow().kind());
        assertTrue(first.failure().orElseThrow().message().contains("not found in repository"));
        assertEquals(1, resolver.callsFor(id("lib:missing:1.0")));
        assertEquals(Set.of(id("lib:missing:1.0")), cache.failures().keySet());
        assertTrue(cache.packages().isEmpty());
    }

    @Test
    void runtimeExceptionAndNullResultBecomeIssues() {
        var cache = new PackageResolutionCache(id -> {
            if (id.name().equals("broken")) {
                throw new IllegalStateException("connection reset");
            }
            return null;
        });

        var broken = cache.resolve(id("lib:broken:1.0"));
        var empty = cache.resolve(id("lib:empty:1.0"));

        assertTrue(broken.failure().orElseThrow().message().contains("IllegalStateException: connection reset"));
        assertEquals(Issue.RESOLUTION_FAILED, empty.failure().orElseThrow().kind());
        assertNull(empty.pkg());
        assertEquals(2, cache.failures().size());
    }

    @Test
    void packageWithDifferentIdIsStoredUnderRequestedId() {
        var cache = new PackageResolutionCache(id -> Package.of(id("lib:other:9.9")).withDescription("other"));

        var resolution = cache.resolve(id("lib:wanted:1.0"));

        var pkg = resolution.packageIfResolved().orElseThrow();
        assertEquals(id("lib:wanted:1.0"), pkg.id());
        assertEquals("other", pkg.description());
    }

    @Test
    void packagesAreSortedAndCanBeRestricted() {
        var cache = new PackageResolutionCache(new RecordingResolver());
        cache.resolve(id("lib:zeta:1.0"));
        cache.resolve(id("lib:alpha:1.0"));
        cache.resolve(id("lib:beta:1.0"));

        assertEquals(
                List.of(id("lib:alpha:1.0"), id("lib:beta:1.0"), id("lib:zeta:1.0")),
                cache.packages().stream().map(Package::id).toList());
        assertEquals(
                List.of(id("lib:zeta:1.0")),
                cache.packages(List.of(id("lib:zeta:1.0"), id("lib:unknown:1.0"))).stream()
                        .map(Package::id)
                        .toList());
        assertFalse(cache.isResolved(id("lib:unknown:1.0")));
    }

    @Test
    void resolverErrorIsNotCachedAndNextRequestRetries() {
        var calls = new AtomicInteger();
        var cache = new PackageResolutionCache(id -> {
            if (calls.incrementAndGet() == 1) {
                throw new NoClassDefFoundError("transient");
            }
            return Package.of(id);
        });

        assertThrows(NoClassDefFoundError.class, () -> cache.resolve(id("lib:plugin:1.0")));
        assertFalse(cache.isResolved(id("lib:plugin:1.0")));

        var retried = cache.resolve(id("lib:plugin:1.0"));

        assertTrue(retried.succeeded());
        assertEquals(2, calls.get());
        assertTrue(cache.isResolved(id("lib:plugin:1.0")));
        assertSame(retried, cache.resolve(id("lib:plugin:1.0")));
    }

    @Test
    void concurrentWaiterReceivesResolverErrorUnwrapped() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var cache = new PackageResolutionCache(id -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new NoClassDefFoundError("plugin class missing");
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            var first = pool.submit(() -> cache.resolve(id("lib:plugin:1.0")));
            assertTrue(entered.await(10, TimeUnit.SECONDS));
            var waiterStarted = new CountDownLatch(1);
            var waiter = pool.submit(() -> {
                waiterStarted.countDown();
                try {
                    cache.resolve(id("lib:plugin:1.0"));
                    return null;
                } catch (Throwable t) {
                    return t;
                }
            });
            assertTrue(waiterStarted.await(10, TimeUnit.SECONDS));
            // give the waiter time to block on the running computation
            Thread.sleep(100);
            release.countDown();

            var e = assertThrows(ExecutionException.class, () -> first.get(10, TimeUnit.SECONDS));
            assertInstanceOf(NoClassDefFoundError.class, e.getCause());
            assertInstanceOf(NoClassDefFoundError.class, waiter.get(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }
}
