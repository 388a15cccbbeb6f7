package ai.depgraph.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public final class ExecutorServiceUtil {

    private ExecutorServiceUtil() {}

    /**
     * Fixed-size pool of daemon threads named {@code <prefix><n>}.
     *
     * @param prefix thread name prefix, e.g. "depgraph-worker-"
     * @param threads pool size; values below 1 are treated as 1
     */
    public static ExecutorService newFixedDaemonExecutor(String prefix, int threads) {
        return Executors.newFixedThreadPool(Math.max(1, threads), daemonThreadFactory(prefix));
    }

    public static ThreadFactory daemonThreadFactory(String prefix) {
        var seq = new AtomicInteger(0);
        return r -> {
            var t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
