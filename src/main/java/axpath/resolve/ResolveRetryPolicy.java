package axpath.resolve;

import axpath.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Caller-side retry for resolutions against a tree that is still settling.
 *
 * <pre>{@code
 * NodeView button = new ResolveRetryPolicy(config).execute(() -> resolver.resolve(path));
 * }</pre>
 *
 * <p>NOT_FOUND, AMBIGUOUS and INDEX_OUT_OF_RANGE are retried with a fixed
 * delay until {@code retry.max.attempts} attempts have been made; the last
 * failure is then rethrown. Accessor failures are rethrown immediately.
 */
public class ResolveRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(ResolveRetryPolicy.class);

    /** Pause between attempts; replaceable in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long delayMs;
    private final Sleeper sleeper;

    public ResolveRetryPolicy(EngineConfig config) {
        this(config.getRetryMaxAttempts(), config.getRetryDelayMs(), Thread::sleep);
    }

    public ResolveRetryPolicy(int maxAttempts, long delayMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.delayMs     = Math.max(0L, delayMs);
        this.sleeper     = sleeper;
    }

    /**
     * Runs the resolution until it succeeds, fails with a non-retryable error
     * or runs out of attempts.
     *
     * @throws ResolveException the last failure
     */
    public <T> T execute(Supplier<T> resolution) {
        for (int attempt = 1; ; attempt++) {
            try {
                return resolution.get();
            } catch (ResolveException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.warn("Giving up after {} attempt(s): {}", attempt, e.getMessage());
                    throw e;
                }
                log.debug("Attempt {}/{} failed ({}), retrying in {} ms",
                        attempt, maxAttempts, e.getKind(), delayMs);
                pause(e);
            }
        }
    }

    public int getMaxAttempts() { return maxAttempts; }

    public long getDelayMs() { return delayMs; }

    private void pause(ResolveException pending) {
        if (delayMs == 0) {
            return;
        }
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw pending;
        }
    }
}
