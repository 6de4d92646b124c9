package axpath.resolve;

import axpath.model.AttributeKey;
import axpath.model.AttributeValue;
import axpath.model.NodeView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorates a {@link TreeAccessor} with a per-call time limit.
 *
 * <p>Calls run one at a time on a dedicated daemon thread. A call that does
 * not answer within the limit is cancelled and surfaces as an
 * {@link AccessorException} with {@link AccessorException#isTimeout()} set.
 * Any other failure of the delegate is wrapped in an {@link AccessorException}.
 * A limit of 0 calls the delegate directly on the caller's thread.
 */
public class TimeLimitedTreeAccessor implements TreeAccessor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeLimitedTreeAccessor.class);

    private final TreeAccessor delegate;
    private final long timeoutMs;
    private final ExecutorService executor;

    public TimeLimitedTreeAccessor(TreeAccessor delegate, long timeoutMs) {
        this.delegate  = Objects.requireNonNull(delegate, "delegate must not be null");
        this.timeoutMs = Math.max(0L, timeoutMs);
        this.executor  = this.timeoutMs == 0 ? null : Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "axpath-accessor");
            t.setDaemon(true);
            return t;
        });
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public List<NodeView> getChildren(NodeView node) {
        return call("getChildren", () -> delegate.getChildren(node));
    }

    @Override
    public Map<AttributeKey, AttributeValue> getAttributes(NodeView node) {
        return call("getAttributes", () -> delegate.getAttributes(node));
    }

    @Override
    public Optional<NodeView> getRootForScope(Scope scope) {
        return call("getRootForScope(" + scope + ")", () -> delegate.getRootForScope(scope));
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private <T> T call(String operation, Callable<T> task) {
        if (executor == null) {
            try {
                return task.call();
            } catch (AccessorException e) {
                throw e;
            } catch (Exception e) {
                throw failure(operation, e);
            }
        }

        Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Accessor call {} exceeded {} ms", operation, timeoutMs);
            throw AccessorException.timeout(operation, timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AccessorException ae) {
                throw ae;
            }
            throw failure(operation, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AccessorException(operation + " interrupted", e);
        }
    }

    private static AccessorException failure(String operation, Throwable cause) {
        log.debug("Accessor call {} failed", operation, cause);
        return new AccessorException(operation + " failed: " + cause, cause);
    }
}
