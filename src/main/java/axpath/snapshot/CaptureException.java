package axpath.snapshot;

import axpath.path.ElementPathException;
import axpath.resolve.AccessorException;

/**
 * A capture could not observe the tree. Unlike a failed resolution this never
 * means "element missing": the snapshot would have been incomplete.
 */
public class CaptureException extends ElementPathException {

    private static final long serialVersionUID = 1L;

    private final boolean timeout;

    public CaptureException(String message) {
        super(message);
        this.timeout = false;
    }

    public CaptureException(String message, AccessorException cause) {
        super(message, cause);
        this.timeout = cause.isTimeout();
    }

    public boolean isTimeout() {
        return timeout;
    }
}
