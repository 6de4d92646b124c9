package axpath.resolve;

import axpath.path.ElementPathException;

/**
 * Raised by a {@link TreeAccessor} when the platform cannot answer a read.
 * Distinct from "element not found": the tree could not be observed at all.
 */
public class AccessorException extends ElementPathException {

    private static final long serialVersionUID = 1L;

    private final boolean timeout;

    public AccessorException(String message) {
        this(message, null, false);
    }

    public AccessorException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public AccessorException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    /** Creates a timeout failure for an accessor call that did not answer in time. */
    public static AccessorException timeout(String operation, long timeoutMs) {
        return new AccessorException(operation + " timed out after " + timeoutMs + " ms", null, true);
    }

    /** True if the call was abandoned because it exceeded its time limit. */
    public boolean isTimeout() {
        return timeout;
    }
}
