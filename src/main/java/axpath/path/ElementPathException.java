package axpath.path;

/**
 * Unchecked base exception for every failure raised by the element path
 * engine: malformed path text, resolution failures and tree read failures.
 */
public class ElementPathException extends RuntimeException {

    public ElementPathException(String msg) {
        super(msg);
    }

    public ElementPathException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
