package axpath.path;

/**
 * Thrown when a path string is malformed. Always an input error: retrying
 * the same text cannot succeed.
 */
public class PathParseException extends ElementPathException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        MISSING_ROOT_MARKER,
        EMPTY_PATH,
        EMPTY_ROLE,
        INVALID_ROLE,
        UNBALANCED_BRACKET,
        UNTERMINATED_STRING,
        INVALID_INDEX,
        INVALID_PREDICATE,
        UNEXPECTED_CHARACTER
    }

    private final Kind kind;
    private final String path;
    private final int position;

    public PathParseException(Kind kind, String message, String path, int position) {
        super(formatMessage(message, path, position));
        this.kind = kind;
        this.path = path;
        this.position = position;
    }

    public Kind getKind() {
        return kind;
    }

    /** The text that was being parsed. */
    public String getPath() {
        return path;
    }

    /** Offset into the text where the error was detected. */
    public int getPosition() {
        return position;
    }

    private static String formatMessage(String message, String path, int position) {
        if (path == null || position < 0) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message)
                .append(" at position ").append(position)
                .append(" in path: ").append(path);
        if (position < path.length()) {
            sb.append(" (near '").append(path.charAt(position)).append("')");
        }
        return sb.toString();
    }
}
