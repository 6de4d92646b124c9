package axpath.path;

/**
 * Non-fatal finding from {@link PathValidator}: the path parses, but is
 * likely to be fragile or ambiguous when resolved.
 *
 * @param segmentIndex index of the offending segment, or -1 for the path as a whole
 * @param message      what was found
 * @param suggestion   how to improve the path
 */
public record PathWarning(int segmentIndex, String message, String suggestion) {

    @Override
    public String toString() {
        String where = segmentIndex < 0 ? "path" : "segment " + segmentIndex;
        return where + ": " + message + " (" + suggestion + ")";
    }
}
