package axpath.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, non-empty sequence of {@link Segment}s addressing one element
 * of an accessibility tree, e.g.
 * {@code macos://ui/AXApplication[@bundleIdentifier="com.apple.calculator"]/AXWindow/AXButton[@AXDescription="1"]}.
 *
 * <p>The first segment is the root segment (usually the application).
 * {@link #toString()} produces the wire form and is a right inverse of
 * {@link #parse(String)}.
 */
public final class ElementPath {

    /** Fixed marker every path string starts with. */
    public static final String ROOT_MARKER = "macos://ui/";

    private final List<Segment> segments;

    public ElementPath(List<Segment> segments) {
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("An element path needs at least one segment");
        }
        this.segments = List.copyOf(segments);
    }

    public static ElementPath of(Segment... segments) {
        return new ElementPath(List.of(segments));
    }

    /**
     * Parses a path string.
     *
     * @throws PathParseException if the text is not a well-formed path
     */
    public static ElementPath parse(String text) {
        return ElementPathParser.parse(text);
    }

    /** True if the string carries the path root marker (it may still be malformed). */
    public static boolean isElementPath(String text) {
        return text != null && text.startsWith(ROOT_MARKER);
    }

    public List<Segment> segments() {
        return segments;
    }

    public Segment segment(int i) {
        return segments.get(i);
    }

    public Segment rootSegment() {
        return segments.get(0);
    }

    public Segment lastSegment() {
        return segments.get(segments.size() - 1);
    }

    public int size() {
        return segments.size();
    }

    public ElementPath append(Segment segment) {
        List<Segment> list = new ArrayList<>(segments);
        list.add(Objects.requireNonNull(segment, "segment"));
        return new ElementPath(list);
    }

    /** Path made of the first {@code count} segments. */
    public ElementPath prefix(int count) {
        return new ElementPath(segments.subList(0, count));
    }

    /** Wire form of this path. */
    public String format() {
        return ElementPathParser.format(segments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementPath)) return false;
        return segments.equals(((ElementPath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
