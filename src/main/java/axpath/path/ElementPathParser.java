package axpath.path;

import axpath.model.AttributeKey;
import axpath.model.AttributeNormalizer;
import axpath.path.PathParseException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Single-pass scanner for element path strings.
 *
 * <pre>
 * path       := "macos://ui/" segment ("/" segment)*
 * segment    := role ("[" predicate "]")* ("[" index "]")?
 * predicate  := "@" attr_name "=" quoted_string
 * index      := non_negative_integer
 * role       := identifier | "*"
 * </pre>
 *
 * <p>Quoted values may contain {@code /}, {@code [} and {@code ]}; the scanner
 * never splits on them. Attribute names are canonicalized through
 * {@link AttributeNormalizer}, so {@code @title} and {@code @AXTitle} parse to
 * the same predicate.
 */
public final class ElementPathParser {

    private static final Logger log = LoggerFactory.getLogger(ElementPathParser.class);

    private final String text;
    private int pos;

    private ElementPathParser(String text) {
        this.text = text;
        this.pos = 0;
    }

    /**
     * Parses a path string into an {@link ElementPath}.
     *
     * @throws NullPointerException if text is null
     * @throws PathParseException   if the text is malformed
     */
    public static ElementPath parse(String text) {
        Objects.requireNonNull(text, "path text must not be null");
        ElementPath path = new ElementPathParser(text).parsePath();
        log.trace("Parsed {} segment(s) from {}", path.size(), text);
        return path;
    }

    /** Wire form of a path. */
    public static String format(ElementPath path) {
        return format(path.segments());
    }

    /** Wire form of a segment list, root marker included. */
    public static String format(List<Segment> segments) {
        return ElementPath.ROOT_MARKER + segments.stream()
                .map(Segment::format)
                .collect(Collectors.joining("/"));
    }

    // ── Grammar ───────────────────────────────────────────────────────────

    private ElementPath parsePath() {
        String marker = ElementPath.ROOT_MARKER;
        if (!text.startsWith(marker)) {
            int mismatch = 0;
            while (mismatch < text.length() && mismatch < marker.length()
                    && text.charAt(mismatch) == marker.charAt(mismatch)) {
                mismatch++;
            }
            throw error(Kind.MISSING_ROOT_MARKER, "Path must start with " + marker, mismatch);
        }
        pos = marker.length();
        if (atEnd()) {
            throw error(Kind.EMPTY_PATH, "Path has no segments", pos);
        }

        List<Segment> segments = new ArrayList<>();
        while (true) {
            segments.add(parseSegment());
            if (atEnd()) {
                break;
            }
            // parseSegment stops only at '/' or end
            pos++;
            if (atEnd()) {
                throw error(Kind.EMPTY_ROLE, "Trailing '/' without a segment", pos);
            }
        }
        return new ElementPath(segments);
    }

    private Segment parseSegment() {
        String role = parseRole();
        List<Predicate> predicates = new ArrayList<>();
        Integer index = null;

        while (!atEnd() && peek() == '[') {
            int open = pos;
            if (index != null) {
                throw error(Kind.UNEXPECTED_CHARACTER, "Index must be the last bracket of a segment", open);
            }
            pos++;
            if (atEnd()) {
                throw error(Kind.UNBALANCED_BRACKET, "Unclosed '['", open);
            }
            if (peek() == '@') {
                predicates.add(parsePredicate(open));
            } else {
                index = parseIndex(open);
            }
        }

        if (!atEnd()) {
            char c = peek();
            if (c == ']') {
                throw error(Kind.UNBALANCED_BRACKET, "Unmatched ']'", pos);
            }
            if (c != '/') {
                throw error(Kind.UNEXPECTED_CHARACTER, "Unexpected character after segment", pos);
            }
        }
        return new Segment(role, predicates, index);
    }

    private String parseRole() {
        int start = pos;
        if (!atEnd() && peek() == '*') {
            pos++;
            return Segment.WILDCARD;
        }
        while (!atEnd() && isRoleChar(peek())) {
            pos++;
        }
        if (pos == start) {
            if (atEnd() || peek() == '/' || peek() == '[') {
                throw error(Kind.EMPTY_ROLE, "Segment has an empty role", start);
            }
            throw error(Kind.INVALID_ROLE, "Invalid character in role", start);
        }
        return text.substring(start, pos);
    }

    /** Parses {@code @name="value"]}; {@code pos} is on the '@'. */
    private Predicate parsePredicate(int open) {
        pos++; // '@'
        int nameStart = pos;
        while (!atEnd() && isNameChar(peek())) {
            pos++;
        }
        if (atEnd()) {
            throw error(Kind.UNBALANCED_BRACKET, "Unclosed '['", open);
        }
        if (pos == nameStart) {
            throw error(Kind.INVALID_PREDICATE, "Predicate has an empty attribute name", nameStart);
        }
        if (peek() != '=') {
            throw error(Kind.INVALID_PREDICATE, "Expected '=' after attribute name", pos);
        }
        String name = text.substring(nameStart, pos);
        pos++; // '='

        if (atEnd()) {
            throw error(Kind.UNBALANCED_BRACKET, "Unclosed '['", open);
        }
        if (peek() != '"') {
            throw error(Kind.INVALID_PREDICATE, "Attribute value must be double-quoted", pos);
        }
        int quote = pos;
        pos++;
        int valueStart = pos;
        while (true) {
            if (atEnd()) {
                throw error(Kind.UNTERMINATED_STRING, "Unterminated quoted value", quote);
            }
            char c = peek();
            if (c == '\\') {
                if (pos + 1 >= text.length()) {
                    throw error(Kind.UNTERMINATED_STRING, "Unterminated quoted value", quote);
                }
                pos += 2;
            } else if (c == '"') {
                break;
            } else {
                pos++;
            }
        }
        String raw = text.substring(valueStart, pos);
        pos++; // closing quote

        if (atEnd()) {
            throw error(Kind.UNBALANCED_BRACKET, "Unclosed '['", open);
        }
        if (peek() != ']') {
            throw error(Kind.INVALID_PREDICATE, "Expected ']' after quoted value", pos);
        }
        pos++;
        return new Predicate(AttributeKey.of(name), AttributeNormalizer.unescape(raw));
    }

    /** Parses {@code digits]}; {@code pos} is just past the '['. */
    private Integer parseIndex(int open) {
        int start = pos;
        while (!atEnd() && peek() != ']' && peek() != '/' && peek() != '[') {
            pos++;
        }
        if (atEnd() || peek() != ']') {
            throw error(Kind.UNBALANCED_BRACKET, "Unclosed '['", open);
        }
        String digits = text.substring(start, pos);
        if (digits.isEmpty() || !digits.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
            throw error(Kind.INVALID_INDEX, "Index must be a non-negative integer, got '" + digits + "'", start);
        }
        int index;
        try {
            index = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw error(Kind.INVALID_INDEX, "Index out of integer range: " + digits, start);
        }
        pos++; // ']'
        return index;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return text.charAt(pos);
    }

    private static boolean isRoleChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }

    private static boolean isNameChar(char c) {
        return isRoleChar(c) || c == '-' || c == '.' || c == ':';
    }

    private PathParseException error(Kind kind, String message, int at) {
        return new PathParseException(kind, message, text, at);
    }
}
