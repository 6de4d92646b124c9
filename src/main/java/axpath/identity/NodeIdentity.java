package axpath.identity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Durable identifier of a node across captures.
 *
 * <p>Either {@code id:<role>:<identifier>} when the platform exposes a usable
 * native identifier, or {@code h:<hex>} synthesized from the node's structural
 * and textual properties. Equality is on the string form only.
 */
public final class NodeIdentity implements Comparable<NodeIdentity> {

    public enum Source { NATIVE, STRUCTURAL }

    static final String NATIVE_PREFIX = "id:";
    static final String STRUCTURAL_PREFIX = "h:";

    private final String value;
    private final Source source;

    private NodeIdentity(String value, Source source) {
        this.value  = value;
        this.source = source;
    }

    static NodeIdentity nativeId(String role, String identifier) {
        return new NodeIdentity(NATIVE_PREFIX + role + ":" + identifier, Source.NATIVE);
    }

    static NodeIdentity structural(String hex) {
        return new NodeIdentity(STRUCTURAL_PREFIX + hex, Source.STRUCTURAL);
    }

    /**
     * Restores an identity from its string form, e.g. one read back from a
     * change report.
     */
    public static NodeIdentity of(String value) {
        Objects.requireNonNull(value, "value must not be null");
        return new NodeIdentity(value, value.startsWith(NATIVE_PREFIX) ? Source.NATIVE : Source.STRUCTURAL);
    }

    /** Same identity with an occurrence suffix, used when a capture sees it twice. */
    public NodeIdentity withOccurrence(int occurrence) {
        return new NodeIdentity(value + "#" + occurrence, source);
    }

    @JsonValue
    public String value() { return value; }

    public Source getSource() { return source; }

    @Override
    public int compareTo(NodeIdentity other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeIdentity)) return false;
        return value.equals(((NodeIdentity) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
