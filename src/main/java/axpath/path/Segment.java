package axpath.path;

import axpath.model.AttributeKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One step of an element path: a role (or the {@code *} wildcard), zero or
 * more ANDed predicates in the order written, and an optional 0-based index
 * among the matching children.
 *
 * <p>Without an index a segment must match exactly one child; with an index
 * it selects that position in document order.
 */
public record Segment(String role, List<Predicate> predicates, Integer index) {

    /** Role token matching any role. */
    public static final String WILDCARD = "*";

    private static final Pattern ROLE_PATTERN = Pattern.compile("[A-Za-z0-9_]+");

    public Segment {
        Objects.requireNonNull(role, "role must not be null");
        if (!WILDCARD.equals(role) && !ROLE_PATTERN.matcher(role).matches()) {
            throw new IllegalArgumentException("Invalid role token: '" + role + "'");
        }
        if (index != null && index < 0) {
            throw new IllegalArgumentException("Index must be non-negative: " + index);
        }
        predicates = predicates == null ? List.of() : List.copyOf(predicates);
    }

    public static Segment of(String role) {
        return new Segment(role, List.of(), null);
    }

    public boolean isWildcard() {
        return WILDCARD.equals(role);
    }

    public boolean hasIndex() {
        return index != null;
    }

    /** True if the role token accepts the given role. */
    public boolean acceptsRole(String nodeRole) {
        return isWildcard() || role.equals(nodeRole);
    }

    /** Value of the first predicate on {@code key}, if any. */
    public Optional<String> predicateValue(AttributeKey key) {
        return predicates.stream()
                .filter(p -> p.key().equals(key))
                .map(Predicate::value)
                .findFirst();
    }

    public Segment withPredicate(Predicate predicate) {
        List<Predicate> list = new ArrayList<>(predicates);
        list.add(predicate);
        return new Segment(role, list, index);
    }

    public Segment withPredicate(String attributeName, String value) {
        return withPredicate(Predicate.of(attributeName, value));
    }

    public Segment withIndex(Integer newIndex) {
        return new Segment(role, predicates, newIndex);
    }

    /** Path syntax for this segment, e.g. {@code AXButton[@AXTitle="OK"][1]}. */
    public String format() {
        StringBuilder sb = new StringBuilder(role);
        for (Predicate p : predicates) {
            sb.append(p.format());
        }
        if (index != null) {
            sb.append('[').append(index).append(']');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
