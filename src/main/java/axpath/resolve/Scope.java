package axpath.resolve;

import axpath.model.AttributeKey;
import axpath.path.ElementPath;
import axpath.path.Segment;

import java.util.Objects;
import java.util.Optional;

/**
 * Where resolution or capture starts: the whole system, one application
 * identified by bundle identifier, or the element under a screen position.
 */
public record Scope(Kind kind, String bundleIdentifier, double x, double y) {

    public enum Kind { SYSTEM_WIDE, APPLICATION, POSITION }

    private static final String APPLICATION_ROLE = "AXApplication";

    private static final Scope SYSTEM_WIDE = new Scope(Kind.SYSTEM_WIDE, null, 0, 0);

    public Scope {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.APPLICATION && (bundleIdentifier == null || bundleIdentifier.isBlank())) {
            throw new IllegalArgumentException("Application scope needs a bundle identifier");
        }
    }

    public static Scope systemWide() {
        return SYSTEM_WIDE;
    }

    public static Scope application(String bundleIdentifier) {
        return new Scope(Kind.APPLICATION, bundleIdentifier, 0, 0);
    }

    public static Scope atPosition(double x, double y) {
        return new Scope(Kind.POSITION, null, x, y);
    }

    /**
     * Scope implied by a path's root segment: an {@code AXApplication} segment
     * with a {@code bundleIdentifier} predicate scopes to that application,
     * anything else to the whole system.
     */
    public static Scope forPath(ElementPath path) {
        Segment root = path.rootSegment();
        if (APPLICATION_ROLE.equals(root.role())) {
            Optional<String> bundle = root.predicateValue(AttributeKey.BUNDLE_IDENTIFIER);
            if (bundle.isPresent() && !bundle.get().isBlank()) {
                return application(bundle.get());
            }
        }
        return systemWide();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SYSTEM_WIDE -> "system-wide";
            case APPLICATION -> "application(" + bundleIdentifier + ")";
            case POSITION    -> "position(" + x + ", " + y + ")";
        };
    }
}
