package axpath.path;

import axpath.model.AttributeKey;
import axpath.model.AttributeNormalizer;

import java.util.Objects;

/**
 * One {@code [@name="value"]} constraint of a path segment. The key is
 * always canonical; the value is stored unescaped.
 */
public record Predicate(AttributeKey key, String value) {

    public Predicate {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static Predicate of(String attributeName, String value) {
        return new Predicate(AttributeKey.of(attributeName), value);
    }

    /** Path syntax for this predicate, e.g. {@code [@AXTitle="OK"]}. */
    public String format() {
        return "[@" + key.name() + "=\"" + AttributeNormalizer.escape(value) + "\"]";
    }

    @Override
    public String toString() {
        return format();
    }
}
