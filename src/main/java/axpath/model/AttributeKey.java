package axpath.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical accessibility attribute name.
 *
 * <p>Every instance is canonical: {@link #of(String)} runs the name through
 * {@link AttributeNormalizer}, so {@code of("title")} and {@code of("AXTitle")}
 * are equal. The constants cover the attributes the engine reads itself;
 * any other platform attribute is still representable.
 */
public final class AttributeKey implements Comparable<AttributeKey> {

    public static final AttributeKey ROLE              = new AttributeKey("AXRole");
    public static final AttributeKey TITLE             = new AttributeKey("AXTitle");
    public static final AttributeKey VALUE             = new AttributeKey("AXValue");
    public static final AttributeKey DESCRIPTION       = new AttributeKey("AXDescription");
    public static final AttributeKey IDENTIFIER        = new AttributeKey("AXIdentifier");
    public static final AttributeKey HELP              = new AttributeKey("AXHelp");
    public static final AttributeKey ENABLED           = new AttributeKey("AXEnabled");
    public static final AttributeKey FOCUSED           = new AttributeKey("AXFocused");
    public static final AttributeKey SELECTED          = new AttributeKey("AXSelected");
    public static final AttributeKey VISIBLE           = new AttributeKey("AXVisible");
    public static final AttributeKey FRAME             = new AttributeKey("AXFrame");
    public static final AttributeKey BUNDLE_IDENTIFIER = new AttributeKey(AttributeNormalizer.BUNDLE_IDENTIFIER);

    private final String name;

    private AttributeKey(String canonicalName) {
        this.name = canonicalName;
    }

    /** Canonical key for any spelling of an attribute name. */
    @JsonCreator
    public static AttributeKey of(String name) {
        return new AttributeKey(AttributeNormalizer.normalizeName(name));
    }

    /** Canonical name, as written in path predicates. */
    @JsonValue
    public String name() {
        return name;
    }

    @Override
    public int compareTo(AttributeKey other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeKey)) return false;
        return name.equals(((AttributeKey) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
