package axpath.model;

import java.util.Locale;
import java.util.Map;

/**
 * Canonicalizes accessibility attribute names and escapes attribute values
 * for embedding inside path predicates.
 *
 * <p>Canonical names carry the {@code AX} prefix ({@code title} becomes
 * {@code AXTitle}, {@code fooBar} becomes {@code AXFooBar}). The one exception
 * is the process bundle identifier: every spelling of it, including an
 * accidental {@code AX} prefix, maps to the un-prefixed {@code bundleIdentifier}.
 * Application-scoped roots are matched on that exact key, so the asymmetry
 * must stay.
 */
public final class AttributeNormalizer {

    /** Prefix carried by every canonical attribute name except the bundle identifier. */
    public static final String PREFIX = "AX";

    /** Canonical name of the process bundle identifier attribute. */
    public static final String BUNDLE_IDENTIFIER = "bundleIdentifier";

    private static final Map<String, String> NAME_MAPPINGS = Map.ofEntries(
            Map.entry("title",       "AXTitle"),
            Map.entry("description", "AXDescription"),
            Map.entry("value",       "AXValue"),
            Map.entry("id",          "AXIdentifier"),
            Map.entry("identifier",  "AXIdentifier"),
            Map.entry("help",        "AXHelp"),
            Map.entry("role",        "AXRole"),
            Map.entry("enabled",     "AXEnabled"),
            Map.entry("focused",     "AXFocused"),
            Map.entry("selected",    "AXSelected"),
            Map.entry("parent",      "AXParent"),
            Map.entry("children",    "AXChildren"),
            Map.entry("position",    "AXPosition"),
            Map.entry("size",        "AXSize"),
            Map.entry("frame",       "AXFrame")
    );

    private AttributeNormalizer() {}

    /**
     * Returns the canonical spelling of an attribute name. Never fails:
     * {@code null} and empty names normalize to the bare prefix.
     */
    public static String normalizeName(String name) {
        if (name == null || name.isEmpty()) {
            return PREFIX;
        }
        if (isBundleIdentifier(name)) {
            return BUNDLE_IDENTIFIER;
        }
        if (name.startsWith(PREFIX)) {
            return name;
        }
        String mapped = NAME_MAPPINGS.get(name);
        if (mapped != null) {
            return mapped;
        }
        return PREFIX + name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    }

    /** Canonical {@link AttributeKey} for an attribute name. */
    public static AttributeKey normalize(String name) {
        return AttributeKey.of(name);
    }

    /**
     * Escapes a value for use between the quotes of a {@code [@name="value"]}
     * predicate: backslash, double quote, newline, carriage return and tab.
     */
    public static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"'  -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default   -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Inverts {@link #escape(String)} in a single left-to-right pass.
     * Unknown escape sequences and a trailing lone backslash are kept verbatim.
     */
    public static String unescape(String text) {
        if (text == null) {
            return "";
        }
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= text.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = text.charAt(i + 1);
            switch (next) {
                case '\\' -> sb.append('\\');
                case '"'  -> sb.append('"');
                case 'n'  -> sb.append('\n');
                case 'r'  -> sb.append('\r');
                case 't'  -> sb.append('\t');
                default   -> sb.append(c).append(next);
            }
            i += 2;
        }
        return sb.toString();
    }

    private static boolean isBundleIdentifier(String name) {
        String bare = name.startsWith(PREFIX) ? name.substring(PREFIX.length()) : name;
        return bare.equalsIgnoreCase("bundleId") || bare.equalsIgnoreCase(BUNDLE_IDENTIFIER);
    }
}
