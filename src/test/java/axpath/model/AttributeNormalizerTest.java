package axpath.model;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AttributeNormalizer} and {@link AttributeKey}.
 */
public class AttributeNormalizerTest {

    // ── Name normalization ────────────────────────────────────────────────

    @DataProvider(name = "mappedNames")
    public Object[][] mappedNames() {
        return new Object[][] {
                {"title",       "AXTitle"},
                {"description", "AXDescription"},
                {"value",       "AXValue"},
                {"id",          "AXIdentifier"},
                {"identifier",  "AXIdentifier"},
                {"help",        "AXHelp"},
                {"role",        "AXRole"},
                {"enabled",     "AXEnabled"},
                {"focused",     "AXFocused"},
                {"selected",    "AXSelected"},
                {"parent",      "AXParent"},
                {"children",    "AXChildren"},
                {"position",    "AXPosition"},
                {"size",        "AXSize"},
                {"frame",       "AXFrame"},
        };
    }

    @Test(dataProvider = "mappedNames", description = "Common spellings map through the table")
    public void testMappingTable(String raw, String expected) {
        assertThat(AttributeNormalizer.normalizeName(raw)).isEqualTo(expected);
    }

    @Test(description = "Names already carrying the AX prefix are returned unchanged")
    public void testPrefixedNamesUnchanged() {
        assertThat(AttributeNormalizer.normalizeName("AXTitle")).isEqualTo("AXTitle");
        assertThat(AttributeNormalizer.normalizeName("AXPlaceholderValue")).isEqualTo("AXPlaceholderValue");
        assertThat(AttributeNormalizer.normalizeName("AXfoo")).isEqualTo("AXfoo");
    }

    @DataProvider(name = "bundleSpellings")
    public Object[][] bundleSpellings() {
        return new Object[][] {
                {"bundleId"}, {"bundleID"}, {"bundleIdentifier"},
                {"AXbundleId"}, {"AXBundleID"}, {"AXbundleIdentifier"}, {"AXBundleIdentifier"},
        };
    }

    @Test(dataProvider = "bundleSpellings", description = "Every bundle identifier spelling maps to the un-prefixed key")
    public void testBundleIdentifierAsymmetry(String raw) {
        assertThat(AttributeNormalizer.normalizeName(raw)).isEqualTo("bundleIdentifier");
        assertThat(AttributeKey.of(raw)).isEqualTo(AttributeKey.BUNDLE_IDENTIFIER);
    }

    @Test(description = "Unknown names get AX plus a capitalized first letter")
    public void testDefaultRule() {
        assertThat(AttributeNormalizer.normalizeName("fooBar")).isEqualTo("AXFooBar");
        assertThat(AttributeNormalizer.normalizeName("placeholderValue")).isEqualTo("AXPlaceholderValue");
        assertThat(AttributeNormalizer.normalizeName("x")).isEqualTo("AXX");
    }

    @Test(description = "Null and empty names normalize to the bare prefix without throwing")
    public void testNullAndEmpty() {
        assertThat(AttributeNormalizer.normalizeName(null)).isEqualTo("AX");
        assertThat(AttributeNormalizer.normalizeName("")).isEqualTo("AX");
    }

    @Test(description = "Normalization is idempotent")
    public void testIdempotent() {
        for (String raw : new String[] {"title", "bundleID", "AXValue", "custom", "AXbundleId", "id"}) {
            String once = AttributeNormalizer.normalizeName(raw);
            assertThat(AttributeNormalizer.normalizeName(once)).as(raw).isEqualTo(once);
        }
    }

    @Test(description = "Keys built from different spellings of one attribute are equal")
    public void testKeyEquality() {
        assertThat(AttributeKey.of("title")).isEqualTo(AttributeKey.TITLE);
        assertThat(AttributeKey.of("AXTitle")).isEqualTo(AttributeKey.of("title"));
        assertThat(AttributeKey.of("id").hashCode()).isEqualTo(AttributeKey.IDENTIFIER.hashCode());
        assertThat(AttributeNormalizer.normalize("help")).isEqualTo(AttributeKey.HELP);
    }

    // ── Escaping ──────────────────────────────────────────────────────────

    @Test(description = "escape covers backslash, quote, newline, carriage return and tab")
    public void testEscape() {
        assertThat(AttributeNormalizer.escape("a\"b\\c\nd\re\tf"))
                .isEqualTo("a\\\"b\\\\c\\nd\\re\\tf");
        assertThat(AttributeNormalizer.escape("plain")).isEqualTo("plain");
        assertThat(AttributeNormalizer.escape(null)).isEmpty();
    }

    @DataProvider(name = "awkwardValues")
    public Object[][] awkwardValues() {
        return new Object[][] {
                {""},
                {"plain"},
                {"\"quoted\""},
                {"back\\slash"},
                {"\\n is not a newline"},
                {"ends with backslash\\"},
                {"\\\\\\"},
                {"line1\nline2\r\n\ttabbed"},
                {"path/like[value]"},
                {"ünïcødé ✓"},
        };
    }

    @Test(dataProvider = "awkwardValues", description = "unescape inverts escape exactly")
    public void testEscapeInverse(String value) {
        assertThat(AttributeNormalizer.unescape(AttributeNormalizer.escape(value))).isEqualTo(value);
    }

    @Test(description = "Unknown escape sequences and a trailing lone backslash are kept literally")
    public void testUnescapeLeniency() {
        assertThat(AttributeNormalizer.unescape("a\\qb")).isEqualTo("a\\qb");
        assertThat(AttributeNormalizer.unescape("trailing\\")).isEqualTo("trailing\\");
        assertThat(AttributeNormalizer.unescape("\\\\n")).isEqualTo("\\n");
    }
}
