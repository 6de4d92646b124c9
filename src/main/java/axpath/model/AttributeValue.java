package axpath.model;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * Typed accessibility attribute value.
 *
 * <p>Platform trees hand out loosely-typed values; {@link #from(Object)}
 * converts them once at the boundary so resolution and identity code only
 * ever see one of four kinds. {@link #asText()} is the form path predicates
 * compare against.
 */
public final class AttributeValue {

    public enum Kind { STRING, NUMBER, BOOLEAN, RECT }

    private final Kind   kind;
    private final String text;
    private final Double number;
    private final Boolean bool;
    private final Rect   rect;

    private AttributeValue(Kind kind, String text, Double number, Boolean bool, Rect rect) {
        this.kind   = kind;
        this.text   = text;
        this.number = number;
        this.bool   = bool;
        this.rect   = rect;
    }

    public static AttributeValue of(String text) {
        return new AttributeValue(Kind.STRING, Objects.requireNonNull(text, "text"), null, null, null);
    }

    public static AttributeValue of(double number) {
        return new AttributeValue(Kind.NUMBER, null, number, null, null);
    }

    public static AttributeValue of(boolean bool) {
        return new AttributeValue(Kind.BOOLEAN, null, null, bool, null);
    }

    public static AttributeValue of(Rect rect) {
        return new AttributeValue(Kind.RECT, null, null, null, Objects.requireNonNull(rect, "rect"));
    }

    /**
     * Converts a loosely-typed platform value. Strings, numbers, booleans and
     * {@link Rect}s map to their kind; a map carrying x/y/width/height becomes
     * a rect; anything else is kept as its string form.
     *
     * @return the typed value, or {@code null} if {@code raw} is null
     */
    public static AttributeValue from(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof AttributeValue v) {
            return v;
        }
        if (raw instanceof String s) {
            return of(s);
        }
        if (raw instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (raw instanceof Number n) {
            return of(n.doubleValue());
        }
        if (raw instanceof Rect r) {
            return of(r);
        }
        if (raw instanceof Map<?, ?> m && m.containsKey("x") && m.containsKey("y")
                && m.containsKey("width") && m.containsKey("height")) {
            return of(new Rect(toDouble(m.get("x")), toDouble(m.get("y")),
                    toDouble(m.get("width")), toDouble(m.get("height"))));
        }
        return of(String.valueOf(raw));
    }

    public Kind getKind() { return kind; }

    /** Boolean reading: booleans as-is, numbers non-zero, strings "true"/"1". */
    public boolean asBoolean() {
        return switch (kind) {
            case BOOLEAN -> bool;
            case NUMBER  -> number != 0.0;
            case STRING  -> "true".equalsIgnoreCase(text) || "1".equals(text);
            case RECT    -> false;
        };
    }

    /** Rect payload, or {@code null} for other kinds. */
    public Rect asRect() {
        return rect;
    }

    /**
     * Text form used for predicate matching: strings verbatim, integral
     * numbers without a fraction, booleans as {@code true}/{@code false},
     * rects as {@code {x, y, w, h}}.
     */
    public String asText() {
        return switch (kind) {
            case STRING  -> text;
            case BOOLEAN -> bool ? "true" : "false";
            case RECT    -> rect.toCompactString();
            case NUMBER  -> formatNumber(number);
        };
    }

    private static String formatNumber(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    private static double toDouble(Object o) {
        if (o instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(o));
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeValue)) return false;
        AttributeValue v = (AttributeValue) o;
        return kind == v.kind
                && Objects.equals(text, v.text)
                && Objects.equals(number, v.number)
                && Objects.equals(bool, v.bool)
                && Objects.equals(rect, v.rect);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, number, bool, rect);
    }

    @Override
    public String toString() {
        return kind + ":" + asText();
    }
}
