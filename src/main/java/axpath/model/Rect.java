package axpath.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;

/**
 * Screen coordinates and dimensions of an element's frame, as reported by
 * the accessibility tree at read time.
 */
public final class Rect {

    /** Frame reported for elements that expose no position or size. */
    public static final Rect ZERO = new Rect(0, 0, 0, 0);

    @JsonProperty("x")
    private final double x;

    @JsonProperty("y")
    private final double y;

    @JsonProperty("width")
    private final double width;

    @JsonProperty("height")
    private final double height;

    @JsonCreator
    public Rect(@JsonProperty("x") double x,
                @JsonProperty("y") double y,
                @JsonProperty("width") double width,
                @JsonProperty("height") double height) {
        this.x      = x;
        this.y      = y;
        this.width  = width;
        this.height = height;
    }

    public double getX()      { return x; }
    public double getY()      { return y; }
    public double getWidth()  { return width; }
    public double getHeight() { return height; }

    /** Frame snapped to whole pixels, absorbing sub-pixel jitter between reads. */
    public Rect rounded() {
        return new Rect(Math.round(x), Math.round(y), Math.round(width), Math.round(height));
    }

    /** True if the point lies inside this frame (left/top edges inclusive). */
    public boolean contains(double px, double py) {
        return px >= x && py >= y && px < x + width && py < y + height;
    }

    /** Compact {@code {x, y, w, h}} form with integral coordinates, used in predicates and hashes. */
    public String toCompactString() {
        Rect r = rounded();
        return String.format(Locale.ROOT, "{%d, %d, %d, %d}",
                (long) r.x, (long) r.y, (long) r.width, (long) r.height);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rect)) return false;
        Rect r = (Rect) o;
        return Double.compare(x, r.x) == 0
                && Double.compare(y, r.y) == 0
                && Double.compare(width, r.width) == 0
                && Double.compare(height, r.height) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Rect{x=%.1f, y=%.1f, w=%.1f, h=%.1f}", x, y, width, height);
    }
}
