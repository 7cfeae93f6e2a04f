package selfheal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Page coordinates and dimensions of an element's bounding rectangle,
 * captured when the element was last resolved.
 */
public final class BoundingBox {

    @JsonProperty("x")
    private final double x;

    @JsonProperty("y")
    private final double y;

    @JsonProperty("width")
    private final double width;

    @JsonProperty("height")
    private final double height;

    @JsonCreator
    public BoundingBox(@JsonProperty("x") double x,
                       @JsonProperty("y") double y,
                       @JsonProperty("width") double width,
                       @JsonProperty("height") double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double getX()      { return x; }
    public double getY()      { return y; }
    public double getWidth()  { return width; }
    public double getHeight() { return height; }

    @JsonIgnore
    public double getCenterX() { return x + width / 2.0; }

    @JsonIgnore
    public double getCenterY() { return y + height / 2.0; }

    /** Euclidean distance between the centres of this box and {@code other}. */
    public double centerDistanceTo(BoundingBox other) {
        double dx = getCenterX() - other.getCenterX();
        double dy = getCenterY() - other.getCenterY();
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingBox)) return false;
        BoundingBox b = (BoundingBox) o;
        return Double.compare(x, b.x) == 0 && Double.compare(y, b.y) == 0
                && Double.compare(width, b.width) == 0 && Double.compare(height, b.height) == 0;
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return String.format("BoundingBox{x=%.1f, y=%.1f, w=%.1f, h=%.1f}", x, y, width, height);
    }
}
