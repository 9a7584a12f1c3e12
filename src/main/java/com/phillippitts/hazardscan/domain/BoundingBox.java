package com.phillippitts.hazardscan.domain;

/**
 * Axis-aligned region in normalized image coordinates (0.0 - 1.0).
 */
public record BoundingBox(double left, double top, double width, double height) {

    /** Region covering the whole frame. */
    public static final BoundingBox FULL_FRAME = new BoundingBox(0.0, 0.0, 1.0, 1.0);

    public BoundingBox {
        requireUnit("left", left);
        requireUnit("top", top);
        requireUnit("width", width);
        requireUnit("height", height);
        if (left + width > 1.0 + 1e-9 || top + height > 1.0 + 1e-9) {
            throw new IllegalArgumentException("box exceeds frame: " + left + "," + top + "," + width + "," + height);
        }
    }

    private static void requireUnit(String name, double v) {
        if (v < 0.0 || v > 1.0 || Double.isNaN(v)) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got: " + v);
        }
    }
}
