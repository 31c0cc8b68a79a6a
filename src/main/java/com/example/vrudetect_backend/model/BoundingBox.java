package com.example.vrudetect_backend.model;

/**
 * Axis-aligned bounding box in pixel coordinates.
 *
 * @param x      left edge.
 * @param y      top edge.
 * @param width  box width, never negative.
 * @param height box height, never negative.
 */
public record BoundingBox(double x, double y, double width, double height) {

    public BoundingBox {
        width = Math.max(0.0, width);
        height = Math.max(0.0, height);
    }

    public double area() {
        return width * height;
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    /**
     * Intersection-over-union with another box.
     *
     * @param other box to compare with.
     * @return overlap ratio in {@code [0, 1]}; {@code 0} when either box is empty.
     */
    public double iou(BoundingBox other) {
        if (other == null) {
            return 0.0;
        }
        double ix = Math.max(0.0, Math.min(right(), other.right()) - Math.max(x, other.x));
        double iy = Math.max(0.0, Math.min(bottom(), other.bottom()) - Math.max(y, other.y));
        double intersection = ix * iy;
        double union = area() + other.area() - intersection;
        if (union <= 0.0) {
            return 0.0;
        }
        return intersection / union;
    }
}
