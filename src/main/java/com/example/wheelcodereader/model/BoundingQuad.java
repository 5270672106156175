package com.example.wheelcodereader.model;

import java.util.List;
import java.util.Objects;

/**
 * Quadrilateral delimiting a detected text region. Points are ordered clockwise
 * starting near the top-left corner and follow the image pixel grid with the
 * origin located in the top-left corner. The quad is not necessarily
 * axis-aligned; derived measurements use its axis-aligned envelope.
 */
public record BoundingQuad(List<QuadPoint> points) {

    public BoundingQuad {
        Objects.requireNonNull(points, "points");
        points = List.copyOf(points);
    }

    public static BoundingQuad of(QuadPoint... points) {
        return new BoundingQuad(List.of(points));
    }

    /**
     * Builds the quad of an axis-aligned rectangle.
     */
    public static BoundingQuad rectangle(double x, double y, double width, double height) {
        return of(
                new QuadPoint(x, y),
                new QuadPoint(x + width, y),
                new QuadPoint(x + width, y + height),
                new QuadPoint(x, y + height));
    }

    /**
     * A quad is usable when it has at least two points and all coordinates are finite.
     */
    public boolean isUsable() {
        return points.size() >= 2 && points.stream().allMatch(QuadPoint::isFinite);
    }

    public double minX() {
        return points.stream().mapToDouble(QuadPoint::x).min().orElse(0.0);
    }

    public double maxX() {
        return points.stream().mapToDouble(QuadPoint::x).max().orElse(0.0);
    }

    public double minY() {
        return points.stream().mapToDouble(QuadPoint::y).min().orElse(0.0);
    }

    public double maxY() {
        return points.stream().mapToDouble(QuadPoint::y).max().orElse(0.0);
    }

    public double width() {
        return maxX() - minX();
    }

    public double height() {
        return maxY() - minY();
    }

    public double area() {
        return width() * height();
    }

    public double centerX() {
        return (minX() + maxX()) / 2;
    }

    public double centerY() {
        return (minY() + maxY()) / 2;
    }
}
