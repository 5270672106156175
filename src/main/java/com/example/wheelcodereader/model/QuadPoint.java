package com.example.wheelcodereader.model;

/**
 * Single corner of a {@link BoundingQuad}, expressed in source image pixels.
 */
public record QuadPoint(double x, double y) {

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
