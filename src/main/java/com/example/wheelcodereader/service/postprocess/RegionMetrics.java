package com.example.wheelcodereader.service.postprocess;

import com.example.wheelcodereader.model.BoundingQuad;

/**
 * Geometry of one observation relative to the inferred image extent.
 *
 * @param areaRatio   bounding box area over image area
 * @param aspectRatio width over height, {@code 0} for a flat box
 * @param distRatio   distance of the box center to the image center over the half diagonal
 */
public record RegionMetrics(
        String text,
        double areaRatio,
        double aspectRatio,
        double distRatio,
        double centerX,
        double centerY,
        double imageWidth,
        double imageHeight) {

    static RegionMetrics measure(String text, BoundingQuad quad, double imageWidth, double imageHeight) {
        double width = quad.width();
        double height = quad.height();
        double areaRatio = quad.area() / (imageWidth * imageHeight);
        double aspectRatio = height > 0 ? width / height : 0.0;

        double imageCenterX = imageWidth / 2;
        double imageCenterY = imageHeight / 2;
        double centerX = quad.centerX();
        double centerY = quad.centerY();
        double distToCenter = Math.hypot(centerX - imageCenterX, centerY - imageCenterY);
        double maxDist = Math.hypot(imageCenterX, imageCenterY);
        double distRatio = maxDist > 0 ? distToCenter / maxDist : 1.0;

        return new RegionMetrics(text, areaRatio, aspectRatio, distRatio, centerX, centerY, imageWidth, imageHeight);
    }
}
