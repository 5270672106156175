package com.example.wheelcodereader.service.preprocessing;

import java.awt.image.BufferedImage;

/**
 * Prepares a photograph for OCR. Implementations return a new image and leave the input untouched.
 */
public interface ImageEnhancer {

    BufferedImage enhance(BufferedImage image);

    static ImageEnhancer identity() {
        return image -> image;
    }
}
