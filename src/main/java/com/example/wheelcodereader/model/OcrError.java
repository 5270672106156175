package com.example.wheelcodereader.model;

/**
 * Failure reported by an OCR engine.
 */
public record OcrError(String engine, String message) {
}
