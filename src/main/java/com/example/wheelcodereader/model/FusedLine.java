package com.example.wheelcodereader.model;

/**
 * Line agreed upon across images at one row position.
 *
 * @param occurrenceCount number of images whose line at that position joined the winning group
 */
public record FusedLine(String text, double confidence, int occurrenceCount) {
}
