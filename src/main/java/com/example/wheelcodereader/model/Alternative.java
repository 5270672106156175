package com.example.wheelcodereader.model;

/**
 * Runner-up reading reported next to a fused winner. For the {@code smart}
 * method, which ranks raw confidences, {@code score} equals {@code confidence}.
 */
public record Alternative(String text, double score, double confidence) {
}
