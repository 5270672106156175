package com.example.wheelcodereader.model;

import java.util.List;
import java.util.Objects;

/**
 * Row of observations merged into one logical line. Members are ordered by
 * horizontal center, left to right.
 */
public record Line(String text, double confidence, List<TextObservation> members) {

    public Line {
        Objects.requireNonNull(text, "text");
        members = List.copyOf(members);
    }

    public int itemCount() {
        return members.size();
    }
}
