package com.example.wheelcodereader.service.fusion;

import com.example.wheelcodereader.model.FusedLine;
import com.example.wheelcodereader.model.ImageRecognitionResult;
import com.example.wheelcodereader.model.Line;
import com.example.wheelcodereader.util.TextSimilarity;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fuses the line lists of several images by row index: line {@code i} of every
 * image is assumed to show the same physical row. Images reporting fewer rows
 * contribute nothing at the missing positions, so partial occlusion shifts the
 * alignment.
 */
class PositionalLineFusion {

    private static final Logger log = LoggerFactory.getLogger(PositionalLineFusion.class);

    static final double SIMILARITY_THRESHOLD = 0.8;
    static final double MAX_LENGTH_DIFFERENCE = 0.3;

    List<FusedLine> fuse(List<ImageRecognitionResult> results) {
        List<List<Line>> linesByImage = new ArrayList<>();
        for (ImageRecognitionResult result : results) {
            if (result.success() && !result.lines().isEmpty()) {
                linesByImage.add(result.lines());
            }
        }
        int maxLines = linesByImage.stream().mapToInt(List::size).max().orElse(0);

        List<FusedLine> fused = new ArrayList<>();
        for (int position = 0; position < maxLines; position++) {
            List<Line> atPosition = new ArrayList<>();
            for (List<Line> lines : linesByImage) {
                if (position < lines.size()) {
                    atPosition.add(lines.get(position));
                }
            }

            List<LineGroup> groups = groupSimilar(atPosition);
            if (groups.isEmpty()) {
                continue;
            }
            LineGroup best = groups.get(0);
            for (LineGroup group : groups.subList(1, groups.size())) {
                if (group.count() > best.count()
                        || (group.count() == best.count() && group.averageConfidence() > best.averageConfidence())) {
                    best = group;
                }
            }
            log.debug("Line position {}: '{}' seen {} times among {} images",
                    position + 1, best.text(), best.count(), atPosition.size());
            fused.add(new FusedLine(best.text(), best.averageConfidence(), best.count()));
        }

        log.info("Positional line fusion produced {} lines", fused.size());
        return fused;
    }

    private List<LineGroup> groupSimilar(List<Line> lines) {
        List<LineGroup> groups = new ArrayList<>();
        for (Line line : lines) {
            String text = line.text().trim();
            if (text.isEmpty()) {
                continue;
            }
            LineGroup match = null;
            for (LineGroup group : groups) {
                if (isSimilar(text, group.text())) {
                    match = group;
                    break;
                }
            }
            if (match != null) {
                match.add(text, line.confidence());
            } else {
                groups.add(new LineGroup(text, line.confidence()));
            }
        }
        return groups;
    }

    /**
     * Texts are similar when identical, identical once spaces and case are
     * ignored, or when one is a longer or shorter reading of the other within
     * the edit-distance threshold. Same-length readings that disagree on a
     * character are kept apart so that the vote decides between them.
     */
    static boolean isSimilar(String left, String right) {
        if (left.equals(right)) {
            return true;
        }
        String compactLeft = TextSimilarity.compact(left);
        String compactRight = TextSimilarity.compact(right);
        if (compactLeft.equals(compactRight)) {
            return true;
        }
        int lengthDifference = Math.abs(compactLeft.length() - compactRight.length());
        int longest = Math.max(compactLeft.length(), compactRight.length());
        if (lengthDifference == 0 || lengthDifference > longest * MAX_LENGTH_DIFFERENCE) {
            return false;
        }
        return TextSimilarity.similarity(compactLeft, compactRight) >= SIMILARITY_THRESHOLD;
    }

    private static final class LineGroup {

        private String text;
        private double maxConfidence;
        private double sumConfidence;
        private int count;

        private LineGroup(String text, double confidence) {
            this.text = text;
            this.maxConfidence = confidence;
            this.sumConfidence = confidence;
            this.count = 1;
        }

        private void add(String candidate, double confidence) {
            count++;
            sumConfidence += confidence;
            if (confidence > maxConfidence) {
                text = candidate;
                maxConfidence = confidence;
            }
        }

        private String text() {
            return text;
        }

        private int count() {
            return count;
        }

        private double averageConfidence() {
            return sumConfidence / count;
        }
    }
}
