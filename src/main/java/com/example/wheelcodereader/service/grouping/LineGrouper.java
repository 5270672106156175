package com.example.wheelcodereader.service.grouping;

import com.example.wheelcodereader.model.BoundingQuad;
import com.example.wheelcodereader.model.Line;
import com.example.wheelcodereader.model.TextObservation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Clusters observations lying on the same row and merges each row into one
 * {@link Line}, read left to right.
 */
@Component
public class LineGrouper {

    private static final Logger log = LoggerFactory.getLogger(LineGrouper.class);

    public static final double DEFAULT_Y_THRESHOLD = 50.0;

    public List<Line> group(List<TextObservation> observations) {
        return group(observations, DEFAULT_Y_THRESHOLD);
    }

    /**
     * @param yThreshold maximum vertical distance, in pixels, between a row's first
     *                   member and any other member
     */
    public List<Line> group(List<TextObservation> observations, double yThreshold) {
        if (observations == null || observations.isEmpty()) {
            return List.of();
        }

        List<TextObservation> byRow = new ArrayList<>(observations);
        byRow.sort(Comparator.comparingDouble(LineGrouper::verticalCenter));

        List<List<TextObservation>> rows = new ArrayList<>();
        List<TextObservation> current = new ArrayList<>();
        double anchor = 0.0;
        for (TextObservation observation : byRow) {
            double center = verticalCenter(observation);
            if (current.isEmpty()) {
                anchor = center;
            } else if (Math.abs(center - anchor) > yThreshold) {
                rows.add(current);
                current = new ArrayList<>();
                anchor = center;
            }
            current.add(observation);
        }
        rows.add(current);

        List<Line> lines = rows.stream().map(LineGrouper::merge).collect(Collectors.toList());
        log.debug("Grouped {} observations into {} lines", observations.size(), lines.size());
        return lines;
    }

    private static Line merge(List<TextObservation> row) {
        List<TextObservation> members = new ArrayList<>(row);
        members.sort(Comparator.comparingDouble(LineGrouper::horizontalCenter));
        String text = members.stream().map(TextObservation::text).collect(Collectors.joining(" "));
        double confidence = members.stream().mapToDouble(TextObservation::confidence).average().orElse(0.0);
        return new Line(text, confidence, members);
    }

    static double verticalCenter(TextObservation observation) {
        return observation.usableQuad().map(BoundingQuad::centerY).orElse(0.0);
    }

    static double horizontalCenter(TextObservation observation) {
        return observation.usableQuad().map(BoundingQuad::centerX).orElse(0.0);
    }
}
