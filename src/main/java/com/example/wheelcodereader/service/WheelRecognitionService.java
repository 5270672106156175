package com.example.wheelcodereader.service;

import com.example.wheelcodereader.config.FilterConfig;
import com.example.wheelcodereader.config.WheelRecognitionProperties;
import com.example.wheelcodereader.model.ImageRecognitionResult;
import com.example.wheelcodereader.model.Line;
import com.example.wheelcodereader.model.ObservationResult;
import com.example.wheelcodereader.model.OcrError;
import com.example.wheelcodereader.model.TextObservation;
import com.example.wheelcodereader.service.grouping.LineGrouper;
import com.example.wheelcodereader.service.ocr.TextObserver;
import com.example.wheelcodereader.service.postprocess.ResultFilterPipeline;
import com.example.wheelcodereader.service.preprocessing.ImageEnhancer;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Recognizes the hub code candidates of a single photograph: enhance, observe,
 * filter and rank, then group into lines.
 */
@Service
public class WheelRecognitionService {

    private static final Logger log = LoggerFactory.getLogger(WheelRecognitionService.class);

    private final ImageEnhancer enhancer;
    private final TextObserver observer;
    private final ResultFilterPipeline pipeline;
    private final LineGrouper lineGrouper;
    private final WheelRecognitionProperties properties;

    public WheelRecognitionService(ImageEnhancer enhancer,
                                   TextObserver observer,
                                   ResultFilterPipeline pipeline,
                                   LineGrouper lineGrouper,
                                   WheelRecognitionProperties properties) {
        this.enhancer = enhancer;
        this.observer = observer;
        this.pipeline = pipeline;
        this.lineGrouper = lineGrouper;
        this.properties = properties;
    }

    public ImageRecognitionResult recognize(BufferedImage image) {
        return recognize(image, 0, properties.getPreprocessing().isEnable(), properties.toFilterConfig(),
                properties.getLineGrouping().getYThreshold());
    }

    /**
     * Recognizes one image of a batch with an explicit settings snapshot.
     *
     * @param sourceImageIndex position of the image inside its batch
     * @param enhance          whether the image goes through the enhancer before OCR
     */
    public ImageRecognitionResult recognize(BufferedImage image, int sourceImageIndex, boolean enhance,
            FilterConfig filterConfig, double yThreshold) {
        long start = System.nanoTime();
        if (image == null) {
            return ImageRecognitionResult.failure("Image could not be loaded", observer.name(), 0L);
        }

        BufferedImage prepared = enhance ? enhancer.enhance(image) : image;
        ObservationResult observed = observer.observe(prepared);
        if (!observed.isSuccess()) {
            String reason = observed.error().map(OcrError::message).orElse("OCR engine failed");
            log.warn("OCR failed for image {}: {}", sourceImageIndex, reason);
            return ImageRecognitionResult.failure(reason, observer.name(), elapsedMillis(start));
        }

        List<TextObservation> tagged = observed.observations().stream()
                .map(observation -> observation.withSourceImageIndex(sourceImageIndex))
                .collect(Collectors.toList());
        List<TextObservation> ranked = pipeline.process(tagged, filterConfig);
        List<Line> lines = lineGrouper.group(ranked, yThreshold);

        long elapsed = elapsedMillis(start);
        log.debug("Image {} produced {} candidates in {} lines within {} ms",
                sourceImageIndex, ranked.size(), lines.size(), elapsed);
        return ImageRecognitionResult.success(ranked, lines, observer.name(), elapsed);
    }

    private static long elapsedMillis(long start) {
        return Duration.ofNanos(System.nanoTime() - start).toMillis();
    }
}
