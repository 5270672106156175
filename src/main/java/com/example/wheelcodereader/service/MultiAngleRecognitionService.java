package com.example.wheelcodereader.service;

import com.example.wheelcodereader.config.FilterConfig;
import com.example.wheelcodereader.config.FusionConfig;
import com.example.wheelcodereader.config.WheelRecognitionProperties;
import com.example.wheelcodereader.model.FusedResult;
import com.example.wheelcodereader.model.ImageRecognitionResult;
import com.example.wheelcodereader.service.fusion.MultiSourceFusion;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Recognizes several photographs of the same hub on a worker pool and fuses
 * them into one answer. Results are always collected in submission order.
 */
@Service
public class MultiAngleRecognitionService {

    private static final Logger log = LoggerFactory.getLogger(MultiAngleRecognitionService.class);

    private final WheelRecognitionService recognitionService;
    private final MultiSourceFusion fusion;
    private final ExecutorService executor;
    private final WheelRecognitionProperties properties;

    public MultiAngleRecognitionService(WheelRecognitionService recognitionService,
                                        MultiSourceFusion fusion,
                                        @Qualifier("recognitionExecutor") ExecutorService executor,
                                        WheelRecognitionProperties properties) {
        this.recognitionService = recognitionService;
        this.fusion = fusion;
        this.executor = executor;
        this.properties = properties;
    }

    public FusedResult recognizeMultiAngle(List<BufferedImage> images) {
        FusionConfig fusionConfig = properties.toFusionConfig();
        List<ImageRecognitionResult> individual = recognizeBatch(images);
        FusedResult fused = fusion.fuse(individual, fusionConfig);
        if (fused.success()) {
            log.info("Fused {} images into '{}' (confidence {})", fused.sourceCount(), fused.mergedText(),
                    fused.confidence());
        } else {
            log.warn("Multi-angle fusion failed: {}", fused.error());
        }
        return fused;
    }

    public List<ImageRecognitionResult> recognizeBatch(List<BufferedImage> images) {
        if (images == null || images.isEmpty()) {
            return List.of();
        }
        boolean enhance = properties.getPreprocessing().isEnable();
        FilterConfig filterConfig = properties.toFilterConfig();
        double yThreshold = properties.getLineGrouping().getYThreshold();

        List<Future<ImageRecognitionResult>> futures = new ArrayList<>(images.size());
        for (int index = 0; index < images.size(); index++) {
            BufferedImage image = images.get(index);
            int sourceIndex = index;
            futures.add(executor.submit(
                    () -> recognitionService.recognize(image, sourceIndex, enhance, filterConfig, yThreshold)));
        }

        List<ImageRecognitionResult> results = new ArrayList<>(futures.size());
        for (int index = 0; index < futures.size(); index++) {
            try {
                results.add(futures.get(index).get());
            } catch (ExecutionException e) {
                log.error("Recognition of image {} failed", index, e.getCause());
                results.add(ImageRecognitionResult.failure("Recognition failed: " + e.getCause().getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for image {}, abandoning the remaining images", index);
                for (int remaining = index; remaining < futures.size(); remaining++) {
                    futures.get(remaining).cancel(true);
                    results.add(ImageRecognitionResult.failure("Recognition interrupted"));
                }
                break;
            }
        }
        log.info("Batch recognition finished for {} images", images.size());
        return results;
    }
}
