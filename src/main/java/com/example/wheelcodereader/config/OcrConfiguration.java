package com.example.wheelcodereader.config;

import com.example.wheelcodereader.service.ocr.TesseractTextObserver;
import com.example.wheelcodereader.service.ocr.TextObserver;
import com.example.wheelcodereader.service.preprocessing.GrayscaleImageEnhancer;
import com.example.wheelcodereader.service.preprocessing.ImageEnhancer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import net.sourceforge.tess4j.Tesseract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the default OCR engine and image enhancer. A different engine, or a
 * {@link com.example.wheelcodereader.service.ocr.FallbackTextObserver} in front of
 * a cloud service, can be wired in by declaring a {@code @Primary} {@link TextObserver}.
 */
@Configuration
public class OcrConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OcrConfiguration.class);

    private static final String TESSDATA_ENV = "TESSDATA_PREFIX";
    private static final List<String> INSTALL_LOCATIONS = List.of(
            "/usr/share/tesseract-ocr/5/tessdata",
            "/usr/share/tesseract-ocr/4.00/tessdata",
            "C:/Program Files/Tesseract-OCR/tessdata");

    @Bean
    public Tesseract tesseract(WheelRecognitionProperties properties) {
        WheelRecognitionProperties.Ocr ocr = properties.getOcr();
        Tesseract tesseract = new Tesseract();
        Optional<Path> dataPath = resolveDataPath(ocr.getDatapath(), ocr.getLanguage());
        if (dataPath.isPresent()) {
            log.info("Using Tesseract language data from {}", dataPath.get());
            tesseract.setDatapath(dataPath.get().toString());
        } else {
            log.warn("No {}.traineddata found; set wheel.ocr.datapath or {}. OCR calls will fail until it is "
                    + "available.", ocr.getLanguage(), TESSDATA_ENV);
        }
        tesseract.setLanguage(ocr.getLanguage());
        tesseract.setOcrEngineMode(1); // LSTM only
        tesseract.setPageSegMode(ocr.getPageSegMode());
        return tesseract;
    }

    @Bean
    public TextObserver textObserver(Tesseract tesseract) {
        return new TesseractTextObserver(tesseract);
    }

    @Bean
    public ImageEnhancer imageEnhancer(WheelRecognitionProperties properties) {
        WheelRecognitionProperties.Preprocessing preprocessing = properties.getPreprocessing();
        return new GrayscaleImageEnhancer(preprocessing.getContrastScale(), preprocessing.getContrastOffset(),
                preprocessing.getSharpenAmount());
    }

    /**
     * First directory holding {@code <language>.traineddata}, looking at each
     * candidate and its {@code tessdata} child. Candidates are the configured
     * path, the {@code TESSDATA_PREFIX} environment variable and system property,
     * then common install locations.
     */
    static Optional<Path> resolveDataPath(String configured, String language) {
        String languageFile = language + ".traineddata";
        Stream<String> explicit = Stream.of(configured, System.getenv(TESSDATA_ENV), System.getProperty(TESSDATA_ENV));
        return Stream.concat(explicit, INSTALL_LOCATIONS.stream())
                .filter(candidate -> candidate != null && !candidate.isBlank())
                .map(candidate -> Paths.get(candidate).normalize())
                .flatMap(base -> Stream.of(base, base.resolve("tessdata")))
                .filter(directory -> Files.isRegularFile(directory.resolve(languageFile)))
                .findFirst();
    }
}
