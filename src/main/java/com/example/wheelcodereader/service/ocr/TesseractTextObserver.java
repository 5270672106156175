package com.example.wheelcodereader.service.ocr;

import com.example.wheelcodereader.model.BoundingQuad;
import com.example.wheelcodereader.model.ObservationResult;
import com.example.wheelcodereader.model.TextObservation;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.sourceforge.tess4j.ITessAPI.TessPageIteratorLevel;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Word-level local OCR backed by Tesseract. Confidences are rescaled from
 * Tesseract's 0-100 range to {@code [0, 1]}.
 */
public class TesseractTextObserver implements TextObserver {

    private static final Logger log = LoggerFactory.getLogger(TesseractTextObserver.class);

    static final String ENGINE_NAME = "tesseract";

    private final ITesseract tesseract;

    public TesseractTextObserver(ITesseract tesseract) {
        this.tesseract = tesseract;
    }

    @Override
    public String name() {
        return ENGINE_NAME;
    }

    @Override
    public ObservationResult observe(BufferedImage image) {
        if (image == null) {
            return ObservationResult.failure(ENGINE_NAME, "No image supplied");
        }
        List<Word> words;
        try {
            words = tesseract.getWords(image, TessPageIteratorLevel.RIL_WORD);
        } catch (LinkageError e) {
            log.error("Tesseract native library could not be loaded", e);
            return ObservationResult.failure(ENGINE_NAME, "Tesseract native library unavailable: " + e.getMessage());
        } catch (Error e) {
            if ("Invalid memory access".equalsIgnoreCase(e.getMessage())) {
                String message = "Tesseract native layer failed. Verify that the tessdata directory contains the configured language data.";
                log.error(message, e);
                return ObservationResult.failure(ENGINE_NAME, message);
            }
            throw e;
        } catch (RuntimeException e) {
            log.error("Tesseract OCR failed", e);
            return ObservationResult.failure(ENGINE_NAME, "Tesseract OCR failed: " + e.getMessage());
        }

        List<TextObservation> observations = new ArrayList<>();
        if (words != null) {
            for (Word word : words) {
                String text = word.getText() == null ? "" : word.getText().replace('\u0000', ' ').trim();
                if (text.isEmpty()) {
                    continue;
                }
                observations.add(TextObservation.of(text, normalizeConfidence(word.getConfidence()), toQuad(word.getBoundingBox())));
            }
        }
        log.info("Tesseract recognized {} text regions", observations.size());
        return ObservationResult.success(observations);
    }

    static double normalizeConfidence(float confidence) {
        double scaled = confidence / 100.0;
        if (Double.isNaN(scaled) || scaled < 0) {
            return 0.0;
        }
        return Math.min(1.0, scaled);
    }

    private static BoundingQuad toQuad(Rectangle box) {
        if (box == null) {
            return null;
        }
        return BoundingQuad.rectangle(box.getX(), box.getY(), box.getWidth(), box.getHeight());
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "TesseractTextObserver[%s]", tesseract.getClass().getSimpleName());
    }
}
