package com.example.wheelcodereader.service.ocr;

import com.example.wheelcodereader.model.BoundingQuad;
import com.example.wheelcodereader.model.ObservationResult;
import com.example.wheelcodereader.model.OcrError;
import com.example.wheelcodereader.model.TextObservation;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Word;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TesseractTextObserverTest {

    @Mock
    private ITesseract tesseract;

    private TesseractTextObserver observer;
    private BufferedImage image;

    @BeforeEach
    void setUp() {
        observer = new TesseractTextObserver(tesseract);
        image = new BufferedImage(100, 80, BufferedImage.TYPE_BYTE_GRAY);
    }

    @Test
    void convertsWordsToObservations() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt())).thenReturn(List.of(
                new Word("AT64202", 87.5f, new Rectangle(10, 20, 30, 40)),
                new Word("  ", 90f, new Rectangle(0, 0, 5, 5))));

        ObservationResult result = observer.observe(image);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.observations()).singleElement().satisfies(observation -> {
            assertThat(observation.text()).isEqualTo("AT64202");
            assertThat(observation.confidence()).isCloseTo(0.875, within(1e-6));
            BoundingQuad quad = observation.usableQuad().orElseThrow();
            assertThat(quad.minX()).isEqualTo(10);
            assertThat(quad.maxX()).isEqualTo(40);
            assertThat(quad.maxY()).isEqualTo(60);
        });
    }

    @Test
    void reportsEngineExceptionsAsFailure() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt()))
                .thenThrow(new IllegalStateException("tessdata missing"));

        ObservationResult result = observer.observe(image);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).map(OcrError::engine).contains(TesseractTextObserver.ENGINE_NAME);
        assertThat(result.error()).map(OcrError::message).hasValueSatisfying(
                message -> assertThat(message).contains("tessdata missing"));
    }

    @Test
    void reportsMissingNativeLibraryAsFailure() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt()))
                .thenThrow(new UnsatisfiedLinkError("libtesseract not found"));

        assertThat(observer.observe(image).isSuccess()).isFalse();
    }

    @Test
    void reportsNativeMemoryFaultAsFailure() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt()))
                .thenThrow(new Error("Invalid memory access"));

        assertThat(observer.observe(image).isSuccess()).isFalse();
    }

    @Test
    void propagatesOtherErrors() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt()))
                .thenThrow(new OutOfMemoryError("heap"));

        assertThatThrownBy(() -> observer.observe(image)).isInstanceOf(OutOfMemoryError.class);
    }

    @Test
    void rejectsMissingImage() {
        assertThat(observer.observe(null).isSuccess()).isFalse();
    }

    @Test
    void clampsConfidenceToUnitRange() {
        assertThat(TesseractTextObserver.normalizeConfidence(-1f)).isZero();
        assertThat(TesseractTextObserver.normalizeConfidence(120f)).isEqualTo(1.0);
        assertThat(TesseractTextObserver.normalizeConfidence(Float.NaN)).isZero();
    }

    @Test
    void emptyPageIsASuccessWithoutObservations() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt())).thenReturn(List.of());

        ObservationResult result = observer.observe(image);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.observations()).extracting(TextObservation::text).isEmpty();
    }
}
