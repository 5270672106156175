package com.example.wheelcodereader.service;

import com.example.wheelcodereader.config.WheelRecognitionProperties;
import com.example.wheelcodereader.model.BoundingQuad;
import com.example.wheelcodereader.model.ImageRecognitionResult;
import com.example.wheelcodereader.model.Line;
import com.example.wheelcodereader.model.ObservationResult;
import com.example.wheelcodereader.model.TextObservation;
import com.example.wheelcodereader.service.grouping.LineGrouper;
import com.example.wheelcodereader.service.ocr.TextObserver;
import com.example.wheelcodereader.service.postprocess.ResultFilterPipeline;
import com.example.wheelcodereader.service.preprocessing.ImageEnhancer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WheelRecognitionServiceTest {

    @Mock
    private ImageEnhancer enhancer;

    @Mock
    private TextObserver observer;

    private WheelRecognitionProperties properties;
    private WheelRecognitionService service;
    private final BufferedImage image = new BufferedImage(1000, 1000, BufferedImage.TYPE_BYTE_GRAY);

    @BeforeEach
    void setUp() {
        properties = new WheelRecognitionProperties();
        when(observer.name()).thenReturn("tesseract");
        when(enhancer.enhance(any(BufferedImage.class))).thenAnswer(invocation -> invocation.getArgument(0));
        service = new WheelRecognitionService(enhancer, observer, new ResultFilterPipeline(), new LineGrouper(),
                properties);
    }

    @Test
    void filtersRanksAndGroupsObservations() {
        when(observer.observe(image)).thenReturn(ObservationResult.success(List.of(
                TextObservation.of("MADE", 0.7, BoundingQuad.rectangle(400, 600, 60, 20)),
                TextObservation.of("AT6O2O2", 0.9, BoundingQuad.rectangle(420, 400, 80, 20)),
                TextObservation.of("noise", 0.2, BoundingQuad.rectangle(100, 100, 20, 20)))));

        ImageRecognitionResult result = service.recognize(image, 3, true, properties.toFilterConfig(), 50);

        assertThat(result.success()).isTrue();
        assertThat(result.engineUsed()).isEqualTo("tesseract");
        assertThat(result.observations()).extracting(TextObservation::text).containsExactly("AT60202", "MADE");
        assertThat(result.observations()).allSatisfy(observation ->
                assertThat(observation.sourceImageIndex()).isEqualTo(3));
        assertThat(result.lines()).extracting(Line::text).containsExactly("AT60202", "MADE");
        verify(enhancer).enhance(image);
    }

    @Test
    void skipsEnhancementWhenPreprocessingIsDisabled() {
        properties.getPreprocessing().setEnable(false);
        when(observer.observe(image)).thenReturn(ObservationResult.success(List.of()));

        ImageRecognitionResult result = service.recognize(image);

        assertThat(result.success()).isTrue();
        assertThat(result.totalTexts()).isZero();
        verifyNoInteractions(enhancer);
    }

    @Test
    void explicitFlagOverridesTheCurrentProperties() {
        when(observer.observe(image)).thenReturn(ObservationResult.success(List.of()));

        service.recognize(image, 0, false, properties.toFilterConfig(), 50);

        assertThat(properties.getPreprocessing().isEnable()).isTrue();
        verifyNoInteractions(enhancer);
    }

    @Test
    void reportsEngineFailure() {
        when(observer.observe(image)).thenReturn(ObservationResult.failure("tesseract", "no tessdata"));

        ImageRecognitionResult result = service.recognize(image);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("no tessdata");
        assertThat(result.observations()).isEmpty();
    }

    @Test
    void reportsMissingImage() {
        ImageRecognitionResult result = service.recognize(null);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Image could not be loaded");
        verify(observer, never()).observe(any());
    }
}
