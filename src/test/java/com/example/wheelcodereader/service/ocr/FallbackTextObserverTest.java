package com.example.wheelcodereader.service.ocr;

import com.example.wheelcodereader.model.ObservationResult;
import com.example.wheelcodereader.model.TextObservation;
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
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FallbackTextObserverTest {

    @Mock
    private TextObserver primary;

    @Mock
    private TextObserver secondary;

    private FallbackTextObserver observer;
    private final BufferedImage image = new BufferedImage(10, 10, BufferedImage.TYPE_BYTE_GRAY);

    @BeforeEach
    void setUp() {
        when(primary.name()).thenReturn("tesseract");
        when(secondary.name()).thenReturn("cloud");
        observer = new FallbackTextObserver(primary, secondary, 0.7);
    }

    @Test
    void confidentPrimaryResultIsUsedDirectly() {
        ObservationResult confident = ObservationResult.success(List.of(TextObservation.of("AT64202", 0.9)));
        when(primary.observe(image)).thenReturn(confident);

        assertThat(observer.observe(image)).isSameAs(confident);
        verify(secondary, never()).observe(image);
    }

    @Test
    void weakPrimaryResultIsReplacedBySecondary() {
        ObservationResult weak = ObservationResult.success(List.of(TextObservation.of("AT6420", 0.4)));
        ObservationResult strong = ObservationResult.success(List.of(TextObservation.of("AT64202", 0.95)));
        when(primary.observe(image)).thenReturn(weak);
        when(secondary.observe(image)).thenReturn(strong);

        assertThat(observer.observe(image)).isSameAs(strong);
    }

    @Test
    void failingSecondaryKeepsUsablePrimaryResult() {
        ObservationResult weak = ObservationResult.success(List.of(TextObservation.of("AT6420", 0.4)));
        when(primary.observe(image)).thenReturn(weak);
        when(secondary.observe(image)).thenReturn(ObservationResult.failure("cloud", "timeout"));

        assertThat(observer.observe(image)).isSameAs(weak);
    }

    @Test
    void failedPrimaryFallsBackToSecondary() {
        ObservationResult strong = ObservationResult.success(List.of(TextObservation.of("AT64202", 0.95)));
        when(primary.observe(image)).thenReturn(ObservationResult.failure("tesseract", "no tessdata"));
        when(secondary.observe(image)).thenReturn(strong);

        assertThat(observer.observe(image)).isSameAs(strong);
        assertThat(observer.name()).isEqualTo("tesseract+cloud");
    }
}
