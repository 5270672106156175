package com.example.wheelcodereader.config;

import com.example.wheelcodereader.service.MultiAngleRecognitionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class WheelRecognitionPropertiesTest {

    @Autowired
    private WheelRecognitionProperties properties;

    @Autowired
    private MultiAngleRecognitionService multiAngleRecognitionService;

    @Test
    void bindsFilterSettingsFromConfiguration() {
        FilterConfig config = properties.toFilterConfig();

        assertThat(config.minConfidence()).isEqualTo(0.5);
        assertThat(config.allowedChars()).isEqualTo("ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789");
        assertThat(config.minResults()).isEqualTo(2);
        assertThat(config.enableRegionFilter()).isTrue();
        assertThat(config.regionFilter().maxAreaRatio()).isEqualTo(0.2);
        assertThat(config.regionFilter().minAreaRatio()).isEqualTo(0.0001);
        assertThat(config.maxLength()).isEqualTo(30);
    }

    @Test
    void bindsFusionSettingsFromConfiguration() {
        FusionConfig config = properties.toFusionConfig();

        assertThat(config.fusionMethod()).isEqualTo("weighted");
        assertThat(config.maxImages()).isEqualTo(6);
        assertThat(config.alternativeThreshold()).isEqualTo(0.75);
        assertThat(config.minImages()).isEqualTo(2);
        assertThat(config.returnAlternatives()).isTrue();
    }

    @Test
    void bindsWorkerPoolSize() {
        assertThat(properties.getSystem().getNumWorkers()).isEqualTo(2);
        assertThat(multiAngleRecognitionService).isNotNull();
    }
}
