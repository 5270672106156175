package com.example.wheelcodereader.service.preprocessing;

import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.Kernel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrayscaleImageEnhancerTest {

    private final GrayscaleImageEnhancer enhancer = new GrayscaleImageEnhancer();

    @Test
    void producesGrayscaleImageOfTheSameSize() {
        BufferedImage input = new BufferedImage(40, 20, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = input.createGraphics();
        g.setColor(Color.ORANGE);
        g.fillRect(0, 0, 20, 20);
        g.dispose();

        BufferedImage output = enhancer.enhance(input);

        assertThat(output.getType()).isEqualTo(BufferedImage.TYPE_BYTE_GRAY);
        assertThat(output.getWidth()).isEqualTo(40);
        assertThat(output.getHeight()).isEqualTo(20);
        assertThat(input.getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
    }

    @Test
    void neutralSettingsOnlyConvertToGrayscale() {
        GrayscaleImageEnhancer grayscaleOnly = new GrayscaleImageEnhancer(1f, 0f, 0f);
        BufferedImage input = new BufferedImage(3, 3, BufferedImage.TYPE_BYTE_GRAY);
        input.getRaster().setSample(1, 1, 0, 120);

        BufferedImage output = grayscaleOnly.enhance(input);

        assertThat(grayscaleOnly.stepCount()).isEqualTo(1);
        assertThat(output).isNotSameAs(input);
        assertThat(output.getRaster().getSample(1, 1, 0)).isEqualTo(120);
    }

    @Test
    void contrastStretchScalesAndShiftsGrayLevels() {
        GrayscaleImageEnhancer stretchOnly = new GrayscaleImageEnhancer(2f, -10f, 0f);
        BufferedImage input = new BufferedImage(3, 3, BufferedImage.TYPE_BYTE_GRAY);
        input.getRaster().setSample(1, 1, 0, 50);

        BufferedImage output = stretchOnly.enhance(input);

        assertThat(stretchOnly.stepCount()).isEqualTo(2);
        assertThat(output.getRaster().getSample(1, 1, 0)).isEqualTo(90);
    }

    @Test
    void sharpenKernelGrowsWithAmount() {
        Kernel kernel = GrayscaleImageEnhancer.laplacianKernel(0.5f);
        float[] weights = kernel.getKernelData(null);

        assertThat(weights[4]).isEqualTo(3f);
        assertThat(weights[1]).isEqualTo(-0.5f);
        assertThat(weights[0]).isZero();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new GrayscaleImageEnhancer(0f, 0f, 1f)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GrayscaleImageEnhancer(1f, 0f, -1f)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNullImage() {
        assertThatThrownBy(() -> enhancer.enhance(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("null");
    }

    @Test
    void identityEnhancerReturnsTheSameImage() {
        BufferedImage input = new BufferedImage(4, 4, BufferedImage.TYPE_BYTE_GRAY);

        assertThat(ImageEnhancer.identity().enhance(input)).isSameAs(input);
    }
}
