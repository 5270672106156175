package com.example.wheelcodereader.service.preprocessing;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;
import java.awt.image.RescaleOp;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Enhancement chain that works without native dependencies: grayscale
 * conversion, then an optional linear contrast stretch and an optional
 * Laplacian sharpen. Engraved metal text loses strokes under global
 * thresholding, so no binarization is applied.
 */
public class GrayscaleImageEnhancer implements ImageEnhancer {

    public static final float DEFAULT_CONTRAST_SCALE = 1.6f;
    public static final float DEFAULT_CONTRAST_OFFSET = -20f;
    public static final float DEFAULT_SHARPEN_AMOUNT = 1.0f;

    private final List<UnaryOperator<BufferedImage>> steps = new ArrayList<>();

    public GrayscaleImageEnhancer() {
        this(DEFAULT_CONTRAST_SCALE, DEFAULT_CONTRAST_OFFSET, DEFAULT_SHARPEN_AMOUNT);
    }

    /**
     * @param contrastScale  gain of the contrast stretch, {@code 1} disables it together with a zero offset
     * @param contrastOffset offset added after scaling, in gray levels
     * @param sharpenAmount  weight of the Laplacian added back to the image, {@code 0} disables sharpening
     */
    public GrayscaleImageEnhancer(float contrastScale, float contrastOffset, float sharpenAmount) {
        if (contrastScale <= 0 || sharpenAmount < 0) {
            throw new IllegalArgumentException("Contrast scale must be positive and sharpen amount non-negative");
        }
        steps.add(GrayscaleImageEnhancer::toGrayscale);
        if (contrastScale != 1f || contrastOffset != 0f) {
            RescaleOp stretch = new RescaleOp(contrastScale, contrastOffset, null);
            steps.add(image -> stretch.filter(image, null));
        }
        if (sharpenAmount > 0) {
            ConvolveOp sharpen = new ConvolveOp(laplacianKernel(sharpenAmount), ConvolveOp.EDGE_NO_OP, null);
            steps.add(image -> sharpen.filter(image, blankLike(image)));
        }
    }

    @Override
    public BufferedImage enhance(BufferedImage input) {
        if (input == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        BufferedImage current = input;
        for (UnaryOperator<BufferedImage> step : steps) {
            current = step.apply(current);
        }
        return current;
    }

    int stepCount() {
        return steps.size();
    }

    static Kernel laplacianKernel(float amount) {
        float center = 1f + 4f * amount;
        return new Kernel(3, 3, new float[]{
                0f, -amount, 0f,
                -amount, center, -amount,
                0f, -amount, 0f
        });
    }

    private static BufferedImage toGrayscale(BufferedImage input) {
        BufferedImage grayscale = blankLike(input);
        Graphics2D g = grayscale.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(input, 0, 0, null);
        } finally {
            g.dispose();
        }
        return grayscale;
    }

    private static BufferedImage blankLike(BufferedImage image) {
        return new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
    }
}
