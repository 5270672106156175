package com.example.wheelcodereader.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized settings of the recognizer. Every value falls back to its field
 * default when absent. The bean is mutable for binding only; services read it
 * through {@link #toFilterConfig()} and {@link #toFusionConfig()} snapshots.
 */
@ConfigurationProperties(prefix = "wheel")
public class WheelRecognitionProperties {

    private final Preprocessing preprocessing = new Preprocessing();
    private final Postprocessing postprocessing = new Postprocessing();
    private final MultiAngle multiAngle = new MultiAngle();
    private final LineGrouping lineGrouping = new LineGrouping();
    private final Ocr ocr = new Ocr();
    private final SystemSettings system = new SystemSettings();

    public Preprocessing getPreprocessing() {
        return preprocessing;
    }

    public Postprocessing getPostprocessing() {
        return postprocessing;
    }

    public MultiAngle getMultiAngle() {
        return multiAngle;
    }

    public LineGrouping getLineGrouping() {
        return lineGrouping;
    }

    public Ocr getOcr() {
        return ocr;
    }

    public SystemSettings getSystem() {
        return system;
    }

    public FilterConfig toFilterConfig() {
        Postprocessing p = postprocessing;
        RegionFilterConfig region = new RegionFilterConfig(
                p.getMinAreaRatio(),
                p.getMaxAreaRatio(),
                p.getMinAspectRatio(),
                p.getMaxAspectRatio(),
                p.isCenterRegionOnly(),
                p.getCenterRegionRatio());
        return FilterConfig.builder()
                .minConfidence(p.getMinConfidence())
                .minLength(p.getMinLength())
                .maxLength(p.getMaxLength())
                .enableCharFilter(p.isEnableCharFilter())
                .allowedChars(p.getAllowedChars())
                .enableCorrection(p.isEnableCorrection())
                .enableDeduplication(p.isEnableDeduplication())
                .similarityThreshold(p.getSimilarityThreshold())
                .minResults(p.getMinResults())
                .enableRegionFilter(p.isEnableRegionFilter())
                .regionFilter(region)
                .build();
    }

    public FusionConfig toFusionConfig() {
        return new FusionConfig(
                multiAngle.getFusionMethod(),
                multiAngle.getMinImages(),
                multiAngle.getMaxImages(),
                multiAngle.isReturnAlternatives(),
                multiAngle.getAlternativeThreshold());
    }

    public static class Preprocessing {

        private boolean enable = true;
        private float contrastScale = 1.6f;
        private float contrastOffset = -20f;
        private float sharpenAmount = 1.0f;

        public boolean isEnable() {
            return enable;
        }

        public void setEnable(boolean enable) {
            this.enable = enable;
        }

        public float getContrastScale() {
            return contrastScale;
        }

        public void setContrastScale(float contrastScale) {
            this.contrastScale = contrastScale;
        }

        public float getContrastOffset() {
            return contrastOffset;
        }

        public void setContrastOffset(float contrastOffset) {
            this.contrastOffset = contrastOffset;
        }

        public float getSharpenAmount() {
            return sharpenAmount;
        }

        public void setSharpenAmount(float sharpenAmount) {
            this.sharpenAmount = sharpenAmount;
        }
    }

    public static class Postprocessing {

        private double minConfidence = 0.6;
        private int minLength = 1;
        private int maxLength = 30;
        private boolean enableCharFilter = true;
        private String allowedChars = "";
        private boolean enableCorrection = true;
        private boolean enableDeduplication = true;
        private double similarityThreshold = 0.9;
        private int minResults = 0;
        private boolean enableRegionFilter = false;
        private double minAreaRatio = 0.0001;
        private double maxAreaRatio = 0.1;
        private double minAspectRatio = 0.2;
        private double maxAspectRatio = 10.0;
        private boolean centerRegionOnly = false;
        private double centerRegionRatio = 0.6;

        public double getMinConfidence() {
            return minConfidence;
        }

        public void setMinConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
        }

        public int getMinLength() {
            return minLength;
        }

        public void setMinLength(int minLength) {
            this.minLength = minLength;
        }

        public int getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(int maxLength) {
            this.maxLength = maxLength;
        }

        public boolean isEnableCharFilter() {
            return enableCharFilter;
        }

        public void setEnableCharFilter(boolean enableCharFilter) {
            this.enableCharFilter = enableCharFilter;
        }

        public String getAllowedChars() {
            return allowedChars;
        }

        public void setAllowedChars(String allowedChars) {
            this.allowedChars = allowedChars;
        }

        public boolean isEnableCorrection() {
            return enableCorrection;
        }

        public void setEnableCorrection(boolean enableCorrection) {
            this.enableCorrection = enableCorrection;
        }

        public boolean isEnableDeduplication() {
            return enableDeduplication;
        }

        public void setEnableDeduplication(boolean enableDeduplication) {
            this.enableDeduplication = enableDeduplication;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public int getMinResults() {
            return minResults;
        }

        public void setMinResults(int minResults) {
            this.minResults = minResults;
        }

        public boolean isEnableRegionFilter() {
            return enableRegionFilter;
        }

        public void setEnableRegionFilter(boolean enableRegionFilter) {
            this.enableRegionFilter = enableRegionFilter;
        }

        public double getMinAreaRatio() {
            return minAreaRatio;
        }

        public void setMinAreaRatio(double minAreaRatio) {
            this.minAreaRatio = minAreaRatio;
        }

        public double getMaxAreaRatio() {
            return maxAreaRatio;
        }

        public void setMaxAreaRatio(double maxAreaRatio) {
            this.maxAreaRatio = maxAreaRatio;
        }

        public double getMinAspectRatio() {
            return minAspectRatio;
        }

        public void setMinAspectRatio(double minAspectRatio) {
            this.minAspectRatio = minAspectRatio;
        }

        public double getMaxAspectRatio() {
            return maxAspectRatio;
        }

        public void setMaxAspectRatio(double maxAspectRatio) {
            this.maxAspectRatio = maxAspectRatio;
        }

        public boolean isCenterRegionOnly() {
            return centerRegionOnly;
        }

        public void setCenterRegionOnly(boolean centerRegionOnly) {
            this.centerRegionOnly = centerRegionOnly;
        }

        public double getCenterRegionRatio() {
            return centerRegionRatio;
        }

        public void setCenterRegionRatio(double centerRegionRatio) {
            this.centerRegionRatio = centerRegionRatio;
        }
    }

    public static class MultiAngle {

        private String fusionMethod = "voting";
        private int minImages = 2;
        private int maxImages = 10;
        private boolean returnAlternatives = true;
        private double alternativeThreshold = 0.85;

        public String getFusionMethod() {
            return fusionMethod;
        }

        public void setFusionMethod(String fusionMethod) {
            this.fusionMethod = fusionMethod;
        }

        public int getMinImages() {
            return minImages;
        }

        public void setMinImages(int minImages) {
            this.minImages = minImages;
        }

        public int getMaxImages() {
            return maxImages;
        }

        public void setMaxImages(int maxImages) {
            this.maxImages = maxImages;
        }

        public boolean isReturnAlternatives() {
            return returnAlternatives;
        }

        public void setReturnAlternatives(boolean returnAlternatives) {
            this.returnAlternatives = returnAlternatives;
        }

        public double getAlternativeThreshold() {
            return alternativeThreshold;
        }

        public void setAlternativeThreshold(double alternativeThreshold) {
            this.alternativeThreshold = alternativeThreshold;
        }
    }

    public static class LineGrouping {

        private double yThreshold = 50.0;

        public double getYThreshold() {
            return yThreshold;
        }

        public void setYThreshold(double yThreshold) {
            this.yThreshold = yThreshold;
        }
    }

    public static class Ocr {

        private String datapath = "";
        private String language = "eng";
        private int pageSegMode = 11;
        private double fallbackConfidenceThreshold = 0.7;

        public String getDatapath() {
            return datapath;
        }

        public void setDatapath(String datapath) {
            this.datapath = datapath;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public int getPageSegMode() {
            return pageSegMode;
        }

        public void setPageSegMode(int pageSegMode) {
            this.pageSegMode = pageSegMode;
        }

        public double getFallbackConfidenceThreshold() {
            return fallbackConfidenceThreshold;
        }

        public void setFallbackConfidenceThreshold(double fallbackConfidenceThreshold) {
            this.fallbackConfidenceThreshold = fallbackConfidenceThreshold;
        }
    }

    public static class SystemSettings {

        private int numWorkers = 4;

        public int getNumWorkers() {
            return numWorkers;
        }

        public void setNumWorkers(int numWorkers) {
            this.numWorkers = numWorkers;
        }
    }
}
