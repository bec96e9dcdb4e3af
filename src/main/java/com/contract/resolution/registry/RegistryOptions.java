package com.contract.resolution.registry;

/**
 * Thresholds applied when mutating a contract snapshot.
 */
public class RegistryOptions {

    private final double ocrConfidenceThreshold;
    private final double referenceConfidenceThreshold;
    private final boolean checkNamingConventions;

    private RegistryOptions(Builder builder) {
        this.ocrConfidenceThreshold = builder.ocrConfidenceThreshold;
        this.referenceConfidenceThreshold = builder.referenceConfidenceThreshold;
        this.checkNamingConventions = builder.checkNamingConventions;
    }

    public static RegistryOptions defaults() {
        return builder().build();
    }

    /**
     * Chunks below this confidence get an OCR warning. Default 0.8.
     */
    public double getOcrConfidenceThreshold() {
        return ocrConfidenceThreshold;
    }

    /**
     * Detected references below this confidence are not registered. Default 0.7.
     */
    public double getReferenceConfidenceThreshold() {
        return referenceConfidenceThreshold;
    }

    public boolean isCheckNamingConventions() {
        return checkNamingConventions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double ocrConfidenceThreshold = 0.8;
        private double referenceConfidenceThreshold = 0.7;
        private boolean checkNamingConventions = true;

        public Builder ocrConfidenceThreshold(double threshold) {
            this.ocrConfidenceThreshold = threshold;
            return this;
        }

        public Builder referenceConfidenceThreshold(double threshold) {
            this.referenceConfidenceThreshold = threshold;
            return this;
        }

        public Builder checkNamingConventions(boolean check) {
            this.checkNamingConventions = check;
            return this;
        }

        public RegistryOptions build() {
            if (ocrConfidenceThreshold < 0.0 || ocrConfidenceThreshold > 1.0) {
                throw new IllegalArgumentException("ocrConfidenceThreshold must be between 0.0 and 1.0");
            }
            if (referenceConfidenceThreshold < 0.0 || referenceConfidenceThreshold > 1.0) {
                throw new IllegalArgumentException("referenceConfidenceThreshold must be between 0.0 and 1.0");
            }
            return new RegistryOptions(this);
        }
    }
}
