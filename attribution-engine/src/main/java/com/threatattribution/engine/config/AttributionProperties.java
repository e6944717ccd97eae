package com.threatattribution.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for training and prediction.
 *
 * <p>
 * Defaults reproduce the reference attribution model: 100 synthetic incidents
 * per intrusion set, an 80/20 stratified split seeded with 27, Laplace
 * smoothing and the top three labels per prediction.
 * </p>
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "attribution")
public class AttributionProperties {

    @Min(1)
    @Max(100)
    private int topN = 3;

    @NotBlank
    private String defaultDatabaseVersion = "(0, 0, 1)";

    @Valid
    private Model model = new Model();
    @Valid
    private Training training = new Training();
    @Valid
    private Generator generator = new Generator();

    public int getTopN() {
        return topN;
    }

    public void setTopN(int topN) {
        this.topN = topN;
    }

    public String getDefaultDatabaseVersion() {
        return defaultDatabaseVersion;
    }

    public void setDefaultDatabaseVersion(String defaultDatabaseVersion) {
        this.defaultDatabaseVersion = defaultDatabaseVersion;
    }

    public Model getModel() {
        return model;
    }

    public void setModel(Model model) {
        this.model = model;
    }

    public Training getTraining() {
        return training;
    }

    public void setTraining(Training training) {
        this.training = training;
    }

    public Generator getGenerator() {
        return generator;
    }

    public void setGenerator(Generator generator) {
        this.generator = generator;
    }

    /** Location of the default model artifact loaded at startup. */
    public static class Model {
        /** Artifact directory; no model is loaded when unset. */
        private String artifactPath;
        @NotBlank
        private String modelFileName = "model.json";
        @NotBlank
        private String metaFileName = "meta_data.json";

        public String getArtifactPath() {
            return artifactPath;
        }

        public void setArtifactPath(String artifactPath) {
            this.artifactPath = artifactPath;
        }

        public String getModelFileName() {
            return modelFileName;
        }

        public void setModelFileName(String modelFileName) {
            this.modelFileName = modelFileName;
        }

        public String getMetaFileName() {
            return metaFileName;
        }

        public void setMetaFileName(String metaFileName) {
            this.metaFileName = metaFileName;
        }
    }

    public static class Training {
        @Min(2)
        private int samplesPerLabel = 100;
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "0.5")
        private double testSize = 0.2;
        private long randomSeed = 27L;
        @DecimalMin(value = "0.0", inclusive = false)
        private double smoothing = 1.0;

        public int getSamplesPerLabel() {
            return samplesPerLabel;
        }

        public void setSamplesPerLabel(int samplesPerLabel) {
            this.samplesPerLabel = samplesPerLabel;
        }

        public double getTestSize() {
            return testSize;
        }

        public void setTestSize(double testSize) {
            this.testSize = testSize;
        }

        public long getRandomSeed() {
            return randomSeed;
        }

        public void setRandomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
        }

        public double getSmoothing() {
            return smoothing;
        }

        public void setSmoothing(double smoothing) {
            this.smoothing = smoothing;
        }
    }

    /** Shape of the synthetic incidents generated from intrusion sets. */
    public static class Generator {
        @Min(1)
        private int minIncidentSize = 10;
        @Min(2)
        private int maxIncidentSize = 50;
        @DecimalMin("0.0")
        private double betaAlpha = 1.5;
        @DecimalMin("0.0")
        private double betaBeta = 10.0;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double attackPatternFraction = 0.5;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double toolFraction = 0.2;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double malwareFraction = 0.2;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double otherFraction = 0.1;

        public int getMinIncidentSize() {
            return minIncidentSize;
        }

        public void setMinIncidentSize(int minIncidentSize) {
            this.minIncidentSize = minIncidentSize;
        }

        public int getMaxIncidentSize() {
            return maxIncidentSize;
        }

        public void setMaxIncidentSize(int maxIncidentSize) {
            this.maxIncidentSize = maxIncidentSize;
        }

        public double getBetaAlpha() {
            return betaAlpha;
        }

        public void setBetaAlpha(double betaAlpha) {
            this.betaAlpha = betaAlpha;
        }

        public double getBetaBeta() {
            return betaBeta;
        }

        public void setBetaBeta(double betaBeta) {
            this.betaBeta = betaBeta;
        }

        public double getAttackPatternFraction() {
            return attackPatternFraction;
        }

        public void setAttackPatternFraction(double attackPatternFraction) {
            this.attackPatternFraction = attackPatternFraction;
        }

        public double getToolFraction() {
            return toolFraction;
        }

        public void setToolFraction(double toolFraction) {
            this.toolFraction = toolFraction;
        }

        public double getMalwareFraction() {
            return malwareFraction;
        }

        public void setMalwareFraction(double malwareFraction) {
            this.malwareFraction = malwareFraction;
        }

        public double getOtherFraction() {
            return otherFraction;
        }

        public void setOtherFraction(double otherFraction) {
            this.otherFraction = otherFraction;
        }
    }
}
