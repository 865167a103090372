package com.example.sgkdocumentreader.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "sgk")
public class PipelineProperties {

    private final Upload upload = new Upload();
    private final Ocr ocr = new Ocr();
    private final Rectifier rectifier = new Rectifier();
    private final Matching matching = new Matching();
    private final Classification classification = new Classification();
    private final Packaging packaging = new Packaging();
    private final Storage storage = new Storage();

    public Upload getUpload() {
        return upload;
    }

    public Ocr getOcr() {
        return ocr;
    }

    public Rectifier getRectifier() {
        return rectifier;
    }

    public Matching getMatching() {
        return matching;
    }

    public Classification getClassification() {
        return classification;
    }

    public Packaging getPackaging() {
        return packaging;
    }

    public Storage getStorage() {
        return storage;
    }

    public static class Upload {

        private long maxBytes = 15L * 1024 * 1024;
        private List<String> allowedTypes = new ArrayList<>(
                List.of("image/jpeg", "image/png", "image/tiff", "application/pdf"));
        private float pdfRenderDpi = 150f;
        private int batchThreads = 2;
        private int batchQueueCapacity = 100;

        public long getMaxBytes() {
            return maxBytes;
        }

        public void setMaxBytes(long maxBytes) {
            this.maxBytes = maxBytes;
        }

        public List<String> getAllowedTypes() {
            return allowedTypes;
        }

        public void setAllowedTypes(List<String> allowedTypes) {
            this.allowedTypes = allowedTypes;
        }

        public float getPdfRenderDpi() {
            return pdfRenderDpi;
        }

        public void setPdfRenderDpi(float pdfRenderDpi) {
            this.pdfRenderDpi = pdfRenderDpi;
        }

        public int getBatchThreads() {
            return batchThreads;
        }

        public void setBatchThreads(int batchThreads) {
            this.batchThreads = batchThreads;
        }

        public int getBatchQueueCapacity() {
            return batchQueueCapacity;
        }

        public void setBatchQueueCapacity(int batchQueueCapacity) {
            this.batchQueueCapacity = batchQueueCapacity;
        }
    }

    public static class Ocr {

        private boolean enabled = true;
        private String datapath = "";
        private String language = "tur+eng";
        private Duration timeout = Duration.ofSeconds(60);
        private int threads = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

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

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    public static class Rectifier {

        private int maxAnalysisDimension = 1200;
        private double edgeDensityFraction = 0.08;
        private double marginFraction = 0.05;
        private double minimumScore = 0.5;
        private boolean opencvEnabled = true;

        public int getMaxAnalysisDimension() {
            return maxAnalysisDimension;
        }

        public void setMaxAnalysisDimension(int maxAnalysisDimension) {
            this.maxAnalysisDimension = maxAnalysisDimension;
        }

        public double getEdgeDensityFraction() {
            return edgeDensityFraction;
        }

        public void setEdgeDensityFraction(double edgeDensityFraction) {
            this.edgeDensityFraction = edgeDensityFraction;
        }

        public double getMarginFraction() {
            return marginFraction;
        }

        public void setMarginFraction(double marginFraction) {
            this.marginFraction = marginFraction;
        }

        public double getMinimumScore() {
            return minimumScore;
        }

        public void setMinimumScore(double minimumScore) {
            this.minimumScore = minimumScore;
        }

        public boolean isOpencvEnabled() {
            return opencvEnabled;
        }

        public void setOpencvEnabled(boolean opencvEnabled) {
            this.opencvEnabled = opencvEnabled;
        }
    }

    public static class Matching {

        private double highThreshold = 0.40;
        private double mediumThreshold = 0.25;
        private double lowThreshold = 0.15;
        private int maxCandidates = 5;

        public double getHighThreshold() {
            return highThreshold;
        }

        public void setHighThreshold(double highThreshold) {
            this.highThreshold = highThreshold;
        }

        public double getMediumThreshold() {
            return mediumThreshold;
        }

        public void setMediumThreshold(double mediumThreshold) {
            this.mediumThreshold = mediumThreshold;
        }

        public double getLowThreshold() {
            return lowThreshold;
        }

        public void setLowThreshold(double lowThreshold) {
            this.lowThreshold = lowThreshold;
        }

        public int getMaxCandidates() {
            return maxCandidates;
        }

        public void setMaxCandidates(int maxCandidates) {
            this.maxCandidates = maxCandidates;
        }
    }

    public static class Classification {

        private boolean weightedKeywords = false;
        private double delegationThreshold = 0.3;
        private double checkThreshold = 0.8;

        public boolean isWeightedKeywords() {
            return weightedKeywords;
        }

        public void setWeightedKeywords(boolean weightedKeywords) {
            this.weightedKeywords = weightedKeywords;
        }

        public double getDelegationThreshold() {
            return delegationThreshold;
        }

        public void setDelegationThreshold(double delegationThreshold) {
            this.delegationThreshold = delegationThreshold;
        }

        public double getCheckThreshold() {
            return checkThreshold;
        }

        public void setCheckThreshold(double checkThreshold) {
            this.checkThreshold = checkThreshold;
        }
    }

    public static class Packaging {

        private long budgetBytes = 300L * 1024;
        private float initialQuality = 0.92f;
        private int initialMaxDimension = 2400;
        private float compressionStartQuality = 0.3f;
        private int compressionStartWidth = 1200;
        private float qualityFactor = 0.8f;
        private double dimensionFactor = 0.9;
        private int maxAttempts = 5;
        private boolean enforceHardBudget = false;

        public long getBudgetBytes() {
            return budgetBytes;
        }

        public void setBudgetBytes(long budgetBytes) {
            this.budgetBytes = budgetBytes;
        }

        public float getInitialQuality() {
            return initialQuality;
        }

        public void setInitialQuality(float initialQuality) {
            this.initialQuality = initialQuality;
        }

        public int getInitialMaxDimension() {
            return initialMaxDimension;
        }

        public void setInitialMaxDimension(int initialMaxDimension) {
            this.initialMaxDimension = initialMaxDimension;
        }

        public float getCompressionStartQuality() {
            return compressionStartQuality;
        }

        public void setCompressionStartQuality(float compressionStartQuality) {
            this.compressionStartQuality = compressionStartQuality;
        }

        public int getCompressionStartWidth() {
            return compressionStartWidth;
        }

        public void setCompressionStartWidth(int compressionStartWidth) {
            this.compressionStartWidth = compressionStartWidth;
        }

        public float getQualityFactor() {
            return qualityFactor;
        }

        public void setQualityFactor(float qualityFactor) {
            this.qualityFactor = qualityFactor;
        }

        public double getDimensionFactor() {
            return dimensionFactor;
        }

        public void setDimensionFactor(double dimensionFactor) {
            this.dimensionFactor = dimensionFactor;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public boolean isEnforceHardBudget() {
            return enforceHardBudget;
        }

        public void setEnforceHardBudget(boolean enforceHardBudget) {
            this.enforceHardBudget = enforceHardBudget;
        }
    }

    public static class Storage {

        private String directory = "./data";
        private long quotaBytes = 500L * 1024 * 1024;
        private String patientsSeed = "";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public long getQuotaBytes() {
            return quotaBytes;
        }

        public void setQuotaBytes(long quotaBytes) {
            this.quotaBytes = quotaBytes;
        }

        public String getPatientsSeed() {
            return patientsSeed;
        }

        public void setPatientsSeed(String patientsSeed) {
            this.patientsSeed = patientsSeed;
        }
    }
}
