package com.cvtailor.ai.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestration settings under {@code cvtailor.*}. Bound once at startup and
 * read-only afterwards.
 */
@ConfigurationProperties(prefix = "cvtailor")
public class OrchestrationProperties {

    private final Selection selection = new Selection();
    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final Budget budget = new Budget();
    private final Cache cache = new Cache();
    private final Chunking chunking = new Chunking();
    private final Pipeline pipeline = new Pipeline();
    private List<Model> models = new ArrayList<>();

    public Selection getSelection() {
        return selection;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Budget getBudget() {
        return budget;
    }

    public Cache getCache() {
        return cache;
    }

    public Chunking getChunking() {
        return chunking;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public List<Model> getModels() {
        return models;
    }

    public void setModels(List<Model> models) {
        this.models = models;
    }

    public static class Selection {
        /** cost_optimized | quality_first | balanced */
        private String strategy = "balanced";
        private double costWeight = 0.5;
        private double qualityWeight = 0.5;

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public double getCostWeight() {
            return costWeight;
        }

        public void setCostWeight(double costWeight) {
            this.costWeight = costWeight;
        }

        public double getQualityWeight() {
            return qualityWeight;
        }

        public void setQualityWeight(double qualityWeight) {
            this.qualityWeight = qualityWeight;
        }
    }

    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(30);
        /** Failures older than this no longer count towards the threshold. */
        private Duration rollingWindow = Duration.ofSeconds(60);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public Duration getRollingWindow() {
            return rollingWindow;
        }

        public void setRollingWindow(Duration rollingWindow) {
            this.rollingWindow = rollingWindow;
        }
    }

    public static class Budget {
        /** USD per principal per day, keyed by tier. */
        private Map<String, Double> dailyLimits = new LinkedHashMap<>(Map.of("free", 0.50, "paid", 5.00));
        private double alertThreshold = 0.8;

        public Map<String, Double> getDailyLimits() {
            return dailyLimits;
        }

        public void setDailyLimits(Map<String, Double> dailyLimits) {
            this.dailyLimits = dailyLimits;
        }

        public double getAlertThreshold() {
            return alertThreshold;
        }

        public void setAlertThreshold(double alertThreshold) {
            this.alertThreshold = alertThreshold;
        }
    }

    public static class Cache {
        private long maximumSize = 10_000;
        private Duration expireAfterAccess = Duration.ofDays(7);
        private final NearDuplicate nearDuplicate = new NearDuplicate();

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }

        public Duration getExpireAfterAccess() {
            return expireAfterAccess;
        }

        public void setExpireAfterAccess(Duration expireAfterAccess) {
            this.expireAfterAccess = expireAfterAccess;
        }

        public NearDuplicate getNearDuplicate() {
            return nearDuplicate;
        }
    }

    public static class NearDuplicate {
        /** Needs product sign-off before it is turned on. */
        private boolean enabled = false;
        private double threshold = 0.98;
        private int candidateLimit = 256;
        /** Allow matches written by another user. */
        private boolean crossScope = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getCandidateLimit() {
            return candidateLimit;
        }

        public void setCandidateLimit(int candidateLimit) {
            this.candidateLimit = candidateLimit;
        }

        public boolean isCrossScope() {
            return crossScope;
        }

        public void setCrossScope(boolean crossScope) {
            this.crossScope = crossScope;
        }
    }

    public static class Chunking {
        private int maxWindow = 1000;
        private int overlap = 200;

        public int getMaxWindow() {
            return maxWindow;
        }

        public void setMaxWindow(int maxWindow) {
            this.maxWindow = maxWindow;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    public static class Pipeline {
        private Duration providerTimeout = Duration.ofSeconds(30);
        private int topArtifacts = 5;
        private int maxOutputTokens = 2000;
        private int workerThreads = 4;
        private int providerThreads = 16;
        private Duration resultRetention = Duration.ofHours(24);
        private long resultCapacity = 10_000;

        public Duration getProviderTimeout() {
            return providerTimeout;
        }

        public void setProviderTimeout(Duration providerTimeout) {
            this.providerTimeout = providerTimeout;
        }

        public int getTopArtifacts() {
            return topArtifacts;
        }

        public void setTopArtifacts(int topArtifacts) {
            this.topArtifacts = topArtifacts;
        }

        public int getMaxOutputTokens() {
            return maxOutputTokens;
        }

        public void setMaxOutputTokens(int maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getProviderThreads() {
            return providerThreads;
        }

        public void setProviderThreads(int providerThreads) {
            this.providerThreads = providerThreads;
        }

        public Duration getResultRetention() {
            return resultRetention;
        }

        public void setResultRetention(Duration resultRetention) {
            this.resultRetention = resultRetention;
        }

        public long getResultCapacity() {
            return resultCapacity;
        }

        public void setResultCapacity(long resultCapacity) {
            this.resultCapacity = resultCapacity;
        }
    }

    /**
     * One entry of the model registry.
     */
    public static class Model {
        private String name;
        private String provider;
        private List<String> tasks = new ArrayList<>();
        private double inputCostPer1k;
        private double outputCostPer1k;
        private String latencyClass = "medium";
        private String qualityTier = "standard";
        private int dimensions;
        private int maxInputTokens;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public List<String> getTasks() {
            return tasks;
        }

        public void setTasks(List<String> tasks) {
            this.tasks = tasks;
        }

        public double getInputCostPer1k() {
            return inputCostPer1k;
        }

        public void setInputCostPer1k(double inputCostPer1k) {
            this.inputCostPer1k = inputCostPer1k;
        }

        public double getOutputCostPer1k() {
            return outputCostPer1k;
        }

        public void setOutputCostPer1k(double outputCostPer1k) {
            this.outputCostPer1k = outputCostPer1k;
        }

        public String getLatencyClass() {
            return latencyClass;
        }

        public void setLatencyClass(String latencyClass) {
            this.latencyClass = latencyClass;
        }

        public String getQualityTier() {
            return qualityTier;
        }

        public void setQualityTier(String qualityTier) {
            this.qualityTier = qualityTier;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }

        public int getMaxInputTokens() {
            return maxInputTokens;
        }

        public void setMaxInputTokens(int maxInputTokens) {
            this.maxInputTokens = maxInputTokens;
        }
    }
}
