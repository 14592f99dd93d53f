package com.cvtailor.ai.config;

import com.cvtailor.ai.service.budget.BudgetLedger;
import com.cvtailor.ai.service.cache.ContentCache;
import com.cvtailor.ai.service.monitoring.PerformanceTracker;
import com.cvtailor.ai.service.pipeline.CvPromptBuilder;
import com.cvtailor.ai.service.pipeline.EmbeddingResolver;
import com.cvtailor.ai.service.pipeline.GenerationPipeline;
import com.cvtailor.ai.service.pipeline.JobRequirementsParser;
import com.cvtailor.ai.service.pipeline.ModelInvoker;
import com.cvtailor.ai.service.pipeline.SimilarityRanker;
import com.cvtailor.ai.service.resilience.CircuitBreakerRegistry;
import com.cvtailor.ai.service.selection.LatencyClass;
import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.ai.service.selection.ModelRegistry;
import com.cvtailor.ai.service.selection.ModelSelector;
import com.cvtailor.ai.service.selection.QualityTier;
import com.cvtailor.ai.service.selection.SelectionStrategy;
import com.cvtailor.ai.service.selection.TaskType;
import com.cvtailor.ai.service.strategy.ProviderClients;
import com.cvtailor.ai.service.text.Chunker;
import com.cvtailor.common.repository.GenerationPersistence;
import com.cvtailor.common.repository.InMemoryGenerationPersistence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Wires the orchestration core from {@link OrchestrationProperties}.
 */
@Slf4j
@Configuration
public class OrchestrationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ModelRegistry modelRegistry(OrchestrationProperties properties) {
        List<ModelProfile> profiles = properties.getModels().stream()
                .map(OrchestrationConfig::toProfile)
                .toList();
        if (profiles.isEmpty()) {
            throw new IllegalStateException("No models configured under 'cvtailor.models'");
        }
        return new ModelRegistry(profiles);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(OrchestrationProperties properties, Clock clock) {
        OrchestrationProperties.CircuitBreaker settings = properties.getCircuitBreaker();
        log.info("Circuit breakers: threshold {} within {}s, cooldown {}s", settings.getFailureThreshold(),
                settings.getRollingWindow().toSeconds(), settings.getCooldown().toSeconds());
        return new CircuitBreakerRegistry(settings.getFailureThreshold(), settings.getCooldown(),
                settings.getRollingWindow(), clock);
    }

    @Bean
    public BudgetLedger budgetLedger(OrchestrationProperties properties, Clock clock) {
        OrchestrationProperties.Budget settings = properties.getBudget();
        log.info("Budget limits per day: {} (alert at {}%)", settings.getDailyLimits(),
                Math.round(settings.getAlertThreshold() * 100));
        return new BudgetLedger(settings.getDailyLimits(), settings.getAlertThreshold(), clock);
    }

    @Bean
    public ModelSelector modelSelector(ModelRegistry registry, CircuitBreakerRegistry breakers, BudgetLedger ledger,
            OrchestrationProperties properties) {
        OrchestrationProperties.Selection selection = properties.getSelection();
        return new ModelSelector(registry, breakers, ledger,
                new SelectionStrategy.SelectionWeights(selection.getCostWeight(), selection.getQualityWeight()));
    }

    @Bean
    public Chunker chunker(OrchestrationProperties properties) {
        return new Chunker(properties.getChunking().getMaxWindow(), properties.getChunking().getOverlap());
    }

    @Bean
    public ContentCache contentCache(OrchestrationProperties properties, Clock clock) {
        OrchestrationProperties.Cache settings = properties.getCache();
        OrchestrationProperties.NearDuplicate nearDuplicate = settings.getNearDuplicate();
        if (nearDuplicate.isEnabled()) {
            log.warn("Near-duplicate cache lookup ENABLED (threshold {}, cross-scope {})",
                    nearDuplicate.getThreshold(), nearDuplicate.isCrossScope());
        }
        return new ContentCache(settings.getMaximumSize(), settings.getExpireAfterAccess(),
                new ContentCache.NearDuplicatePolicy(nearDuplicate.isEnabled(), nearDuplicate.getThreshold(),
                        nearDuplicate.getCandidateLimit(), nearDuplicate.isCrossScope()),
                clock);
    }

    @Bean
    public PerformanceTracker performanceTracker(Clock clock) {
        return new PerformanceTracker(clock);
    }

    @Bean(destroyMethod = "shutdownNow")
    public MdcAwareThreadPoolExecutor providerExecutor(OrchestrationProperties properties) {
        return new MdcAwareThreadPoolExecutor("cvtailor-provider", properties.getPipeline().getProviderThreads());
    }

    @Bean(destroyMethod = "shutdownNow")
    public MdcAwareThreadPoolExecutor pipelineWorkers(OrchestrationProperties properties) {
        return new MdcAwareThreadPoolExecutor("cvtailor-pipeline", properties.getPipeline().getWorkerThreads());
    }

    @Bean
    public ModelInvoker modelInvoker(ModelSelector selector, CircuitBreakerRegistry breakers, BudgetLedger ledger,
            ProviderClients clients, PerformanceTracker performance,
            @Qualifier("providerExecutor") MdcAwareThreadPoolExecutor providerExecutor,
            OrchestrationProperties properties) {
        return new ModelInvoker(selector, breakers, ledger, clients, performance, providerExecutor,
                properties.getPipeline().getProviderTimeout());
    }

    @Bean
    public EmbeddingResolver embeddingResolver(ContentCache cache, Chunker chunker, ModelInvoker invoker,
            ModelSelector selector, BudgetLedger ledger) {
        return new EmbeddingResolver(cache, chunker, invoker, selector, ledger);
    }

    @Bean
    public JobRequirementsParser jobRequirementsParser(ModelInvoker invoker, ContentCache cache,
            OrchestrationProperties properties) {
        return new JobRequirementsParser(invoker, cache, properties.getPipeline().getMaxOutputTokens());
    }

    @Bean
    @ConditionalOnMissingBean
    public GenerationPersistence generationPersistence() {
        log.warn("No GenerationPersistence bean found, results are kept in memory only");
        return new InMemoryGenerationPersistence();
    }

    @Bean
    public GenerationPipeline generationPipeline(GenerationPersistence persistence, JobRequirementsParser parser,
            EmbeddingResolver resolver, ModelInvoker invoker, ContentCache cache,
            @Qualifier("pipelineWorkers") MdcAwareThreadPoolExecutor pipelineWorkers,
            OrchestrationProperties properties, Clock clock) {
        OrchestrationProperties.Pipeline settings = properties.getPipeline();
        SelectionStrategy strategy = SelectionStrategy.fromConfig(properties.getSelection().getStrategy());
        log.info("Default selection strategy: {}", strategy);
        return new GenerationPipeline(persistence, parser, new SimilarityRanker(resolver), new CvPromptBuilder(),
                invoker, cache, pipelineWorkers,
                new GenerationPipeline.Settings(strategy, settings.getTopArtifacts(), settings.getMaxOutputTokens(),
                        settings.getResultRetention(), settings.getResultCapacity()),
                clock);
    }

    static ModelProfile toProfile(OrchestrationProperties.Model model) {
        Set<TaskType> tasks = model.getTasks().stream()
                .map(TaskType::fromConfig)
                .collect(Collectors.toSet());
        return new ModelProfile(
                model.getName(),
                model.getProvider(),
                tasks,
                model.getInputCostPer1k(),
                model.getOutputCostPer1k(),
                LatencyClass.valueOf(model.getLatencyClass().trim().toUpperCase(Locale.ROOT)),
                QualityTier.valueOf(model.getQualityTier().trim().toUpperCase(Locale.ROOT)),
                model.getDimensions(),
                model.getMaxInputTokens());
    }
}
