package com.phillippitts.hazardscan.config.orchestration;

import com.phillippitts.hazardscan.config.properties.BackendsProperties;
import com.phillippitts.hazardscan.config.properties.BudgetProperties;
import com.phillippitts.hazardscan.config.properties.CacheProperties;
import com.phillippitts.hazardscan.config.properties.DeviceProperties;
import com.phillippitts.hazardscan.config.properties.FallbackProperties;
import com.phillippitts.hazardscan.config.properties.ValidationProperties;
import com.phillippitts.hazardscan.domain.AccuracyClass;
import com.phillippitts.hazardscan.domain.BackendDescriptor;
import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.service.backend.BackendRegistry;
import com.phillippitts.hazardscan.service.backend.CloudBackend;
import com.phillippitts.hazardscan.service.backend.CloudVisionClient;
import com.phillippitts.hazardscan.service.backend.ConcurrencyGuard;
import com.phillippitts.hazardscan.service.backend.CredentialProvider;
import com.phillippitts.hazardscan.service.backend.EmergencyBackend;
import com.phillippitts.hazardscan.service.backend.EnvironmentCredentialProvider;
import com.phillippitts.hazardscan.service.backend.HttpCloudVisionClient;
import com.phillippitts.hazardscan.service.backend.InferenceBackend;
import com.phillippitts.hazardscan.service.backend.LocalBackend;
import com.phillippitts.hazardscan.service.backend.LocalModelRunner;
import com.phillippitts.hazardscan.service.backend.ModelArtifact;
import com.phillippitts.hazardscan.service.backend.UnavailableLocalModelRunner;
import com.phillippitts.hazardscan.service.budget.BudgetManager;
import com.phillippitts.hazardscan.service.budget.BudgetStore;
import com.phillippitts.hazardscan.service.budget.InMemoryBudgetStore;
import com.phillippitts.hazardscan.service.cache.AnalysisRequestFactory;
import com.phillippitts.hazardscan.service.cache.ImageFingerprinter;
import com.phillippitts.hazardscan.service.cache.ResultCache;
import com.phillippitts.hazardscan.service.device.ConfiguredDeviceSignalSource;
import com.phillippitts.hazardscan.service.device.DeviceCapabilityProfiler;
import com.phillippitts.hazardscan.service.device.DeviceSignalSource;
import com.phillippitts.hazardscan.service.device.RuntimeDeviceCapabilityProfiler;
import com.phillippitts.hazardscan.service.fallback.FallbackCoordinator;
import com.phillippitts.hazardscan.service.orchestration.DefaultHazardAnalysisOrchestrator;
import com.phillippitts.hazardscan.service.orchestration.HazardAnalysisOrchestrator;
import com.phillippitts.hazardscan.service.strategy.StrategySelector;
import com.phillippitts.hazardscan.service.validation.ImageFormatInspector;
import com.phillippitts.hazardscan.service.validation.ModelIntegrityVerifier;
import com.phillippitts.hazardscan.service.validation.PromptSanitizer;
import com.phillippitts.hazardscan.service.validation.SecurityValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the hazard analysis pipeline: validation, backends, cache, budget, strategy and fallback.
 *
 * <p>Seams that touch the platform (clock, device signals, cloud transport, credentials, on-device
 * runtime, budget persistence) are {@link ConditionalOnMissingBean} so an embedding application
 * can supply its own.
 */
@Configuration
public class OrchestrationConfig {

    private static final Logger LOG = LogManager.getLogger(OrchestrationConfig.class);

    private final ApplicationEventPublisher publisher;

    public OrchestrationConfig(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ImageFormatInspector imageFormatInspector() {
        return new ImageFormatInspector();
    }

    @Bean
    public PromptSanitizer promptSanitizer(ValidationProperties props) {
        return new PromptSanitizer(props.getMaxNotesLength());
    }

    @Bean
    public ModelIntegrityVerifier modelIntegrityVerifier() {
        return new ModelIntegrityVerifier();
    }

    /** Fingerprinter for cache keys. Images are hashed as captured, with no resize step. */
    @Bean
    public ImageFingerprinter imageFingerprinter() {
        return new ImageFingerprinter("none");
    }

    @Bean
    public AnalysisRequestFactory analysisRequestFactory(ImageFingerprinter fingerprinter) {
        return new AnalysisRequestFactory(fingerprinter);
    }

    @Bean
    @ConditionalOnMissingBean
    public LocalModelRunner localModelRunner() {
        return new UnavailableLocalModelRunner();
    }

    @Bean
    @ConditionalOnMissingBean
    public CloudVisionClient cloudVisionClient(BackendsProperties props,
                                               ObjectProvider<RestClient.Builder> restClientBuilder) {
        BackendsProperties.Cloud cloud = props.getCloud();
        return new HttpCloudVisionClient(restClientBuilder.getIfAvailable(RestClient::builder),
                cloud.getEndpoint(), cloud.getMaxLatency());
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialProvider credentialProvider(Environment environment) {
        return new EnvironmentCredentialProvider(environment);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeviceSignalSource deviceSignalSource(DeviceProperties props) {
        return new ConfiguredDeviceSignalSource(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeviceCapabilityProfiler deviceCapabilityProfiler(DeviceSignalSource signals,
                                                             DeviceProperties props) {
        return new RuntimeDeviceCapabilityProfiler(signals, props.getReservedMemoryMb());
    }

    @Bean
    @ConditionalOnMissingBean
    public BudgetStore budgetStore() {
        return new InMemoryBudgetStore();
    }

    /**
     * Registry of every enabled backend. The emergency tier is always registered.
     * Backends are initialized here; a tier that fails to initialize is disabled, not fatal.
     */
    @Bean(destroyMethod = "closeAll")
    public BackendRegistry backendRegistry(BackendsProperties props,
                                           CloudVisionClient cloudClient,
                                           CredentialProvider credentials,
                                           LocalModelRunner localRunner) {
        List<InferenceBackend> backends = new ArrayList<>();

        BackendsProperties.Cloud cloud = props.getCloud();
        if (cloud.isEnabled()) {
            BackendDescriptor descriptor = new BackendDescriptor(BackendTier.CLOUD, cloud.getAccuracyClass(),
                    cloud.getCostPerCall(), cloud.getMaxLatency(), 0, true, false);
            ConcurrencyGuard guard = new ConcurrencyGuard(cloud.getMaxConcurrentRequests(),
                    cloud.getPermitTimeout(), "cloud");
            backends.add(new CloudBackend(descriptor, cloudClient, credentials, guard, cloud.getPromptTemplate()));
        }

        BackendsProperties.Accelerator accel = props.getAccelerator();
        ConcurrencyGuard acceleratorGuard = new ConcurrencyGuard(accel.getPermits(),
                accel.getPermitTimeout(), "accelerator");
        addLocal(backends, BackendTier.LOCAL_LARGE, props.getLocalLarge(), localRunner, acceleratorGuard);
        addLocal(backends, BackendTier.LOCAL_SMALL, props.getLocalSmall(), localRunner, acceleratorGuard);

        BackendsProperties.Emergency emergency = props.getEmergency();
        BackendDescriptor emergencyDescriptor = new BackendDescriptor(BackendTier.EMERGENCY,
                AccuracyClass.BASIC, BigDecimal.ZERO,
                emergency.getMaxLatency(), 0, false, false);
        backends.add(new EmergencyBackend(emergencyDescriptor, emergency.getConfidenceScale()));

        BackendRegistry registry = new BackendRegistry(backends);
        registry.initializeAll();
        LOG.info("Registered {} backend(s): {}", backends.size(),
                backends.stream().map(b -> b.tier().label()).toList());
        return registry;
    }

    private static void addLocal(List<InferenceBackend> backends, BackendTier tier, BackendsProperties.Local local,
                                 LocalModelRunner runner, ConcurrencyGuard acceleratorGuard) {
        if (!local.isEnabled()) {
            return;
        }
        BackendDescriptor descriptor = new BackendDescriptor(tier, local.getAccuracyClass(), BigDecimal.ZERO,
                local.getMaxLatency(), local.getMinMemoryMb(), false, local.isNeedsAccelerator());
        ModelArtifact artifact = local.getModelPath() == null || local.getModelPath().isBlank()
                ? null
                : new ModelArtifact(Path.of(local.getModelPath()), local.getExpectedSha256());
        backends.add(new LocalBackend(descriptor, runner, acceleratorGuard, artifact));
    }

    @Bean
    public SecurityValidator securityValidator(ValidationProperties props,
                                               ImageFormatInspector inspector,
                                               PromptSanitizer sanitizer,
                                               ModelIntegrityVerifier verifier,
                                               BackendRegistry registry) {
        return new SecurityValidator(props, inspector, sanitizer, verifier, registry, publisher);
    }

    /** Result cache. Computations run on the orchestration pool. */
    @Bean
    public ResultCache resultCache(CacheProperties props,
                                   Clock clock,
                                   @Qualifier("orchestrationExecutor") ThreadPoolTaskExecutor executor) {
        return new ResultCache(props.getCapacity(), props.getTtl(), clock, executor, publisher);
    }

    @Bean
    public BudgetManager budgetManager(BudgetProperties props, Clock clock, BudgetStore store) {
        return new BudgetManager(props.getDailyCap(), props.getMonthlyCap(), props.getZone(),
                clock, store, publisher);
    }

    @Bean
    public StrategySelector strategySelector(BackendRegistry registry, FallbackProperties props) {
        return new StrategySelector(registry, props);
    }

    /** Fallback coordinator. Each attempt runs on the inference pool under its tier timeout. */
    @Bean
    public FallbackCoordinator fallbackCoordinator(
            @Qualifier("inferenceExecutor") ThreadPoolTaskExecutor executor,
            BudgetManager budget,
            FallbackProperties props) {
        return new FallbackCoordinator(executor.getThreadPoolExecutor(), budget, props, publisher);
    }

    /** Main orchestrator. */
    @Bean
    public HazardAnalysisOrchestrator hazardAnalysisOrchestrator(SecurityValidator validator,
                                                                 ResultCache cache,
                                                                 DeviceCapabilityProfiler profiler,
                                                                 BudgetManager budget,
                                                                 StrategySelector selector,
                                                                 FallbackCoordinator coordinator) {
        return new DefaultHazardAnalysisOrchestrator(validator, cache, profiler, budget, selector, coordinator);
    }
}
