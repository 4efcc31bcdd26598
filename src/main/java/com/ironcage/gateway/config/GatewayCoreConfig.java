package com.ironcage.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ironcage.gateway.audit.AuditPublisher;
import com.ironcage.gateway.audit.AuditSink;
import com.ironcage.gateway.audit.AuditingBudgetEventListener;
import com.ironcage.gateway.audit.LoggingAuditSink;
import com.ironcage.gateway.budget.BudgetLedger;
import com.ironcage.gateway.budget.BudgetStore;
import com.ironcage.gateway.budget.InMemoryBudgetStore;
import com.ironcage.gateway.budget.RedisBudgetStore;
import com.ironcage.gateway.directory.AgentDirectory;
import com.ironcage.gateway.directory.InMemoryAgentDirectory;
import com.ironcage.gateway.orchestration.RequestOrchestrator;
import com.ironcage.gateway.pricing.CostEstimator;
import com.ironcage.gateway.pricing.PricingCatalog;
import com.ironcage.gateway.provider.ProviderAdapterRegistry;
import com.ironcage.gateway.resilience.CircuitBreakerRegistry;
import com.ironcage.gateway.resilience.RateLimiter;
import com.ironcage.gateway.resilience.RedisSlidingWindowRateLimiter;
import com.ironcage.gateway.resilience.SlidingWindowRateLimiter;
import com.ironcage.gateway.routing.FallbackChainSelector;
import com.ironcage.gateway.security.InMemoryRevocationStore;
import com.ironcage.gateway.security.RedisRevocationStore;
import com.ironcage.gateway.security.RevocationStore;
import com.ironcage.gateway.security.TokenIssuer;
import com.ironcage.gateway.security.TokenTranslator;
import com.ironcage.gateway.security.TokenValidator;
import com.ironcage.gateway.vault.AesGcmCredentialVault;
import com.ironcage.gateway.vault.CredentialVault;
import com.ironcage.gateway.vault.EncryptedSecret;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Wires the gateway components. Each component is a plain class taking its
 * collaborators in the constructor; this is the only place that knows the concrete
 * implementations.
 */
@Slf4j
@Configuration
public class GatewayCoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ==================== IDENTITY ====================

    @Bean
    public AgentDirectory agentDirectory(AgentsConfig agentsConfig) {
        return InMemoryAgentDirectory.fromConfig(agentsConfig);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway.auth", name = "revocation-store", havingValue = "redis")
    public RevocationStore redisRevocationStore(ReactiveRedisTemplate<String, String> redisTemplate) {
        return new RedisRevocationStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway.auth", name = "revocation-store", havingValue = "memory", matchIfMissing = true)
    public RevocationStore inMemoryRevocationStore() {
        return new InMemoryRevocationStore();
    }

    @Bean
    public TokenValidator tokenValidator(AuthConfig authConfig, RevocationStore revocationStore, AgentDirectory agentDirectory) {
        return new TokenValidator(authConfig.getJwtSecret(), revocationStore, agentDirectory,
                authConfig.isRevocationFailOpen());
    }

    @Bean
    public TokenIssuer tokenIssuer(AuthConfig authConfig, AgentDirectory agentDirectory,
                                   RevocationStore revocationStore, Clock clock) {
        return new TokenIssuer(authConfig.getJwtSecret(), agentDirectory, revocationStore,
                authConfig.getTokenTtl(), clock);
    }

    // ==================== CREDENTIALS ====================

    @Bean
    public CredentialVault credentialVault(VaultConfig vaultConfig, Scheduler gatewayWorkers) {
        AesGcmCredentialVault vault;
        if (vaultConfig.getMasterKey() == null || vaultConfig.getMasterKey().isBlank()) {
            log.warn("No vault master key configured, using an ephemeral key. Encrypted credentials cannot be loaded.");
            byte[] key = new byte[AesGcmCredentialVault.KEY_SIZE];
            new SecureRandom().nextBytes(key);
            vault = new AesGcmCredentialVault(key, gatewayWorkers);
        } else {
            vault = AesGcmCredentialVault.fromBase64Key(vaultConfig.getMasterKey(), gatewayWorkers);
        }

        vaultConfig.getCredentials().forEach((providerId, credential) -> {
            if (credential.getCiphertext() != null && credential.getNonce() != null) {
                vault.register(providerId, EncryptedSecret.fromBase64(credential.getCiphertext(), credential.getNonce()));
            } else if (credential.getApiKey() != null && !credential.getApiKey().isBlank()) {
                vault.register(providerId, vault.encrypt(credential.getApiKey()));
            } else {
                log.warn("Credential for provider {} has neither ciphertext nor api-key, skipped", providerId);
            }
        });
        return vault;
    }

    @Bean
    public TokenTranslator tokenTranslator(AgentDirectory agentDirectory, CredentialVault credentialVault) {
        return new TokenTranslator(agentDirectory, credentialVault);
    }

    // ==================== BUDGET ====================

    @Bean
    @ConditionalOnProperty(prefix = "gateway.budget", name = "store", havingValue = "redis")
    public BudgetStore redisBudgetStore(ReactiveRedisTemplate<String, String> redisTemplate, AgentDirectory agentDirectory) {
        return new RedisBudgetStore(redisTemplate, agentDirectory);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway.budget", name = "store", havingValue = "memory", matchIfMissing = true)
    public BudgetStore inMemoryBudgetStore(AgentDirectory agentDirectory) {
        return new InMemoryBudgetStore(agentDirectory);
    }

    @Bean
    public BudgetLedger budgetLedger(BudgetConfig budgetConfig, BudgetStore budgetStore,
                                     AuditPublisher auditPublisher, Clock clock) {
        return new BudgetLedger(budgetStore, new AuditingBudgetEventListener(auditPublisher, clock), clock,
                budgetConfig.getReservationTtl(), budgetConfig.getSoftThresholdPercent());
    }

    @Bean
    public CostEstimator costEstimator(PricingConfig pricingConfig) {
        PricingCatalog catalog = PricingCatalog.fromConfig(pricingConfig);
        log.info("Pricing catalog loaded with {} models", catalog.size());
        return new CostEstimator(catalog);
    }

    // ==================== RESILIENCE ====================

    @Bean
    @ConditionalOnProperty(prefix = "gateway.rate-limit", name = "store", havingValue = "redis")
    public RateLimiter redisRateLimiter(RateLimitConfig rateLimitConfig,
                                        ReactiveRedisTemplate<String, String> redisTemplate, Clock clock) {
        return new RedisSlidingWindowRateLimiter(redisTemplate, rateLimitConfig.getRequestsPerWindow(),
                rateLimitConfig.getWindow(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway.rate-limit", name = "store", havingValue = "memory", matchIfMissing = true)
    public RateLimiter inMemoryRateLimiter(RateLimitConfig rateLimitConfig, Clock clock) {
        return new SlidingWindowRateLimiter(rateLimitConfig.getRequestsPerWindow(), rateLimitConfig.getWindow(), clock);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ResilienceConfig resilienceConfig, Clock clock) {
        return new CircuitBreakerRegistry(resilienceConfig.breakerSettings(), clock);
    }

    @Bean
    public FallbackChainSelector fallbackChainSelector(RoutingConfig routingConfig, CircuitBreakerRegistry circuitBreakerRegistry) {
        return new FallbackChainSelector(routingConfig.fallbackTiers(), circuitBreakerRegistry, routingConfig.getPreference());
    }

    @Bean
    public ProviderAdapterRegistry providerAdapterRegistry(RoutingConfig routingConfig,
                                                           WebClient.Builder webClientBuilder,
                                                           ObjectMapper objectMapper) {
        return ProviderAdapterRegistry.fromConfig(routingConfig, webClientBuilder, objectMapper);
    }

    // ==================== AUDIT ====================

    @Bean
    public AuditSink auditSink(ObjectMapper objectMapper) {
        return new LoggingAuditSink(objectMapper);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public AuditPublisher auditPublisher(AuditConfig auditConfig, AuditSink auditSink, MeterRegistry meterRegistry) {
        return new AuditPublisher(auditSink, auditConfig.getQueueCapacity(), auditConfig.getBatchSize(),
                auditConfig.getDrainInterval(), meterRegistry);
    }

    // ==================== ORCHESTRATION ====================

    @Bean
    public RequestOrchestrator requestOrchestrator(TokenValidator tokenValidator,
                                                   RateLimiter rateLimiter,
                                                   RateLimitConfig rateLimitConfig,
                                                   AgentDirectory agentDirectory,
                                                   CostEstimator costEstimator,
                                                   BudgetLedger budgetLedger,
                                                   FallbackChainSelector fallbackChainSelector,
                                                   CircuitBreakerRegistry circuitBreakerRegistry,
                                                   TokenTranslator tokenTranslator,
                                                   ProviderAdapterRegistry providerAdapterRegistry,
                                                   ResilienceConfig resilienceConfig,
                                                   VaultConfig vaultConfig,
                                                   AuditPublisher auditPublisher,
                                                   Scheduler gatewayWorkers,
                                                   Clock clock) {
        return RequestOrchestrator.builder()
                .tokenValidator(tokenValidator)
                .rateLimiter(rateLimiter)
                .rateLimitKeyStrategy(rateLimitConfig.getKeyStrategy())
                .agentDirectory(agentDirectory)
                .costEstimator(costEstimator)
                .budgetLedger(budgetLedger)
                .fallbackChainSelector(fallbackChainSelector)
                .circuitBreakers(circuitBreakerRegistry)
                .tokenTranslator(tokenTranslator)
                .providerAdapters(providerAdapterRegistry)
                .retryPolicy(resilienceConfig.retryPolicy())
                .attemptTimeout(resilienceConfig.getAttemptTimeout())
                .vaultUnavailablePolicy(vaultConfig.getUnavailablePolicy())
                .auditPublisher(auditPublisher)
                .workers(gatewayWorkers)
                .clock(clock)
                .build();
    }
}
