package com.ironcage.gateway.orchestration;

/*
 * ============================================================================
 * REQUEST ORCHESTRATOR - CODE FLOW
 * ============================================================================
 *
 *   AGENT REQUEST (bearer token + capability + messages)
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 1. TokenValidator.validate          │ → UNAUTHENTICATED / REVOKED
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 2. Request shape + capability known │ → INVALID_REQUEST
 *   │ 3. RateLimiter.check                │ → RATE_LIMITED (retry-after)
 *   │ 4. Bound tiers for the agent        │ → NO_PROVIDER_BINDING
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 5. BudgetLedger.reserve(estimate)   │ → BUDGET_EXCEEDED
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 6. For each candidate (selector):   │
 *   │    - TokenTranslator.translate      │ → VAULT_UNAVAILABLE (fail-closed)
 *   │    - breaker permission?  no → skip │
 *   │    - call with retry + backoff      │
 *   │    - exhausted → breaker failure,   │
 *   │      exclude provider, next         │
 *   └─────────────────────────────────────┘
 *         │                         │
 *      success                 none left
 *         │                         │
 *         ▼                         ▼
 *   ┌──────────────────┐   ┌──────────────────────────────┐
 *   │ 7. commit actual │   │ release reservation          │
 *   │    cost          │   │ → ALL_PROVIDERS_UNAVAILABLE  │
 *   └──────────────────┘   └──────────────────────────────┘
 *
 *   Every path that does not commit releases the reservation, including
 *   cancellation. Audit events are queued fire-and-forget.
 *
 * ============================================================================
 */

import com.ironcage.gateway.audit.AuditEvent;
import com.ironcage.gateway.audit.AuditEventType;
import com.ironcage.gateway.audit.AuditPublisher;
import com.ironcage.gateway.budget.BudgetLedger;
import com.ironcage.gateway.budget.Reservation;
import com.ironcage.gateway.directory.AgentDirectory;
import com.ironcage.gateway.directory.AgentRecord;
import com.ironcage.gateway.exception.AllProvidersUnavailableException;
import com.ironcage.gateway.exception.GatewayException;
import com.ironcage.gateway.exception.InvalidRequestException;
import com.ironcage.gateway.exception.NoProviderBindingException;
import com.ironcage.gateway.exception.RateLimitedException;
import com.ironcage.gateway.exception.RevokedTokenException;
import com.ironcage.gateway.exception.VaultUnavailableException;
import com.ironcage.gateway.pricing.CostEstimator;
import com.ironcage.gateway.pricing.Money;
import com.ironcage.gateway.provider.ChatMessage;
import com.ironcage.gateway.provider.ProviderAdapter;
import com.ironcage.gateway.provider.ProviderAdapterRegistry;
import com.ironcage.gateway.provider.ProviderCall;
import com.ironcage.gateway.provider.ProviderCallException;
import com.ironcage.gateway.provider.ProviderResponse;
import com.ironcage.gateway.resilience.CircuitBreakerRegistry;
import com.ironcage.gateway.resilience.RateLimitKeyStrategy;
import com.ironcage.gateway.resilience.RateLimiter;
import com.ironcage.gateway.resilience.RetryPolicy;
import com.ironcage.gateway.routing.FallbackChainSelector;
import com.ironcage.gateway.routing.FallbackTier;
import com.ironcage.gateway.security.AgentIdentity;
import com.ironcage.gateway.security.TokenTranslator;
import com.ironcage.gateway.security.TokenValidator;
import com.ironcage.gateway.vault.ProviderCredential;
import com.ironcage.gateway.vault.UnavailablePolicy;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Drives one agent request through admission, routing and reconciliation.
 */
@Slf4j
public class RequestOrchestrator {

    private final TokenValidator tokenValidator;
    private final RateLimiter rateLimiter;
    private final RateLimitKeyStrategy rateLimitKeyStrategy;
    private final AgentDirectory agentDirectory;
    private final CostEstimator costEstimator;
    private final BudgetLedger budgetLedger;
    private final FallbackChainSelector fallbackChainSelector;
    private final CircuitBreakerRegistry circuitBreakers;
    private final TokenTranslator tokenTranslator;
    private final ProviderAdapterRegistry providerAdapters;
    private final RetryPolicy retryPolicy;
    private final Duration attemptTimeout;
    private final UnavailablePolicy vaultUnavailablePolicy;
    private final AuditPublisher auditPublisher;
    private final Scheduler workers;
    private final Clock clock;

    @Builder
    public RequestOrchestrator(TokenValidator tokenValidator,
                               RateLimiter rateLimiter,
                               RateLimitKeyStrategy rateLimitKeyStrategy,
                               AgentDirectory agentDirectory,
                               CostEstimator costEstimator,
                               BudgetLedger budgetLedger,
                               FallbackChainSelector fallbackChainSelector,
                               CircuitBreakerRegistry circuitBreakers,
                               TokenTranslator tokenTranslator,
                               ProviderAdapterRegistry providerAdapters,
                               RetryPolicy retryPolicy,
                               Duration attemptTimeout,
                               UnavailablePolicy vaultUnavailablePolicy,
                               AuditPublisher auditPublisher,
                               Scheduler workers,
                               Clock clock) {
        this.tokenValidator = tokenValidator;
        this.rateLimiter = rateLimiter;
        this.rateLimitKeyStrategy = rateLimitKeyStrategy != null ? rateLimitKeyStrategy : RateLimitKeyStrategy.AGENT;
        this.agentDirectory = agentDirectory;
        this.costEstimator = costEstimator;
        this.budgetLedger = budgetLedger;
        this.fallbackChainSelector = fallbackChainSelector;
        this.circuitBreakers = circuitBreakers;
        this.tokenTranslator = tokenTranslator;
        this.providerAdapters = providerAdapters;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.noRetry();
        this.attemptTimeout = attemptTimeout != null ? attemptTimeout : Duration.ofSeconds(30);
        this.vaultUnavailablePolicy = vaultUnavailablePolicy != null ? vaultUnavailablePolicy : UnavailablePolicy.FAIL_CLOSED;
        this.auditPublisher = auditPublisher;
        this.workers = workers;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public Mono<InferenceResult> execute(String token, InferenceRequest request) {
        return execute(token, request, null);
    }

    /**
     * @param requestId id used in logs, audit events and the result; generated when null
     */
    public Mono<InferenceResult> execute(String token, InferenceRequest request, String requestId) {
        String id = requestId != null ? requestId : UUID.randomUUID().toString();
        Mono<InferenceResult> flow = tokenValidator.validate(token)
                .flatMap(identity -> checkRequest(request)
                        .then(Mono.defer(() -> checkRateLimit(identity, request)))
                        .then(Mono.defer(() -> agentDirectory.findAgent(identity.agentId())))
                        .switchIfEmpty(Mono.error(new RevokedTokenException("Agent is no longer provisioned")))
                        .flatMap(agent -> admitAndRoute(new RequestContext(id, identity, agent, request)))
                        .doOnError(e -> auditFailure(id, identity.agentId(), request, e)));
        return workers != null ? flow.subscribeOn(workers) : flow;
    }

    // ==================== ADMISSION ====================

    private Mono<Void> checkRequest(InferenceRequest request) {
        if (request == null || request.capability() == null || request.capability().isBlank()) {
            return Mono.error(new InvalidRequestException("capability is required"));
        }
        if (request.messages() == null || request.messages().isEmpty()) {
            return Mono.error(new InvalidRequestException("messages must not be empty"));
        }
        for (ChatMessage message : request.messages()) {
            if (message == null || message.role() == null || message.content() == null) {
                return Mono.error(new InvalidRequestException("every message needs a role and content"));
            }
        }
        if (request.maxOutputTokens() != null && request.maxOutputTokens() < 1) {
            return Mono.error(new InvalidRequestException("maxOutputTokens must be positive"));
        }
        if (!fallbackChainSelector.supports(request.capability())) {
            return Mono.error(new InvalidRequestException("Unknown capability '" + request.capability() + "'"));
        }
        return Mono.empty();
    }

    private Mono<Void> checkRateLimit(AgentIdentity identity, InferenceRequest request) {
        String key = rateLimitKeyStrategy.keyFor(identity.agentId(), request.capability());
        return rateLimiter.check(key)
                .flatMap(decision -> {
                    if (decision.allowed()) {
                        return Mono.<Void>empty();
                    }
                    log.info("Rate limit hit for {} - retry after {}ms", key, decision.retryAfter().toMillis());
                    return Mono.error(new RateLimitedException(key, decision.retryAfter()));
                });
    }

    private Mono<InferenceResult> admitAndRoute(RequestContext ctx) {
        List<FallbackTier> boundTiers = fallbackChainSelector.configuredTiers(ctx.capability()).stream()
                .filter(tier -> ctx.agent().isBoundTo(tier.providerId()))
                .toList();
        if (boundTiers.isEmpty()) {
            return Mono.error(new NoProviderBindingException(
                    "Agent " + ctx.agentId() + " is not bound to any provider serving '" + ctx.capability() + "'"));
        }

        long estimate = costEstimator.estimateMicros(boundTiers, ctx.request().messages(), ctx.request().maxOutputTokens());
        return budgetLedger.reserve(ctx.agentId(), estimate)
                .flatMap(reservation -> nextCandidate(ctx, new ArrayList<>())
                        .flatMap(outcome -> settle(ctx, reservation, outcome))
                        .onErrorResume(e -> releaseAfterFailure(reservation, e))
                        .doOnCancel(() -> {
                            log.info("Request {} cancelled, releasing reservation {}", ctx.requestId(), reservation.id());
                            budgetLedger.release(reservation.id()).subscribe();
                        }));
    }

    // ==================== ROUTING ====================

    private Mono<Outcome> nextCandidate(RequestContext ctx, List<String> attempted) {
        List<FallbackTier> candidates = fallbackChainSelector.select(ctx.capability(), attempted).stream()
                .filter(tier -> ctx.agent().isBoundTo(tier.providerId()))
                .toList();
        if (candidates.isEmpty()) {
            log.warn("Request {} exhausted all providers for '{}' (attempted {})",
                    ctx.requestId(), ctx.capability(), attempted);
            return Mono.error(new AllProvidersUnavailableException(ctx.capability(), attempted));
        }

        FallbackTier tier = candidates.get(0);
        attempted.add(tier.providerId());

        ProviderAdapter adapter = providerAdapters.adapterFor(tier.providerId()).orElse(null);
        if (adapter == null) {
            log.error("No adapter configured for provider {}, skipping", tier.providerId());
            return nextCandidate(ctx, attempted);
        }

        CircuitBreaker breaker = circuitBreakers.breaker(tier.providerId());
        return tokenTranslator.translate(ctx.identity(), tier.providerId())
                .flatMap(credential -> {
                    ProviderCall call = new ProviderCall(tier.providerId(), tier.model(), ctx.request().messages(),
                            costEstimator.outputCap(tier.model(), ctx.request().maxOutputTokens()),
                            ctx.request().temperature(), ctx.request().stop());
                    return attempt(ctx, adapter, call, credential)
                            .transformDeferred(CircuitBreakerOperator.of(breaker));
                })
                .map(response -> new Outcome(tier, response))
                .onErrorResume(e -> handleCandidateFailure(ctx, tier, e, attempted));
    }

    /**
     * One provider call with bounded retry. The breaker wraps the whole sequence, so an
     * exhausted provider counts as a single failure.
     */
    private Mono<ProviderResponse> attempt(RequestContext ctx,
                                           ProviderAdapter adapter,
                                           ProviderCall call,
                                           ProviderCredential credential) {
        Mono<ProviderResponse> single = Mono.defer(() -> adapter.call(call, credential))
                .timeout(attemptTimeout);
        if (!retryPolicy.retries()) {
            return single;
        }
        return single.retryWhen(retryPolicy.toRetrySpec(RequestOrchestrator::isRetryable)
                .doBeforeRetry(signal -> log.warn("Request {} attempt {} on {} failed ({}), retrying",
                        ctx.requestId(), signal.totalRetries() + 1, call.providerId(), describe(signal.failure()))));
    }

    private Mono<Outcome> handleCandidateFailure(RequestContext ctx,
                                                 FallbackTier tier,
                                                 Throwable error,
                                                 List<String> attempted) {
        if (error instanceof CallNotPermittedException) {
            log.debug("Request {} skipping {}: breaker {} refused permission",
                    ctx.requestId(), tier.providerId(), circuitBreakers.stateOf(tier.providerId()));
            return nextCandidate(ctx, attempted);
        }
        if (error instanceof VaultUnavailableException) {
            if (vaultUnavailablePolicy == UnavailablePolicy.FAIL_CLOSED) {
                return Mono.error(error);
            }
            log.warn("Request {} skipping {}: credential unavailable", ctx.requestId(), tier.providerId());
            return nextCandidate(ctx, attempted);
        }
        if (error instanceof GatewayException) {
            return Mono.error(error);
        }

        if (ProviderCallException.countsAgainstProvider(error)) {
            log.warn("Request {} gave up on {} ({}), breaker now {}",
                    ctx.requestId(), tier.providerId(), describe(error), circuitBreakers.stateOf(tier.providerId()));
        } else {
            log.warn("Request {} rejected by {} with status {}, not counted against the provider",
                    ctx.requestId(), tier.providerId(), ((ProviderCallException) error).getStatusCode());
        }
        audit(AuditEvent.builder(AuditEventType.PROVIDER_ATTEMPT_FAILED, clock.instant())
                .requestId(ctx.requestId())
                .agentId(ctx.agentId())
                .attribute("provider", tier.providerId())
                .attribute("model", tier.model())
                .attribute("error", describe(error))
                .build());
        return nextCandidate(ctx, attempted);
    }

    // ==================== RECONCILIATION ====================

    private Mono<InferenceResult> settle(RequestContext ctx, Reservation reservation, Outcome outcome) {
        ProviderResponse response = outcome.response();
        String model = response.model() != null ? response.model() : outcome.tier().model();
        long actualMicros = costEstimator.actualMicros(outcome.tier().model(),
                response.inputTokens(), response.outputTokens());

        return budgetLedger.commit(reservation.id(), actualMicros)
                .map(commit -> commit.budget().remainingMicros())
                .map(remainingMicros -> {
                    audit(AuditEvent.builder(AuditEventType.REQUEST_COMPLETED, clock.instant())
                            .requestId(ctx.requestId())
                            .agentId(ctx.agentId())
                            .attribute("capability", ctx.capability())
                            .attribute("provider", outcome.tier().providerId())
                            .attribute("model", model)
                            .attribute("inputTokens", response.inputTokens())
                            .attribute("outputTokens", response.outputTokens())
                            .attribute("reservedUsd", Money.toUsd(reservation.amountMicros()))
                            .attribute("costUsd", Money.toUsd(actualMicros))
                            .build());
                    log.info("Request {} served by {} ({}) for agent {}: cost {} USD",
                            ctx.requestId(), outcome.tier().providerId(), model, ctx.agentId(), Money.toUsd(actualMicros));
                    return new InferenceResult(ctx.requestId(), outcome.tier().providerId(), model,
                            response.content(), response.inputTokens(), response.outputTokens(),
                            Money.toUsd(actualMicros), Money.toUsd(remainingMicros));
                });
    }

    private <T> Mono<T> releaseAfterFailure(Reservation reservation, Throwable error) {
        return budgetLedger.release(reservation.id())
                .onErrorResume(releaseError -> {
                    log.error("Failed to release reservation {}: {}", reservation.id(), releaseError.getMessage());
                    return Mono.just(false);
                })
                .then(Mono.error(error));
    }

    // ==================== HELPER METHODS ====================

    private static boolean isRetryable(Throwable error) {
        if (error instanceof ProviderCallException pce) {
            return pce.isDependencyFault();
        }
        return error instanceof TimeoutException;
    }

    private static String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "timeout";
        }
        if (error instanceof ProviderCallException pce) {
            return pce.getStatusCode() == ProviderCallException.NO_STATUS
                    ? "unreachable"
                    : "status " + pce.getStatusCode();
        }
        return error.getClass().getSimpleName();
    }

    private void auditFailure(String requestId, String agentId, InferenceRequest request, Throwable error) {
        boolean rejected = error instanceof GatewayException
                && !(error instanceof AllProvidersUnavailableException);
        audit(AuditEvent.builder(rejected ? AuditEventType.REQUEST_REJECTED : AuditEventType.REQUEST_FAILED,
                        clock.instant())
                .requestId(requestId)
                .agentId(agentId)
                .attribute("capability", request != null ? request.capability() : null)
                .attribute("code", error instanceof GatewayException ge ? ge.getErrorCode().name() : "INTERNAL_ERROR")
                .build());
    }

    private void audit(AuditEvent event) {
        if (auditPublisher != null) {
            auditPublisher.publish(event);
        }
    }

    private record RequestContext(String requestId, AgentIdentity identity, AgentRecord agent, InferenceRequest request) {

        String agentId() {
            return identity.agentId();
        }

        String capability() {
            return request.capability();
        }
    }

    private record Outcome(FallbackTier tier, ProviderResponse response) {
    }
}
