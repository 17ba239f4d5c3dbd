package com.planforge.llm.router;

import com.planforge.common.concurrent.CancellationReason;
import com.planforge.common.concurrent.CancellationToken;
import com.planforge.common.concurrent.GenerationCancelledException;
import com.planforge.llm.failure.FailureClassifier;
import com.planforge.llm.model.GenerationInput;
import com.planforge.llm.model.GenerationOptions;
import com.planforge.llm.model.ProviderResult;
import com.planforge.llm.provider.LlmProvider;
import com.planforge.llm.provider.ProviderClient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Ordered fallback across generation backends.
 *
 * <p>Each backend gets {@code retriesPerProvider} extra tries for retryable failures (throttling, 5xx), with
 * exponential backoff and jitter between them. Any other failure moves straight to the next backend. When the
 * chain is exhausted the last error is rethrown unchanged so it can be classified.</p>
 */
@Service
@Slf4j
public class ProviderRouter {

    private static final long BACKOFF_POLL_MS = 25;

    private final List<ProviderClient> chain;
    private final Map<LlmProvider, ProviderState> providerStates = new ConcurrentHashMap<>();
    private final int retriesPerProvider;
    private final long minBackoffMs;
    private final long maxBackoffMs;

    @Autowired
    public ProviderRouter(
            List<ProviderClient> clients,
            @Value("${llm.router.retries-per-provider:1}") int retriesPerProvider,
            @Value("${llm.router.min-backoff-ms:300}") long minBackoffMs,
            @Value("${llm.router.max-backoff-ms:700}") long maxBackoffMs,
            @Value("${llm.router.use-mock:${AI_USE_MOCK:false}}") boolean useMock,
            @Value("${llm.router.enable-overflow:${AI_ENABLE_OPENROUTER:false}}") boolean enableOverflow) {
        this(buildChain(clients, useMock, enableOverflow), retriesPerProvider, minBackoffMs, maxBackoffMs);
    }

    public ProviderRouter(List<ProviderClient> chain, int retriesPerProvider, long minBackoffMs, long maxBackoffMs) {
        if (chain.isEmpty()) {
            throw new IllegalStateException("No generation providers configured");
        }
        this.chain = List.copyOf(chain);
        this.retriesPerProvider = Math.max(0, retriesPerProvider);
        this.minBackoffMs = Math.max(0, minBackoffMs);
        this.maxBackoffMs = Math.max(this.minBackoffMs, maxBackoffMs);
        for (ProviderClient client : this.chain) {
            providerStates.put(client.getProvider(), new ProviderState(client.getProvider(), client.getModel()));
        }

        log.info("[ROUTER] Initialized | chain={} | retriesPerProvider={} | backoffMs={}..{}",
            this.chain.stream().map(c -> c.getProvider().getDisplayName()).collect(Collectors.joining(" -> ")),
            this.retriesPerProvider, this.minBackoffMs, this.maxBackoffMs);
    }

    private static List<ProviderClient> buildChain(List<ProviderClient> clients, boolean useMock, boolean enableOverflow) {
        Map<LlmProvider, ProviderClient> byProvider = new EnumMap<>(LlmProvider.class);
        clients.forEach(client -> byProvider.put(client.getProvider(), client));

        List<ProviderClient> chain = new ArrayList<>();
        if (!useMock) {
            addIfConfigured(chain, byProvider.get(LlmProvider.GEMINI));
            addIfConfigured(chain, byProvider.get(LlmProvider.GROQ));
            if (enableOverflow) {
                addIfConfigured(chain, byProvider.get(LlmProvider.OPENROUTER));
            }
        }
        if (chain.isEmpty() && byProvider.containsKey(LlmProvider.MOCK)) {
            if (!useMock) {
                log.warn("[ROUTER] No provider API keys configured, falling back to the mock provider");
            }
            chain.add(byProvider.get(LlmProvider.MOCK));
        }
        return chain;
    }

    private static void addIfConfigured(List<ProviderClient> chain, ProviderClient client) {
        if (client == null) {
            return;
        }
        if (!client.isConfigured()) {
            log.debug("[ROUTER] Skipping {} - no API key provided", client.getProvider().getDisplayName());
            return;
        }
        chain.add(client);
    }

    public ProviderResult generate(GenerationInput input, GenerationOptions options) {
        long requestStartTime = System.currentTimeMillis();
        String requestId = options.getRequestId() != null
            ? options.getRequestId()
            : "req-" + System.currentTimeMillis() + "-" + Thread.currentThread().getId();
        CancellationToken token = options.getCancellationToken();

        log.info("[ROUTER] Starting generation | requestId={} | chainLength={} | topicLength={}",
            requestId, chain.size(), input.getTopic().length());

        RuntimeException lastError = null;
        int routerAttempts = 0;
        List<LlmProvider> attemptedProviders = new ArrayList<>();

        for (ProviderClient client : chain) {
            LlmProvider provider = client.getProvider();
            ProviderState state = providerStates.get(provider);
            attemptedProviders.add(provider);

            for (int attempt = 0; attempt <= retriesPerProvider; attempt++) {
                token.throwIfCancelled();
                routerAttempts++;
                state.recordAttempt();

                log.info("[ROUTER] Attempting provider | requestId={} | provider={} | attempt={}/{} | model={}",
                    requestId, provider.getDisplayName(), attempt + 1, retriesPerProvider + 1, client.getModel());

                long providerStartTime = System.currentTimeMillis();
                try {
                    ProviderResult result = client.generate(input, options);
                    state.recordSuccess();
                    log.info("[ROUTER] Provider accepted request | requestId={} | provider={} | providerDurationMs={} | totalDurationMs={} | routerAttempts={}",
                        requestId, provider.getDisplayName(), System.currentTimeMillis() - providerStartTime,
                        System.currentTimeMillis() - requestStartTime, routerAttempts);
                    int attemptsUsed = routerAttempts;
                    return result.withMetadata(metadata -> metadata.toBuilder().routerAttempts(attemptsUsed).build());
                } catch (GenerationCancelledException e) {
                    log.info("[ROUTER] Generation cancelled | requestId={} | provider={} | reason={}",
                        requestId, provider.getDisplayName(), e.getReason());
                    throw e;
                } catch (RuntimeException e) {
                    lastError = e;
                    state.recordFailure(e);
                    boolean retryable = FailureClassifier.isRouterRetryable(e);

                    log.warn("[ROUTER] Provider request failed | requestId={} | provider={} | attempt={}/{} | statusCode={} | classification={} | retryable={} | durationMs={} | error={}",
                        requestId, provider.getDisplayName(), attempt + 1, retriesPerProvider + 1,
                        FailureClassifier.statusCodeOf(e), FailureClassifier.classify(e).getValue(), retryable,
                        System.currentTimeMillis() - providerStartTime, e.getMessage());

                    if (!retryable) {
                        break;
                    }
                    if (attempt < retriesPerProvider) {
                        long waitMs = backoffMs(attempt);
                        log.info("[ROUTER] Backing off before retry | requestId={} | provider={} | waitMs={}",
                            requestId, provider.getDisplayName(), waitMs);
                        sleep(waitMs, token);
                    }
                }
            }
            log.info("[ROUTER] Provider exhausted, moving on | requestId={} | provider={}", requestId, provider.getDisplayName());
        }

        log.error("[ROUTER] All providers failed | requestId={} | routerAttempts={} | attemptedProviders={} | totalDurationMs={} | lastError={}",
            requestId, routerAttempts,
            attemptedProviders.stream().map(LlmProvider::getDisplayName).collect(Collectors.joining(",")),
            System.currentTimeMillis() - requestStartTime, lastError != null ? lastError.getMessage() : "unknown");

        throw lastError;
    }

    long backoffMs(int attempt) {
        long base = Math.min(maxBackoffMs, minBackoffMs * (1L << Math.min(attempt, 16)));
        double jitter = 1.0 + ThreadLocalRandom.current().nextDouble();
        return Math.min(maxBackoffMs, (long) (base * jitter));
    }

    private void sleep(long ms, CancellationToken token) {
        long deadline = System.currentTimeMillis() + ms;
        try {
            while (System.currentTimeMillis() < deadline) {
                token.throwIfCancelled();
                Thread.sleep(Math.min(BACKOFF_POLL_MS, Math.max(1, deadline - System.currentTimeMillis())));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationCancelledException(CancellationReason.CLIENT);
        }
        token.throwIfCancelled();
    }

    public List<LlmProvider> getChain() {
        return chain.stream().map(ProviderClient::getProvider).toList();
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalProviders", chain.size());
        stats.put("chain", getChain().stream().map(LlmProvider::getDisplayName).toList());
        stats.put("retriesPerProvider", retriesPerProvider);

        Map<String, Object> providerStats = new LinkedHashMap<>();
        for (ProviderClient client : chain) {
            ProviderState state = providerStates.get(client.getProvider());
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("model", state.getModel());
            entry.put("attempts", state.getAttempts().get());
            entry.put("successes", state.getSuccesses().get());
            entry.put("failures", state.getFailures().get());
            entry.put("rateLimited", state.getRateLimited().get());
            entry.put("lastStatusCode", state.getLastStatusCode().get());
            entry.put("lastFailureAt", state.getLastFailureAt().get() != null ? state.getLastFailureAt().get().toString() : null);
            entry.put("healthy", state.isHealthy());
            providerStats.put(client.getProvider().getDisplayName(), entry);
        }
        stats.put("providers", providerStats);
        return stats;
    }

    @Getter
    static class ProviderState {
        private final LlmProvider provider;
        private final String model;

        private final AtomicLong attempts = new AtomicLong(0);
        private final AtomicLong successes = new AtomicLong(0);
        private final AtomicLong failures = new AtomicLong(0);
        private final AtomicLong rateLimited = new AtomicLong(0);
        private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
        private final AtomicReference<Integer> lastStatusCode = new AtomicReference<>();
        private final AtomicReference<Instant> lastFailureAt = new AtomicReference<>();

        ProviderState(LlmProvider provider, String model) {
            this.provider = provider;
            this.model = model;
        }

        void recordAttempt() { attempts.incrementAndGet(); }

        void recordSuccess() {
            successes.incrementAndGet();
            consecutiveFailures.set(0);
        }

        void recordFailure(RuntimeException error) {
            failures.incrementAndGet();
            consecutiveFailures.incrementAndGet();
            lastFailureAt.set(Instant.now());
            Integer status = FailureClassifier.statusCodeOf(error);
            lastStatusCode.set(status);
            if (status != null && status == 429) {
                rateLimited.incrementAndGet();
            }
        }

        boolean isHealthy() { return consecutiveFailures.get() < 5; }
    }
}
