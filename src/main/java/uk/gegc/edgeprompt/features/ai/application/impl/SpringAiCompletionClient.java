package uk.gegc.edgeprompt.features.ai.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import uk.gegc.edgeprompt.features.ai.application.CompletionClient;
import uk.gegc.edgeprompt.features.ai.config.AiCompletionProperties;
import uk.gegc.edgeprompt.shared.config.AiRateLimitConfig;
import uk.gegc.edgeprompt.shared.exception.AiServiceException;
import uk.gegc.edgeprompt.shared.exception.CompletionCancelledException;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Completion client on top of Spring AI's {@link ChatClient} (OpenAI-compatible server).
 * Each attempt runs on the {@code aiTaskExecutor}; the calling thread waits for it while
 * watching the deadline and the cancellation checker.
 */
@Service
@Slf4j
public class SpringAiCompletionClient implements CompletionClient {

    private static final long POLL_INTERVAL_MS = 50;

    private final ChatClient chatClient;
    private final AiCompletionProperties properties;
    private final AiRateLimitConfig rateLimitConfig;
    private final ThreadPoolTaskExecutor aiTaskExecutor;
    private final RestClient completionServerRestClient;
    private final Logger aiResponseLogger;

    public SpringAiCompletionClient(ChatClient chatClient,
                                    AiCompletionProperties properties,
                                    AiRateLimitConfig rateLimitConfig,
                                    @Qualifier("aiTaskExecutor") ThreadPoolTaskExecutor aiTaskExecutor,
                                    @Qualifier("completionServerRestClient") RestClient completionServerRestClient,
                                    @Qualifier("aiResponseLogger") Logger aiResponseLogger) {
        this.chatClient = chatClient;
        this.properties = properties;
        this.rateLimitConfig = rateLimitConfig;
        this.aiTaskExecutor = aiTaskExecutor;
        this.completionServerRestClient = completionServerRestClient;
        this.aiResponseLogger = aiResponseLogger;
    }

    @Override
    public String complete(String prompt, BooleanSupplier cancellationChecker) {
        if (prompt == null || prompt.isBlank()) {
            throw new AiServiceException("Prompt cannot be null or empty");
        }

        int maxAttempts = Math.max(1, rateLimitConfig.getMaxRetries());
        log.info("Sending completion request ({} characters)", prompt.length());
        aiResponseLogger.info("PROMPT\n{}", prompt);

        for (int attempt = 1; ; attempt++) {
            if (cancellationChecker.getAsBoolean()) {
                throw new CompletionCancelledException("Completion cancelled before attempt " + attempt);
            }

            Future<String> future = aiTaskExecutor.getThreadPoolExecutor().submit(() -> requestCompletion(prompt));
            try {
                String content = awaitResult(future, cancellationChecker);
                aiResponseLogger.info("RESPONSE\n{}", content);
                log.info("Completion received ({} characters, attempt {})", content.length(), attempt);
                return content;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Completion request failed (attempt {}/{}): {}", attempt, maxAttempts, cause.getMessage());
                if (attempt >= maxAttempts) {
                    throw new AiServiceException(
                            "Failed to get completion after " + maxAttempts + " attempts: " + cause.getMessage(), cause);
                }
                long delayMs = calculateBackoffDelay(attempt - 1);
                log.warn("Retrying completion in {} ms", delayMs);
                sleepForRateLimit(delayMs);
            }
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            ResponseEntity<Void> response = completionServerRestClient.get()
                    .uri("/v1/models")
                    .retrieve()
                    .toBodilessEntity();
            return response.getStatusCode().value() == 200;
        } catch (Exception e) {
            log.warn("Completion endpoint {} is not available: {}", properties.getBaseUrl(), e.getMessage());
            return false;
        }
    }

    private String requestCompletion(String prompt) {
        String content = chatClient.prompt()
                .system(properties.getSystemPrompt())
                .user(prompt)
                .call()
                .content();
        if (content == null) {
            throw new AiServiceException("No completion returned by " + properties.getBaseUrl());
        }
        return content;
    }

    /**
     * Waits for the attempt. Deadline and cancellation abort the attempt and are not retried.
     *
     * @throws ExecutionException if the request itself failed
     */
    private String awaitResult(Future<String> future, BooleanSupplier cancellationChecker) throws ExecutionException {
        Duration timeout = properties.getCompletionTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            if (cancellationChecker.getAsBoolean()) {
                future.cancel(true);
                log.info("Completion cancelled by caller");
                throw new CompletionCancelledException("Completion cancelled");
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                future.cancel(true);
                log.error("Completion timed out after {} ms", timeout.toMillis());
                throw new AiServiceException("Completion timed out after " + timeout.toMillis() + " ms");
            }
            try {
                return future.get(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_INTERVAL_MS)), TimeUnit.NANOSECONDS);
            } catch (TimeoutException stillRunning) {
                // poll again
                continue;
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new AiServiceException("Interrupted while waiting for completion", e);
            }
        }
    }

    /**
     * Exponential backoff with jitter, capped at the configured maximum.
     */
    private long calculateBackoffDelay(int retryCount) {
        long exponentialDelay = rateLimitConfig.getBaseDelayMs() * (long) Math.pow(2, retryCount);
        double jitterRange = rateLimitConfig.getJitterFactor();
        double jitter = (1.0 - jitterRange) + (Math.random() * 2 * jitterRange);
        return Math.min((long) (exponentialDelay * jitter), rateLimitConfig.getMaxDelayMs());
    }

    /**
     * Overridden in tests to avoid actual sleeping.
     */
    protected void sleepForRateLimit(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AiServiceException("Interrupted while waiting to retry", ie);
        }
    }
}
