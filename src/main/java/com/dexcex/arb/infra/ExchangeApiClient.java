package com.dexcex.arb.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionSpec;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * Shared REST client for public exchange endpoints. One instance is shared by all
 * HTTP adapters, so the rate limit is global across venues.
 */
@Slf4j
public class ExchangeApiClient {

    private static final String USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final int MAX_ATTEMPTS = 3;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final Duration retryBackoff;

    public ExchangeApiClient(ObjectMapper objectMapper, double permitsPerSecond, Duration timeout,
            Duration retryBackoff) {
        this.objectMapper = objectMapper;
        this.rateLimiter = new RateLimiter(permitsPerSecond);
        this.retryBackoff = retryBackoff;

        ConnectionSpec spec = new ConnectionSpec.Builder(ConnectionSpec.MODERN_TLS)
                .allEnabledTlsVersions()
                .allEnabledCipherSuites()
                .build();

        this.httpClient = new OkHttpClient.Builder()
                .connectionSpecs(Arrays.asList(spec, ConnectionSpec.CLEARTEXT))
                .readTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .connectTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }

    /**
     * Every attempt, retries included, waits for its own permit.
     */
    public JsonNode getJson(String url) {
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .build();

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            rateLimiter.acquire();
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    if (response.code() == 429 && attempt < MAX_ATTEMPTS) {
                        log.debug("Rate limited by {} (attempt {}), backing off", url, attempt);
                        backoff(retryBackoff.multipliedBy(attempt));
                        continue;
                    }
                    throw new ExchangeApiException(
                            "API request failed: " + response.code() + " " + response.message() + " [" + url + "]");
                }
                ResponseBody body = response.body();
                if (body == null) {
                    throw new ExchangeApiException("Empty response body [" + url + "]");
                }
                return objectMapper.readTree(body.string());
            } catch (IOException e) {
                if (attempt == MAX_ATTEMPTS) {
                    throw new ExchangeApiException("Failed to call API after retries: " + url, e);
                }
                log.debug("Transient error calling {}: {}", url, e.getMessage());
                backoff(retryBackoff);
            }
        }
        throw new ExchangeApiException("Failed to call API after retries: " + url);
    }

    private void backoff(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeApiException("Interrupted while backing off", e);
        }
    }

    public static class ExchangeApiException extends RuntimeException {
        public ExchangeApiException(String message) {
            super(message);
        }

        public ExchangeApiException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Spaces calls at least {@code 1 / permitsPerSecond} apart. Callers reserve the next
     * free slot under the lock and sleep outside it.
     */
    static class RateLimiter {
        private final long intervalNanos;
        private long nextFreeNanos = System.nanoTime();

        RateLimiter(double permitsPerSecond) {
            if (permitsPerSecond <= 0) {
                throw new IllegalArgumentException("permitsPerSecond must be positive: " + permitsPerSecond);
            }
            this.intervalNanos = (long) (TimeUnit.SECONDS.toNanos(1) / permitsPerSecond);
        }

        void acquire() {
            long waitNanos = reserve(System.nanoTime());
            if (waitNanos <= 0) {
                return;
            }
            try {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExchangeApiException("Interrupted while waiting for rate limit", e);
            }
        }

        /**
         * @return nanoseconds the caller must wait before its slot starts
         */
        synchronized long reserve(long nowNanos) {
            long slot = Math.max(nowNanos, nextFreeNanos);
            nextFreeNanos = slot + intervalNanos;
            return slot - nowNanos;
        }
    }
}
