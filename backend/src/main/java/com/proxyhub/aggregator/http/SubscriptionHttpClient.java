package com.proxyhub.aggregator.http;

import com.proxyhub.aggregator.model.HttpFetchResult;
import com.proxyhub.config.HubProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Issues exactly one GET per call with a caller-supplied timeout. Retrying is left to the caller
 * (the auto-refresh loop or a manual update), so no retry happens here.
 */
@Service
public class SubscriptionHttpClient {
    private static final String ACCEPT = "text/plain, text/html, */*;q=0.8";

    private final HubProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;

    public SubscriptionHttpClient(
        HubProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, Duration timeout) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed", null);
        }
        Duration safeTimeout = timeout == null || timeout.isZero() || timeout.isNegative()
            ? Duration.ofSeconds(properties.getRequestTimeoutSeconds())
            : timeout;

        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(safeTimeout)
                .header("User-Agent", HubProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", ACCEPT)
                .GET()
                .build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                response.body(),
                Duration.between(startedAt, Instant.now()),
                null,
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage(), e);
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage(), e);
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message, Exception failure) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            Duration.between(startedAt, Instant.now()),
            code,
            message,
            failure
        );
    }

    private String describe(IOException e) {
        if (e.getMessage() != null && !e.getMessage().isBlank()) {
            return e.getMessage();
        }
        return e.getClass().getSimpleName();
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            return new URI(input.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
