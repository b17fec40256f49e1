package com.mk.fx.qa.llm.load.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP client for an OpenAI-compatible {@code /v1/chat/completions} endpoint. One instance wraps a
 * single {@link HttpClient}, so every caller shares the same connection pool. This implementation
 * does not include retry logic; it classifies failures into {@link LlmTimeoutException} and
 * {@link LlmTransportException} and leaves the retry policy to the caller.
 */
@Slf4j
public class LlmHttpClient implements AutoCloseable {

    /** Path of the chat completion operation, relative to the endpoint. */
    public static final String COMPLETIONS_PATH = "/v1/chat/completions";

    /** Default connection timeout in seconds. */
    private static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;

    /** The underlying Java HTTP client. */
    private final HttpClient httpClient;

    /** Headers included in all requests. */
    private final Map<String, String> headers;

    /** Fully resolved completion URI. */
    private final URI completionsUri;

    /** Default timeout applied to each request. */
    private final Duration requestTimeout;

    /**
     * Constructs a client with the default connection timeout.
     *
     * @param baseUrl endpoint base URL, e.g. {@code https://llm.example.com}
     * @param bearerToken optional credential sent as {@code Authorization: Bearer ...}
     * @param requestTimeoutSeconds per-request timeout in seconds
     * @param verifyTls whether server certificates are verified
     */
    public LlmHttpClient(
            String baseUrl, String bearerToken, int requestTimeoutSeconds, boolean verifyTls) {
        this(baseUrl, bearerToken, DEFAULT_CONNECT_TIMEOUT_SECONDS, requestTimeoutSeconds, verifyTls);
    }

    /**
     * Constructs a client.
     *
     * @param baseUrl endpoint base URL
     * @param bearerToken optional credential, ignored when null or blank
     * @param connTimeOutSeconds connection timeout in seconds
     * @param requestTimeoutSeconds per-request timeout in seconds
     * @param verifyTls whether server certificates and host names are verified
     */
    public LlmHttpClient(
            String baseUrl,
            String bearerToken,
            int connTimeOutSeconds,
            int requestTimeoutSeconds,
            boolean verifyTls) {

        var normalized = validateAndNormalizeBaseUrl(baseUrl);
        this.completionsUri = URI.create(normalized + COMPLETIONS_PATH);
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);

        var builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(connTimeOutSeconds));
        if (!verifyTls) {
            builder.sslContext(InsecureTls.sslContext());
        }
        this.httpClient = builder.build();

        var globalHeaders = new LinkedHashMap<String, String>();
        globalHeaders.put("Content-Type", "application/json");
        if (bearerToken != null && !bearerToken.isBlank()) {
            globalHeaders.put("Authorization", "Bearer " + bearerToken);
        }
        this.headers = Map.copyOf(globalHeaders);

        log.info(
                "LlmHttpClient initialised - URI: {}, Connection timeout: {}s, Request timeout: {}s, TLS verification: {}",
                completionsUri,
                connTimeOutSeconds,
                requestTimeoutSeconds,
                verifyTls);
    }

    /**
     * Sends a chat completion request using the default request timeout.
     *
     * @see #send(ChatCompletionRequest, Duration)
     */
    public ChatResponseData send(ChatCompletionRequest request) throws InterruptedException {
        return send(request, requestTimeout);
    }

    /**
     * Sends a chat completion request synchronously. Any HTTP status is returned as response data;
     * only failures to obtain a response are thrown.
     *
     * @param request the completion request
     * @param timeout timeout for this request
     * @return the response data
     * @throws LlmTimeoutException if no response arrived within the timeout
     * @throws LlmTransportException on connection, DNS, TLS or serialization failures
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    public ChatResponseData send(ChatCompletionRequest request, Duration timeout)
            throws InterruptedException {
        Objects.requireNonNull(request, "Request cannot be null");
        Objects.requireNonNull(timeout, "Timeout cannot be null");

        var httpRequest = buildHttpRequest(request, timeout);
        var startTime = System.nanoTime();
        try {
            log.debug("Executing POST to {} (model={})", completionsUri, request.getModel());

            var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            var duration = (System.nanoTime() - startTime) / 1_000_000;

            log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
            return new ChatResponseData(response.statusCode(), response.body(), duration);

        } catch (HttpTimeoutException e) {
            log.debug("Request timed out after {} seconds: {}", timeout.toSeconds(), e.getMessage());
            throw new LlmTimeoutException("Request timeout after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            log.debug("Transport error executing request: {}", e.toString());
            throw new LlmTransportException(describe(e), e);
        }
    }

    /** Returns the URI every request is posted to. */
    public URI completionsUri() {
        return completionsUri;
    }

    private HttpRequest buildHttpRequest(ChatCompletionRequest request, Duration timeout) {
        String jsonBody;
        try {
            jsonBody = JsonUtil.toJson(request);
        } catch (JsonProcessingException e) {
            throw new LlmTransportException("Failed to serialize request body: " + e.getMessage(), e);
        }

        var requestBuilder = HttpRequest.newBuilder()
                .uri(completionsUri)
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody));
        headers.forEach(requestBuilder::header);
        return requestBuilder.build();
    }

    /** Builds a readable message for transport failures whose message is often null. */
    private static String describe(IOException e) {
        var message = e.getMessage();
        if (message == null || message.isBlank()) {
            Throwable cause = e.getCause();
            message = cause != null && cause.getMessage() != null ? cause.getMessage() : "";
        }
        var type = e.getClass().getSimpleName();
        return message.isBlank() ? type : type + ": " + message;
    }

    /**
     * Validates and normalizes the base URL.
     *
     * @throws IllegalArgumentException if the base URL is empty or not absolute http(s)
     */
    private String validateAndNormalizeBaseUrl(String baseUrl) {
        Objects.requireNonNull(baseUrl, "Base URL cannot be null");
        var trimmed = baseUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Base URL cannot be empty");
        }
        if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
            throw new IllegalArgumentException("Base URL must start with http:// or https://");
        }
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    /** The JDK client keeps no resources that outlive garbage collection on Java 17. */
    @Override
    public void close() {
        log.debug("LlmHttpClient for {} closed", completionsUri);
    }
}
