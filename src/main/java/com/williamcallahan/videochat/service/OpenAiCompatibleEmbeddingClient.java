package com.williamcallahan.videochat.service;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIRetryableException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.Embedding;
import com.openai.models.embeddings.EmbeddingCreateParams;
import com.williamcallahan.videochat.support.OpenAiSdkUrlNormalizer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenAI-compatible embedding client for the sentence-transformer endpoint.
 *
 * <p>Calls {@code /embeddings} through the OpenAI Java SDK. Transient provider failures are retried
 * here with exponential backoff; anything else surfaces as
 * {@link EmbeddingServiceUnavailableException} so ingestion aborts before writing.</p>
 */
public class OpenAiCompatibleEmbeddingClient implements EmbeddingClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleEmbeddingClient.class);

    private static final int CONNECT_TIMEOUT_SECONDS = 10;
    private static final int READ_TIMEOUT_SECONDS = 120;
    private static final int MAX_ERROR_SNIPPET = 512;
    private static final int MAX_EMBED_ATTEMPTS = 4;
    private static final long INITIAL_RETRY_BACKOFF_MILLIS = 1_000L;
    private static final long MAX_RETRY_BACKOFF_MILLIS = 8_000L;

    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_CONFLICT = 409;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_INTERNAL_SERVER_ERROR = 500;

    private final OpenAIClient client;
    private final String modelName;
    private final int dimensions;

    /**
     * Creates a client for a remote OpenAI-compatible embedding endpoint.
     *
     * @param baseUrl base URL of the provider
     * @param apiKey API key, may be blank for self-hosted servers
     * @param modelName embedding model identifier
     * @param dimensions expected vector dimension
     * @return embedding client
     */
    public static OpenAiCompatibleEmbeddingClient create(
            String baseUrl, String apiKey, String modelName, int dimensions) {
        validateDimensions(dimensions);
        OpenAIClient client = OpenAIOkHttpClient.builder()
                // self-hosted servers ignore the key, but the SDK requires one
                .apiKey(apiKey == null || apiKey.isBlank() ? "unused" : apiKey)
                .baseUrl(OpenAiSdkUrlNormalizer.normalize(baseUrl))
                .build();
        return new OpenAiCompatibleEmbeddingClient(client, requireConfiguredModel(modelName), dimensions);
    }

    static OpenAiCompatibleEmbeddingClient create(OpenAIClient client, String modelName, int dimensions) {
        validateDimensions(dimensions);
        return new OpenAiCompatibleEmbeddingClient(
                Objects.requireNonNull(client, "client"), requireConfiguredModel(modelName), dimensions);
    }

    private OpenAiCompatibleEmbeddingClient(OpenAIClient client, String modelName, int dimensions) {
        this.client = client;
        this.modelName = modelName;
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        EmbeddingCreateParams params = EmbeddingCreateParams.builder()
                .model(modelName)
                .inputOfArrayOfStrings(texts)
                .build();

        for (int attemptNumber = 1; attemptNumber <= MAX_EMBED_ATTEMPTS; attemptNumber++) {
            try {
                CreateEmbeddingResponse response = client.embeddings().create(params, requestOptions());
                return parseResponse(response, texts.size());
            } catch (EmbeddingServiceUnavailableException invalidResponse) {
                throw invalidResponse;
            } catch (RuntimeException exception) {
                if (shouldRetry(exception, attemptNumber)) {
                    long backoffMillis = calculateBackoff(attemptNumber);
                    log.warn("[EMBEDDING] {} on attempt {}/{}; retrying in {}ms ({})",
                            exception.getClass().getSimpleName(),
                            attemptNumber,
                            MAX_EMBED_ATTEMPTS,
                            backoffMillis,
                            sanitizeMessage(exception.getMessage()));
                    sleepBeforeRetry(backoffMillis);
                    continue;
                }
                throw new EmbeddingServiceUnavailableException(
                        "Remote embedding call failed after " + attemptNumber + " attempt(s): "
                                + sanitizeMessage(exception.getMessage()),
                        exception);
            }
        }
        throw new EmbeddingServiceUnavailableException("Remote embedding call failed after retries");
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private static RequestOptions requestOptions() {
        Duration requestTimeout = Duration.ofSeconds(READ_TIMEOUT_SECONDS);
        Timeout timeout = Timeout.builder()
                .connect(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS))
                .request(requestTimeout)
                .read(requestTimeout)
                .build();
        return RequestOptions.builder().timeout(timeout).build();
    }

    private static boolean shouldRetry(RuntimeException exception, int attemptNumber) {
        if (attemptNumber >= MAX_EMBED_ATTEMPTS) {
            return false;
        }
        if (exception instanceof OpenAIServiceException serviceException) {
            int statusCode = serviceException.statusCode();
            return statusCode == HTTP_TOO_MANY_REQUESTS
                    || statusCode == HTTP_REQUEST_TIMEOUT
                    || statusCode == HTTP_CONFLICT
                    || statusCode >= HTTP_INTERNAL_SERVER_ERROR;
        }
        return exception instanceof OpenAIRetryableException;
    }

    private static long calculateBackoff(int attemptNumber) {
        return Math.min(INITIAL_RETRY_BACKOFF_MILLIS * (1L << (attemptNumber - 1)), MAX_RETRY_BACKOFF_MILLIS);
    }

    private static void sleepBeforeRetry(long retryBackoffMillis) {
        try {
            Thread.sleep(retryBackoffMillis);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new EmbeddingServiceUnavailableException("Embedding retry interrupted", interruptedException);
        }
    }

    private List<float[]> parseResponse(CreateEmbeddingResponse response, int expectedCount) {
        if (response == null || response.data().isEmpty()) {
            throw new EmbeddingServiceUnavailableException("Remote embedding response missing embedding entries");
        }

        float[][] embeddingsByIndex = new float[expectedCount][];
        for (Embedding embeddingEntry : response.data()) {
            long responseIndex = embeddingEntry.index();
            if (responseIndex < 0 || responseIndex >= expectedCount) {
                log.debug("[EMBEDDING] Ignoring embedding index={} (expectedCount={})", responseIndex, expectedCount);
                continue;
            }
            embeddingsByIndex[(int) responseIndex] = toFloatVector(embeddingEntry.embedding());
        }

        List<float[]> orderedEmbeddings = new ArrayList<>(expectedCount);
        for (int index = 0; index < expectedCount; index++) {
            if (embeddingsByIndex[index] == null) {
                throw new EmbeddingServiceUnavailableException(
                        "Remote embedding response missing embedding for index " + index);
            }
            orderedEmbeddings.add(embeddingsByIndex[index]);
        }
        return List.copyOf(orderedEmbeddings);
    }

    private float[] toFloatVector(List<Float> values) {
        if (values == null || values.isEmpty()) {
            throw new EmbeddingServiceUnavailableException("Remote embedding response missing embedding values");
        }
        if (values.size() != dimensions) {
            throw new EmbeddingServiceUnavailableException("Remote embedding dimension mismatch: expected "
                    + dimensions + " but received " + values.size());
        }
        float[] vector = new float[values.size()];
        for (int vectorIndex = 0; vectorIndex < values.size(); vectorIndex++) {
            Float value = values.get(vectorIndex);
            if (value == null) {
                throw new EmbeddingServiceUnavailableException(
                        "Remote embedding payload invalid: null value at index " + vectorIndex);
            }
            vector[vectorIndex] = value;
        }
        return vector;
    }

    private static void validateDimensions(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive: " + dimensions);
        }
    }

    private static String requireConfiguredModel(String modelName) {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalStateException("Embedding model is not configured (app.embedding.model)");
        }
        return modelName.trim();
    }

    private static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "no details";
        }
        String sanitized = message.replace("\r", " ").replace("\n", " ").trim();
        if (sanitized.length() > MAX_ERROR_SNIPPET) {
            return sanitized.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
        return sanitized;
    }

    /**
     * Closes the underlying OpenAI client and releases its resources.
     */
    @Override
    public void close() {
        client.close();
    }
}
