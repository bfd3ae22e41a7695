package com.williamcallahan.videochat.support;

import com.williamcallahan.videochat.service.EmbeddingServiceUnavailableException;
import java.util.Locale;
import java.util.concurrent.ExecutionException;

/**
 * Classifies vector store and retrieval failures into stable categories.
 */
public final class RetrievalErrorClassifier {

    /** Category label for socket and deadline failures. */
    public static final String CONNECTION_ERROR = "Connection Error";
    /** Category label for HTTP 429 and gRPC resource exhaustion. */
    public static final String RATE_LIMITED = "429 Rate Limited";
    /** Category label for embedding provider outages. */
    public static final String EMBEDDING_UNAVAILABLE = "Embedding Service Unavailable";
    /** Category label for anything unrecognized. */
    public static final String UNKNOWN = "Unknown Error";

    private RetrievalErrorClassifier() {}

    /**
     * Determine a stable error category based on exception types, messages and causes.
     *
     * @param error failure encountered during retrieval
     * @return normalized error category label
     */
    public static String determineErrorType(Throwable error) {
        StringBuilder messageBuilder = new StringBuilder();
        Throwable current = error;
        while (current != null) {
            if (current instanceof EmbeddingServiceUnavailableException) {
                return EMBEDDING_UNAVAILABLE;
            }
            String currentMessage = current.getMessage();
            if (currentMessage != null && !currentMessage.isBlank()) {
                if (messageBuilder.length() > 0) {
                    messageBuilder.append(' ');
                }
                messageBuilder.append(currentMessage);
            }
            current = current.getCause();
        }

        String message = messageBuilder.toString().toLowerCase(Locale.ROOT);

        if (message.contains("429") || message.contains("too many requests") || message.contains("resource exhausted")) {
            return RATE_LIMITED;
        } else if (message.contains("connection")
                || message.contains("timeout")
                || message.contains("timed out")
                || message.contains("unavailable")
                || message.contains("deadline exceeded")) {
            return CONNECTION_ERROR;
        }
        return UNKNOWN;
    }

    /**
     * Determines whether the exception is a transient Qdrant error worth retrying.
     *
     * <p>Connection issues, deadlines, rate limits and gRPC status failures are transient.
     * Malformed ids and other programming errors are not.
     *
     * @param error the exception to classify
     * @return true if the error is transient
     */
    public static boolean isTransientVectorStoreError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            String lowerMessage = current.getMessage() == null ? "" : current.getMessage().toLowerCase(Locale.ROOT);
            if (current instanceof IllegalArgumentException && lowerMessage.contains("uuid")) {
                return false;
            }
            if (current instanceof ExecutionException && current.getCause() != null) {
                String causeName = current.getCause().getClass().getName().toLowerCase(Locale.ROOT);
                if (causeName.contains("statusruntimeexception")) {
                    return true;
                }
            }
            current = current.getCause();
        }

        String errorType = determineErrorType(error);
        return CONNECTION_ERROR.equals(errorType) || RATE_LIMITED.equals(errorType);
    }
}
