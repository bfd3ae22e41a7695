package com.williamcallahan.videochat.service.rerank;

/**
 * Raised when the cross-encoder cannot score a candidate list. Callers keep the fused order.
 */
public class RerankingFailureException extends RuntimeException {

    public RerankingFailureException(String message) {
        super(message);
    }

    public RerankingFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
