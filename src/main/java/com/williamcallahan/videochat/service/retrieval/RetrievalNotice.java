package com.williamcallahan.videochat.service.retrieval;

import com.williamcallahan.videochat.domain.SourceSignal;
import com.williamcallahan.videochat.support.RetrievalErrorClassifier;

/**
 * A retrieval signal that failed and was left out of fusion.
 *
 * @param signal failed signal
 * @param errorType classified failure, see {@link RetrievalErrorClassifier}
 * @param detail failure message
 */
public record RetrievalNotice(SourceSignal signal, String errorType, String detail) {

    static RetrievalNotice of(SourceSignal signal, Throwable failure) {
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return new RetrievalNotice(signal, RetrievalErrorClassifier.determineErrorType(failure), root.getMessage());
    }
}
