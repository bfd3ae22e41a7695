package com.williamcallahan.videochat.service.quiz;

/**
 * Thrown when the model's quiz output cannot be used.
 */
public class QuizGenerationException extends RuntimeException {

    public QuizGenerationException(String message) {
        super(message);
    }

    public QuizGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
