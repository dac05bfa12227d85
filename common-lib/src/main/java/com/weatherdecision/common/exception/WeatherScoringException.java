package com.weatherdecision.common.exception;

/**
 * Base of the input-level failures that stop an evaluation before scoring begins.
 *
 * <p>{@code subject} names what was rejected (a sample field, a profile key) so the
 * caller can point the user at it.
 */
public class WeatherScoringException extends RuntimeException {

    private final String subject;

    public WeatherScoringException(String subject, String message) {
        super("[" + subject + "] " + message);
        this.subject = subject;
    }

    public WeatherScoringException(String subject, String message, Throwable cause) {
        super("[" + subject + "] " + message, cause);
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }
}
