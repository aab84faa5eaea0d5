package com.coursegen.orchestrator.provider;

import com.coursegen.orchestrator.fallback.FailureKind;

/**
 * Thrown by a provider client when a call does not produce a usable answer.
 *
 * Always classified: the kind travels with the exception so the producer
 * adapter can hand the fallback chain an explicit tag instead of a message
 * to pattern-match on.
 */
public class ProviderException extends RuntimeException {

    private final FailureKind kind;

    public ProviderException(FailureKind kind, String message) {
        this(kind, message, null);
    }

    public ProviderException(FailureKind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public static ProviderException missingCredential(String provider) {
        return new ProviderException(FailureKind.CONFIGURATION, "No API key configured for " + provider);
    }

    /** Non-2xx answer. 401/403 mean a bad credential, everything else is transient. */
    public static ProviderException httpStatus(String provider, int statusCode, String body) {
        FailureKind kind = (statusCode == 401 || statusCode == 403)
                ? FailureKind.CONFIGURATION
                : FailureKind.PROVIDER;
        return new ProviderException(kind, "%s error %d: %s".formatted(provider, statusCode, abbreviate(body)));
    }

    public FailureKind kind() {
        return kind;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 300 ? body : body.substring(0, 300) + "...";
    }
}
