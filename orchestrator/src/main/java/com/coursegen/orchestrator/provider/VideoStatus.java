package com.coursegen.orchestrator.provider;

/**
 * One poll answer from a {@link VideoProvider}.
 *
 * @param resultUrl set when state is DONE
 * @param error     set when state is ERROR
 */
public record VideoStatus(State state, String resultUrl, String error) {

    public enum State { PENDING, DONE, ERROR }

    public static VideoStatus pending() {
        return new VideoStatus(State.PENDING, null, null);
    }

    public static VideoStatus done(String resultUrl) {
        return new VideoStatus(State.DONE, resultUrl, null);
    }

    public static VideoStatus error(String error) {
        return new VideoStatus(State.ERROR, null, error);
    }
}
