package com.visionai.gateway.core.model;

/**
 * Outcome of one envelope publish. Publishing never throws; failures are carried in {@code error}.
 *
 * @param eventId id injected into the envelope, {@code null} if the envelope could not be built
 */
public record PublishResult(String channel, String eventId, String error) {

    public static PublishResult ok(String channel, String eventId) {
        return new PublishResult(channel, eventId, null);
    }

    public static PublishResult failed(String channel, String eventId, Throwable cause) {
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new PublishResult(channel, eventId, message);
    }

    public boolean succeeded() {
        return error == null;
    }
}
