package io.github.cyfko.formstate.core.session;

import io.github.cyfko.formstate.core.model.ResponseDocument;

import java.util.Objects;

/**
 * Terminal event of a session.
 *
 * @param type      what happened
 * @param sessionId id of the session
 * @param response  the submitted response (disabled items excluded), or the response as it was on cancel
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormEvent(Type type, String sessionId, ResponseDocument response) {

    public enum Type {
        SUBMITTED,
        CANCELLED
    }

    public FormEvent {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(sessionId, "sessionId cannot be null");
        Objects.requireNonNull(response, "response cannot be null");
    }
}
