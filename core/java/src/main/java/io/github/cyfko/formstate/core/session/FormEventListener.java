package io.github.cyfko.formstate.core.session;

/**
 * Receives the terminal event of a session. Called on the session's mutation queue.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface FormEventListener {

    void onEvent(FormEvent event);
}
