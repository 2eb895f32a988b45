package io.horde.api.session;

/**
 * Lifecycle hook run by a virtual user when it starts or stops.
 */
@FunctionalInterface
public interface SessionHook {

    SessionHook NONE = session -> {};

    void run(Session session) throws Exception;
}
