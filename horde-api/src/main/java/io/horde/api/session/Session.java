package io.horde.api.session;

import java.util.Map;
import java.util.Optional;

/**
 * Session context available to tasks during execution.
 * Each virtual user gets its own session instance and is the only thread touching it.
 */
public interface Session {

    /**
     * @return unique identifier for this virtual user session
     */
    String sessionId();

    /**
     * Store a value in the session for use by subsequent tasks.
     * A {@code null} value removes the key.
     */
    void put(String key, Object value);

    /**
     * Retrieve a value from the session.
     */
    Optional<Object> get(String key);

    /**
     * Retrieve a value from the session if it is present and of the given type.
     */
    default <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    /**
     * @return all session attributes
     */
    Map<String, Object> attributes();
}
