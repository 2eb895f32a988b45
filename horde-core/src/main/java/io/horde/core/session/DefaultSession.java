package io.horde.core.session;

import io.horde.api.session.Session;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Default session implementation for virtual users.
 * Only the owning virtual user's thread touches it, so a plain map is enough.
 */
public class DefaultSession implements Session {

    private final String sessionId;
    private final Map<String, Object> attributes = new HashMap<>();

    public DefaultSession() {
        this(UUID.randomUUID().toString());
    }

    public DefaultSession(String sessionId) {
        this.sessionId = sessionId;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public void put(String key, Object value) {
        if (value == null) {
            attributes.remove(key);
        } else {
            attributes.put(key, value);
        }
    }

    @Override
    public Optional<Object> get(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    @Override
    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Override
    public String toString() {
        return "DefaultSession[" + sessionId + "]";
    }
}
