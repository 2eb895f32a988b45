package io.horde.api.task;

import io.horde.api.session.Session;

/**
 * Builds the request a virtual user sends when this task is selected.
 * <p>
 * A task may read and mutate the owning user's session (e.g. append to a
 * conversation transcript) but keeps no state of its own between invocations.
 */
@FunctionalInterface
public interface Task {

    RequestSpec build(Session session) throws Exception;
}
