package io.horde.api.task;

import io.horde.api.ConfigurationException;

import java.util.Set;

/**
 * Thrown when the active tag filter leaves no task to select from.
 */
public class NoEligibleTaskException extends ConfigurationException {

    private final Set<String> tagFilter;

    public NoEligibleTaskException(String profileName, Set<String> tagFilter) {
        super("No task of profile '" + profileName + "' matches tag filter " + tagFilter);
        this.tagFilter = Set.copyOf(tagFilter);
    }

    public Set<String> tagFilter() {
        return tagFilter;
    }
}
