package io.horde.api.run;

/**
 * A pool gave up ramping after too many failed spawns.
 * The users it already runs keep running; the run continues with the reduced population.
 */
public class PartialRampException extends RuntimeException {

    private final String profileName;
    private final int reached;
    private final int target;

    public PartialRampException(String profileName, int reached, int target, Throwable lastFailure) {
        super("Pool '" + profileName + "' reached " + reached + " of " + target + " users", lastFailure);
        this.profileName = profileName;
        this.reached = reached;
        this.target = target;
    }

    public String profileName() {
        return profileName;
    }

    public int reached() {
        return reached;
    }

    public int target() {
        return target;
    }
}
