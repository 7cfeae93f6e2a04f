package selfheal.snapshot;

import selfheal.engine.HealingException;

/**
 * The driver binding could not produce a snapshot (session gone, connection
 * lost, script error). Fatal for the current resolution.
 */
public class SnapshotUnavailableException extends HealingException {

    public SnapshotUnavailableException(String msg) {
        super(msg);
    }

    public SnapshotUnavailableException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
