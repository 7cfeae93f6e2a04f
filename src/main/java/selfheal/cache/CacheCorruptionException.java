package selfheal.cache;

import selfheal.engine.HealingException;

/**
 * A persisted cache could not be read back. {@link HealingCache} recovers by
 * starting empty.
 */
public class CacheCorruptionException extends HealingException {

    public CacheCorruptionException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
