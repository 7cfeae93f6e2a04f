package selfheal.engine;

/**
 * Unchecked root of every exception raised by the healing engine.
 * A strategy that simply finds nothing never throws; see
 * {@link selfheal.strategy.HealingStrategy}.
 */
public class HealingException extends RuntimeException {

    public HealingException(String msg) {
        super(msg);
    }

    public HealingException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
