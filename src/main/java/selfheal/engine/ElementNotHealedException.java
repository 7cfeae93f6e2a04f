package selfheal.engine;

/**
 * Thrown by callers that must hand back an element (keyword steps, the
 * WebDriver facade) when {@link HealingOrchestrator#resolve} reports a
 * {@link ResolutionFailure}.
 */
public class ElementNotHealedException extends HealingException {

    private final ResolutionFailure failure;

    public ElementNotHealedException(ResolutionFailure failure) {
        super("Could not find element even with self-healing: " + failure);
        this.failure = failure;
    }

    public ResolutionFailure getFailure() {
        return failure;
    }
}
