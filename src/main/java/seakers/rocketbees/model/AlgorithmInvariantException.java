package seakers.rocketbees.model;

/**
 * Thrown when an internally constructed allocation breaks the capacity or coverage invariants. Signals a bug in the
 * search code, never a problem with the user's input.
 */
public class AlgorithmInvariantException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public AlgorithmInvariantException(String message) {
        super(message);
    }
}
