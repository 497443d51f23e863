package seakers.rocketbees.model;

/**
 * Thrown when problem settings or search parameters are malformed (dimension mismatch, negative values, etc.)
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }
}
