package seakers.rocketbees.model;

/**
 * Thrown at construction when the rockets cannot carry all the modules, i.e. total capacity is below the module count
 */
public class InfeasibleProblemException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final long totalCapacity;
    private final int numModules;

    public InfeasibleProblemException(long totalCapacity, int numModules) {
        super("Not enough capacity to carry all modules: total capacity " + totalCapacity + " < " + numModules + " modules");
        this.totalCapacity = totalCapacity;
        this.numModules = numModules;
    }

    public long getTotalCapacity() {
        return this.totalCapacity;
    }

    public int getNumModules() {
        return this.numModules;
    }
}
