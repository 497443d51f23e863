package seakers.rocketbees.model;

import java.util.Arrays;

/**
 * Immutable description of the module-to-rocket allocation problem.
 *
 * Each rocket r can carry at most capacities[r] modules. A rocket that carries at least one module burns
 * baseFuel[r] plus costMatrix[r][m] for every module m on board. Rockets that carry nothing burn nothing.
 */
public class ProblemSettings {

    private final int numRockets;
    private final int numModules;
    private final int[] capacities;
    private final double[] baseFuel;
    private final double[][] costMatrix;

    /**
     * @param numRockets number of rockets in the fleet
     * @param numModules number of modules to allocate
     * @param capacities maximum number of modules per rocket (length numRockets)
     * @param baseFuel fuel burned by a rocket carrying at least one module (length numRockets)
     * @param costMatrix costMatrix[r][m] is the fuel cost of carrying module m on rocket r
     * @throws ConfigurationException on dimension mismatch or negative values
     * @throws InfeasibleProblemException if the fleet cannot carry all modules
     */
    public ProblemSettings(int numRockets, int numModules, int[] capacities, double[] baseFuel, double[][] costMatrix) {
        this.numRockets = numRockets;
        this.numModules = numModules;
        this.capacities = capacities == null ? null : capacities.clone();
        this.baseFuel = baseFuel == null ? null : baseFuel.clone();
        if (costMatrix == null) {
            this.costMatrix = null;
        } else {
            this.costMatrix = new double[costMatrix.length][];
            for (int r = 0; r < costMatrix.length; r++) {
                this.costMatrix[r] = costMatrix[r] == null ? null : costMatrix[r].clone();
            }
        }

        validate();

        if (totalCapacity() < numModules) {
            throw new InfeasibleProblemException(totalCapacity(), numModules);
        }
    }

    /**
     * Builds settings from module types instead of individual modules. Every type t contributes moduleAmounts[t]
     * modules, each costing typeCosts[r][t] on rocket r. Modules are numbered type by type, in type order.
     *
     * @param capacities maximum number of modules per rocket
     * @param baseFuel fuel burned by a rocket carrying at least one module
     * @param typeCosts typeCosts[r][t] is the cost of one module of type t on rocket r
     * @param moduleAmounts number of modules of each type
     * @return the expanded settings
     */
    public static ProblemSettings ofModuleTypes(int[] capacities, double[] baseFuel, double[][] typeCosts, int[] moduleAmounts) {
        if (capacities == null || baseFuel == null || typeCosts == null || moduleAmounts == null) {
            throw new ConfigurationException("Capacities, base fuel, type costs and module amounts are required");
        }
        if (typeCosts.length != capacities.length) {
            throw new ConfigurationException("Type cost rows (" + typeCosts.length + ") do not match rocket count (" + capacities.length + ")");
        }

        int numModules = 0;
        for (int t = 0; t < moduleAmounts.length; t++) {
            if (moduleAmounts[t] < 0) {
                throw new ConfigurationException("Negative amount for module type " + t + ": " + moduleAmounts[t]);
            }
            numModules += moduleAmounts[t];
        }

        double[][] costMatrix = new double[capacities.length][numModules];
        for (int r = 0; r < capacities.length; r++) {
            if (typeCosts[r] == null || typeCosts[r].length != moduleAmounts.length) {
                throw new ConfigurationException("Type cost row " + r + " must have " + moduleAmounts.length + " entries");
            }
            int module = 0;
            for (int t = 0; t < moduleAmounts.length; t++) {
                for (int k = 0; k < moduleAmounts[t]; k++) {
                    costMatrix[r][module++] = typeCosts[r][t];
                }
            }
        }

        return new ProblemSettings(capacities.length, numModules, capacities, baseFuel, costMatrix);
    }

    /**
     * Builds settings for a fleet described by rocket types. Rocket r is of type rocketTypes[r] and takes its
     * capacity, base fuel and per-module-type costs from that type.
     *
     * @param rocketTypes type index of every rocket in the fleet
     * @param typeCapacities capacity of each rocket type
     * @param typeBaseFuel base fuel of each rocket type
     * @param typeModuleCosts typeModuleCosts[k][t] is the cost of one module of type t on a rocket of type k
     * @param moduleAmounts number of modules of each module type
     * @return the expanded settings
     */
    public static ProblemSettings ofRocketTypes(int[] rocketTypes, int[] typeCapacities, double[] typeBaseFuel, double[][] typeModuleCosts, int[] moduleAmounts) {
        if (rocketTypes == null || typeCapacities == null || typeBaseFuel == null || typeModuleCosts == null) {
            throw new ConfigurationException("Rocket types, type capacities, type base fuel and type module costs are required");
        }
        int numTypes = typeCapacities.length;
        if (typeBaseFuel.length != numTypes || typeModuleCosts.length != numTypes) {
            throw new ConfigurationException("Expected " + numTypes + " rocket types in base fuel and module costs, got "
                    + typeBaseFuel.length + " and " + typeModuleCosts.length);
        }

        int[] capacities = new int[rocketTypes.length];
        double[] baseFuel = new double[rocketTypes.length];
        double[][] typeCosts = new double[rocketTypes.length][];
        for (int r = 0; r < rocketTypes.length; r++) {
            int type = rocketTypes[r];
            if (type < 0 || type >= numTypes) {
                throw new ConfigurationException("Unknown type " + type + " for rocket " + r + ", expected 0 to " + (numTypes - 1));
            }
            capacities[r] = typeCapacities[type];
            baseFuel[r] = typeBaseFuel[type];
            typeCosts[r] = typeModuleCosts[type];
        }

        return ofModuleTypes(capacities, baseFuel, typeCosts, moduleAmounts);
    }

    /**
     * Checks dimensions and non-negativity of every field.
     *
     * @throws ConfigurationException on the first violation found
     */
    public void validate() {
        if (this.numRockets <= 0) {
            throw new ConfigurationException("Number of rockets must be positive: " + this.numRockets);
        }
        if (this.numModules <= 0) {
            throw new ConfigurationException("Number of modules must be positive: " + this.numModules);
        }
        if (this.capacities == null || this.capacities.length != this.numRockets) {
            throw new ConfigurationException("Expected " + this.numRockets + " capacities, got " + lengthOf(this.capacities));
        }
        if (this.baseFuel == null || this.baseFuel.length != this.numRockets) {
            throw new ConfigurationException("Expected " + this.numRockets + " base fuel values, got " + lengthOf(this.baseFuel));
        }
        if (this.costMatrix == null || this.costMatrix.length != this.numRockets) {
            throw new ConfigurationException("Expected " + this.numRockets + " cost matrix rows, got " + (this.costMatrix == null ? 0 : this.costMatrix.length));
        }

        for (int r = 0; r < this.numRockets; r++) {
            if (this.capacities[r] < 0) {
                throw new ConfigurationException("Negative capacity for rocket " + r + ": " + this.capacities[r]);
            }
            checkNonNegative(this.baseFuel[r], "base fuel for rocket " + r);

            if (this.costMatrix[r] == null || this.costMatrix[r].length != this.numModules) {
                throw new ConfigurationException("Cost matrix row " + r + " must have " + this.numModules + " entries, got " + lengthOf(this.costMatrix[r]));
            }
            for (int m = 0; m < this.numModules; m++) {
                checkNonNegative(this.costMatrix[r][m], "cost of module " + m + " on rocket " + r);
            }
        }
    }

    /**
     * @return sum of all rocket capacities, as a long since each capacity may be up to Integer.MAX_VALUE
     */
    public long totalCapacity() {
        long total = 0;
        for (int capacity : this.capacities) {
            total += capacity;
        }
        return total;
    }

    public int getNumRockets() {
        return this.numRockets;
    }

    public int getNumModules() {
        return this.numModules;
    }

    public int getCapacity(int rocket) {
        return this.capacities[rocket];
    }

    public int[] getCapacities() {
        return this.capacities.clone();
    }

    public double getBaseFuel(int rocket) {
        return this.baseFuel[rocket];
    }

    public double getCost(int rocket, int module) {
        return this.costMatrix[rocket][module];
    }

    @Override
    public String toString() {
        return "ProblemSettings{rockets=" + this.numRockets + ", modules=" + this.numModules
                + ", capacities=" + Arrays.toString(this.capacities) + ", baseFuel=" + Arrays.toString(this.baseFuel) + "}";
    }

    private static void checkNonNegative(double value, String what) {
        // NaN fails this check as well
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new ConfigurationException("Invalid " + what + ": " + value);
        }
    }

    private static int lengthOf(int[] array) {
        return array == null ? 0 : array.length;
    }

    private static int lengthOf(double[] array) {
        return array == null ? 0 : array.length;
    }
}
