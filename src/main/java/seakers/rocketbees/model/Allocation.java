package seakers.rocketbees.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable assignment of every module to exactly one rocket. Entry m of the backing array holds the rocket index
 * carrying module m.
 */
public final class Allocation {

    private final int[] rocketOfModule;

    public Allocation(int[] rocketOfModule) {
        if (rocketOfModule == null) {
            throw new IllegalArgumentException("Allocation array is required");
        }
        this.rocketOfModule = rocketOfModule.clone();
    }

    public int getRocket(int module) {
        return this.rocketOfModule[module];
    }

    public int getNumModules() {
        return this.rocketOfModule.length;
    }

    public int[] toArray() {
        return this.rocketOfModule.clone();
    }

    /**
     * Counts modules per rocket. Entries outside [0, numRockets) are ignored.
     */
    public int[] rocketLoads(int numRockets) {
        int[] loads = new int[numRockets];
        for (int rocket : this.rocketOfModule) {
            if (rocket >= 0 && rocket < numRockets) {
                loads[rocket]++;
            }
        }
        return loads;
    }

    public List<Integer> modulesOn(int rocket) {
        List<Integer> modules = new ArrayList<>();
        for (int m = 0; m < this.rocketOfModule.length; m++) {
            if (this.rocketOfModule[m] == rocket) {
                modules.add(m);
            }
        }
        return modules;
    }

    /**
     * Total fuel burned by this allocation. Rockets carrying no module contribute nothing.
     */
    public double evaluate(ProblemSettings settings) {
        int numRockets = settings.getNumRockets();
        double[] rocketFuel = new double[numRockets];
        boolean[] used = new boolean[numRockets];

        for (int m = 0; m < this.rocketOfModule.length; m++) {
            int rocket = this.rocketOfModule[m];
            rocketFuel[rocket] += settings.getCost(rocket, m);
            used[rocket] = true;
        }

        // summed per rocket in index order so the result does not depend on module order
        double fuel = 0.0;
        for (int r = 0; r < numRockets; r++) {
            if (used[r]) {
                fuel += settings.getBaseFuel(r) + rocketFuel[r];
            }
        }
        return fuel;
    }

    /**
     * True when every module sits on a valid rocket and no rocket exceeds its capacity.
     */
    public boolean isFeasible(ProblemSettings settings) {
        if (this.rocketOfModule.length != settings.getNumModules()) {
            return false;
        }
        int[] loads = new int[settings.getNumRockets()];
        for (int rocket : this.rocketOfModule) {
            if (rocket < 0 || rocket >= settings.getNumRockets()) {
                return false;
            }
            loads[rocket]++;
        }
        for (int r = 0; r < loads.length; r++) {
            if (loads[r] > settings.getCapacity(r)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Allocation)) {
            return false;
        }
        return Arrays.equals(this.rocketOfModule, ((Allocation) o).rocketOfModule);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(this.rocketOfModule);
    }

    @Override
    public String toString() {
        return Arrays.toString(this.rocketOfModule);
    }
}
