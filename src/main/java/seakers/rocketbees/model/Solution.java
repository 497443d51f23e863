package seakers.rocketbees.model;

import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.MathArrays;

import java.util.ArrayList;
import java.util.List;

/**
 * An evaluated allocation. Solutions are immutable: perturbing one always yields a new instance.
 */
public final class Solution {

    /**
     * Draws per module when looking for a rocket other than the one the module already sits on
     */
    public static final int MAX_REASSIGN_ATTEMPTS = 8;

    private final Allocation allocation;
    private final double fuel;
    private final boolean feasible;

    private Solution(Allocation allocation, double fuel, boolean feasible) {
        this.allocation = allocation;
        this.fuel = fuel;
        this.feasible = feasible;
    }

    /**
     * Evaluates an allocation that must satisfy the capacity and coverage invariants.
     *
     * @throws AlgorithmInvariantException if the allocation is not feasible
     */
    public static Solution of(ProblemSettings settings, Allocation allocation) {
        if (!allocation.isFeasible(settings)) {
            throw new AlgorithmInvariantException("Allocation " + allocation + " violates capacity or coverage for " + settings);
        }
        return new Solution(allocation, allocation.evaluate(settings), true);
    }

    /**
     * Builds a random feasible solution: modules are visited in shuffled order and each one goes to a rocket drawn
     * uniformly among those with room left.
     */
    public static Solution generateRandom(ProblemSettings settings, RandomGenerator rng) {
        int numModules = settings.getNumModules();
        int[] remaining = settings.getCapacities();
        int[] assignment = new int[numModules];

        int[] moduleOrder = new int[numModules];
        for (int m = 0; m < numModules; m++) {
            moduleOrder[m] = m;
        }
        MathArrays.shuffle(moduleOrder, rng);

        List<Integer> open = new ArrayList<>(remaining.length);
        for (int module : moduleOrder) {
            open.clear();
            for (int r = 0; r < remaining.length; r++) {
                if (remaining[r] > 0) {
                    open.add(r);
                }
            }
            if (open.isEmpty()) {
                throw new AlgorithmInvariantException("No rocket has room left for module " + module);
            }
            int rocket = open.get(rng.nextInt(open.size()));
            assignment[module] = rocket;
            remaining[rocket]--;
        }

        return of(settings, new Allocation(assignment));
    }

    /**
     * Produces a new solution by moving up to patchSize distinct modules, drawn uniformly, to rockets with spare
     * capacity. All picked modules are lifted off first; each is then placed on a rocket with room, preferring one other
     * than its current rocket. After {@link #MAX_REASSIGN_ATTEMPTS} draws that land on the same rocket the module keeps
     * its original placement.
     */
    public Solution neighbor(ProblemSettings settings, int patchSize, RandomGenerator rng) {
        int numModules = this.allocation.getNumModules();
        int[] assignment = this.allocation.toArray();
        int movable = Math.min(patchSize, numModules);
        if (movable <= 0) {
            return new Solution(new Allocation(assignment), this.fuel, this.feasible);
        }

        int numRockets = settings.getNumRockets();
        int[] loads = this.allocation.rocketLoads(numRockets);
        int[] picked = new RandomDataGenerator(rng).nextPermutation(numModules, movable);
        for (int module : picked) {
            loads[assignment[module]]--;
        }

        List<Integer> open = new ArrayList<>(numRockets);
        for (int module : picked) {
            int current = assignment[module];
            open.clear();
            for (int r = 0; r < numRockets; r++) {
                if (loads[r] < settings.getCapacity(r)) {
                    open.add(r);
                }
            }
            if (open.isEmpty()) {
                throw new AlgorithmInvariantException("No rocket has room left to reinsert module " + module);
            }

            int target = -1;
            for (int attempt = 0; attempt < MAX_REASSIGN_ATTEMPTS; attempt++) {
                int candidate = open.get(rng.nextInt(open.size()));
                if (candidate != current) {
                    target = candidate;
                    break;
                }
            }
            if (target < 0) {
                // every draw hit the current rocket, which is therefore open
                target = current;
            }

            assignment[module] = target;
            loads[target]++;
        }

        return of(settings, new Allocation(assignment));
    }

    public Allocation getAllocation() {
        return this.allocation;
    }

    public double getFuel() {
        return this.fuel;
    }

    public boolean isFeasible() {
        return this.feasible;
    }

    @Override
    public String toString() {
        return "Solution{fuel=" + this.fuel + ", allocation=" + this.allocation + "}";
    }
}
