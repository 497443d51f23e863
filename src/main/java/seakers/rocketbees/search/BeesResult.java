package seakers.rocketbees.search;

import seakers.rocketbees.model.Allocation;
import seakers.rocketbees.model.Solution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one bees run: the best solution seen, and the best fuel after every iteration
 */
public class BeesResult {

    private final long seed;
    private final Solution best;
    private final List<Double> history;
    private final int iterations;
    private final long evaluations;

    public BeesResult(long seed, Solution best, List<Double> history, int iterations, long evaluations) {
        this.seed = seed;
        this.best = best;
        this.history = Collections.unmodifiableList(new ArrayList<>(history));
        this.iterations = iterations;
        this.evaluations = evaluations;
    }

    public long getSeed() {
        return this.seed;
    }

    public Solution getBest() {
        return this.best;
    }

    public Allocation getBestAllocation() {
        return this.best.getAllocation();
    }

    public double getBestFuel() {
        return this.best.getFuel();
    }

    public List<Double> getHistory() {
        return this.history;
    }

    public int getIterations() {
        return this.iterations;
    }

    public long getEvaluations() {
        return this.evaluations;
    }

    @Override
    public String toString() {
        return "BeesResult{seed=" + this.seed + ", bestFuel=" + getBestFuel() + ", iterations=" + this.iterations
                + ", evaluations=" + this.evaluations + ", allocation=" + getBestAllocation() + "}";
    }
}
