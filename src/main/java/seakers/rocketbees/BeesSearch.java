package seakers.rocketbees;

import seakers.rocketbees.moeaclasses.BeesAlgorithm;
import seakers.rocketbees.search.BeesResult;

import java.util.concurrent.Callable;

public class BeesSearch implements Callable<BeesResult> {
    private final BeesAlgorithm algorithm;
    private final int runNumber;

    public BeesSearch(BeesAlgorithm algorithm, int runNumber) {
        this.algorithm = algorithm;
        this.runNumber = runNumber;
    }

    @Override
    public BeesResult call() {
        System.out.println("Starting Bees Run " + runNumber);

        long startTime = System.currentTimeMillis();
        while (!algorithm.isTerminated()) {
            algorithm.step();
        }
        long endTime = System.currentTimeMillis();

        BeesResult result = algorithm.getColony().toResult();

        System.out.println("Run " + runNumber + " finished. NFE = " + algorithm.getNumberOfEvaluations() + ", iterations = " + result.getIterations());
        System.out.println("Run " + runNumber + " best fuel = " + result.getBestFuel() + ", allocation = " + result.getBestAllocation());
        System.out.println("Total Execution Time: " + ((endTime - startTime)/1000.0) + " s");

        return result;
    }

    public int getRunNumber() {
        return runNumber;
    }
}
