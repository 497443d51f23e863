package seakers.rocketbees;

import seakers.rocketbees.model.ProblemSettings;
import seakers.rocketbees.moeaclasses.BeesAlgorithm;
import seakers.rocketbees.moeaclasses.RocketAllocationProblem;
import seakers.rocketbees.search.BeesParameters;
import seakers.rocketbees.search.BeesResult;

import java.util.concurrent.*;

public class BeesRun {

    public static ExecutorService pool;
    public static CompletionService<BeesResult> cs;

    public static void main(String[] args) throws InterruptedException, ExecutionException {

        int numCPU = 4;
        int numRuns = 10;

        pool = Executors.newFixedThreadPool(numCPU);
        cs = new ExecutorCompletionService<>(pool);

        // Fleet of four rockets, each of capacity 10; rockets 0 and 1 are of the first type, 2 and 3 of the second
        int[] rocketTypes = {0, 0, 1, 1};
        int[] typeCapacities = {10, 10};
        double[] typeBaseFuel = {39.9175704, 47.029129};
        double[][] typeModuleCosts = {
                {3.22714791, 6.39551519, 5.92349917, 3.02169468},
                {9.31912442, 8.56746934, 9.37825445, 1.80524675}};
        int[] moduleAmounts = {6, 15, 9, 5};

        ProblemSettings settings = ProblemSettings.ofRocketTypes(rocketTypes, typeCapacities, typeBaseFuel, typeModuleCosts, moduleAmounts);
        System.out.println(settings);

        // Algorithm parameters
        BeesParameters params = new BeesParameters(12, 3, 3, 2, 4, 1000);
        params.setStagnationLimit(25);
        params.setEarlyStopIterations(200);
        System.out.println(params);

        for (int i = 0; i < numRuns; i++) {
            BeesAlgorithm bees = new BeesAlgorithm(new RocketAllocationProblem(settings), params, i);
            cs.submit(new BeesSearch(bees, i));
        }

        BeesResult overallBest = null;
        for (int i = 0; i < numRuns; i++) {
            try {
                BeesResult result = cs.take().get();
                if (overallBest == null || result.getBestFuel() < overallBest.getBestFuel()) {
                    overallBest = result;
                }
            } catch (ExecutionException e) {
                pool.shutdownNow();
                throw e;
            }
        }

        pool.shutdown();

        System.out.println("Best over " + numRuns + " runs: " + overallBest);
    }
}
