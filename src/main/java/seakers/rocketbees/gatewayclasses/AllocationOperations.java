package seakers.rocketbees.gatewayclasses;

import seakers.rocketbees.model.ProblemSettings;
import seakers.rocketbees.search.BeesOptimizer;
import seakers.rocketbees.search.BeesParameters;
import seakers.rocketbees.search.BeesResult;

import java.util.ArrayList;

public class AllocationOperations {

    /**
     * Entry point for Python callers through py4j: set the problem, optionally tune the parameters, run for a seed and
     * read the best allocation back as plain lists
     */

    private ProblemSettings settings;
    private BeesParameters params;
    private BeesResult lastResult;
    private int runCount;

    public AllocationOperations() {
        this.params = new BeesParameters();
        this.runCount = 0;
    }

    // Run before run()
    public void setProblem(int numRockets, int numModules, ArrayList<Integer> capacities, ArrayList<Double> baseFuel, ArrayList<ArrayList<Double>> costMatrix) {
        int[] capacityArray = capacities.stream().mapToInt(i->i).toArray();
        double[] baseFuelArray = baseFuel.stream().mapToDouble(d->d).toArray();
        double[][] costArray = new double[costMatrix.size()][];
        for (int r = 0; r < costMatrix.size(); r++) {
            costArray[r] = costMatrix.get(r).stream().mapToDouble(d->d).toArray();
        }
        this.settings = new ProblemSettings(numRockets, numModules, capacityArray, baseFuelArray, costArray);
        this.lastResult = null;
    }

    // Module-type form of setProblem(), costs given per module type
    public void setProblemByModuleTypes(ArrayList<Integer> capacities, ArrayList<Double> baseFuel, ArrayList<ArrayList<Double>> typeCosts, ArrayList<Integer> moduleAmounts) {
        int[] capacityArray = capacities.stream().mapToInt(i->i).toArray();
        double[] baseFuelArray = baseFuel.stream().mapToDouble(d->d).toArray();
        double[][] typeCostArray = new double[typeCosts.size()][];
        for (int r = 0; r < typeCosts.size(); r++) {
            typeCostArray[r] = typeCosts.get(r).stream().mapToDouble(d->d).toArray();
        }
        this.settings = ProblemSettings.ofModuleTypes(capacityArray, baseFuelArray, typeCostArray, moduleAmounts.stream().mapToInt(i->i).toArray());
        this.lastResult = null;
    }

    // Rocket-type form of setProblem(), every rocket takes capacity, base fuel and module-type costs from its type
    public void setProblemByRocketTypes(ArrayList<Integer> rocketTypes, ArrayList<Integer> typeCapacities, ArrayList<Double> typeBaseFuel, ArrayList<ArrayList<Double>> typeModuleCosts, ArrayList<Integer> moduleAmounts) {
        double[][] typeCostArray = new double[typeModuleCosts.size()][];
        for (int k = 0; k < typeModuleCosts.size(); k++) {
            typeCostArray[k] = typeModuleCosts.get(k).stream().mapToDouble(d->d).toArray();
        }
        this.settings = ProblemSettings.ofRocketTypes(
                rocketTypes.stream().mapToInt(i->i).toArray(),
                typeCapacities.stream().mapToInt(i->i).toArray(),
                typeBaseFuel.stream().mapToDouble(d->d).toArray(),
                typeCostArray,
                moduleAmounts.stream().mapToInt(i->i).toArray());
        this.lastResult = null;
    }

    public void setSiteParameters(int populationSize, int numEliteSites, int numBestSites, int eliteBeesCount, int bestBeesCount) {
        this.params.setPopulationSize(populationSize);
        this.params.setNumEliteSites(numEliteSites);
        this.params.setNumBestSites(numBestSites);
        this.params.setEliteBeesCount(eliteBeesCount);
        this.params.setBestBeesCount(bestBeesCount);
    }

    public void setPatchParameters(double initialPatchSize, double patchDecayFactor) {
        this.params.setInitialPatchSize(initialPatchSize);
        this.params.setPatchDecayFactor(patchDecayFactor);
    }

    public void setStoppingParameters(int maxIterations, int stagnationLimit, int earlyStopIterations) {
        this.params.setMaxIterations(maxIterations);
        this.params.setStagnationLimit(stagnationLimit);
        this.params.setEarlyStopIterations(earlyStopIterations);
    }

    public void setNumThreads(int numThreads) {
        this.params.setNumThreads(numThreads);
    }

    public double run(long seed) {
        if (this.settings == null) {
            throw new IllegalStateException("Problem must be set before running");
        }
        BeesOptimizer optimizer = new BeesOptimizer(this.settings, this.params);
        this.lastResult = optimizer.run(seed);
        this.runCount++;

        System.out.println("Bees run complete. " + this.runCount + " (best fuel = " + this.lastResult.getBestFuel() + ")");
        return this.lastResult.getBestFuel();
    }

    // Get results (run run() before these)
    public double getBestFuel() {
        return requireResult().getBestFuel();
    }

    public ArrayList<Integer> getBestAllocation() {
        ArrayList<Integer> allocation = new ArrayList<>();
        for (int rocket : requireResult().getBestAllocation().toArray()) {
            allocation.add(rocket);
        }
        return allocation;
    }

    public ArrayList<Double> getHistory() {
        return new ArrayList<>(requireResult().getHistory());
    }

    public int getIterations() {
        return requireResult().getIterations();
    }

    public int getRunCount() {
        return this.runCount;
    }

    // Reset parameters and results, keeps the problem
    public void resetParameters() {
        this.params = new BeesParameters();
        this.lastResult = null;
    }

    private BeesResult requireResult() {
        if (this.lastResult == null) {
            throw new IllegalStateException("No run completed yet");
        }
        return this.lastResult;
    }
}
