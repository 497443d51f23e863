package seakers.rocketbees.search;

import seakers.rocketbees.model.ConfigurationException;

/**
 * Tuning parameters of the bees algorithm. Defaults match the reference example instance.
 */
public class BeesParameters {

    private int populationSize = 12;
    private int numEliteSites = 3;
    private int numBestSites = 3;
    private int eliteBeesCount = 2; // neighbours spawned around each elite site
    private int bestBeesCount = 4; // neighbours spawned around each other best site
    private double initialPatchSize = 5.0;
    private double patchDecayFactor = 0.98;
    private double minPatchSize = 1.0;
    private int stagnationLimit = 10;
    private int maxIterations = 1000;
    private int earlyStopIterations = 0; // 0 -> run until maxIterations
    private int numThreads = 1;

    public BeesParameters() {
    }

    public BeesParameters(int populationSize, int numEliteSites, int numBestSites, int eliteBeesCount, int bestBeesCount, int maxIterations) {
        this.populationSize = populationSize;
        this.numEliteSites = numEliteSites;
        this.numBestSites = numBestSites;
        this.eliteBeesCount = eliteBeesCount;
        this.bestBeesCount = bestBeesCount;
        this.maxIterations = maxIterations;
    }

    public BeesParameters(BeesParameters other) {
        this.populationSize = other.populationSize;
        this.numEliteSites = other.numEliteSites;
        this.numBestSites = other.numBestSites;
        this.eliteBeesCount = other.eliteBeesCount;
        this.bestBeesCount = other.bestBeesCount;
        this.initialPatchSize = other.initialPatchSize;
        this.patchDecayFactor = other.patchDecayFactor;
        this.minPatchSize = other.minPatchSize;
        this.stagnationLimit = other.stagnationLimit;
        this.maxIterations = other.maxIterations;
        this.earlyStopIterations = other.earlyStopIterations;
        this.numThreads = other.numThreads;
    }

    /**
     * @throws ConfigurationException if any parameter is out of range
     */
    public void validate() {
        if (populationSize < 1) throw new ConfigurationException("Invalid populationSize: " + populationSize);
        if (numEliteSites < 0) throw new ConfigurationException("Invalid numEliteSites: " + numEliteSites);
        if (numBestSites < 0) throw new ConfigurationException("Invalid numBestSites: " + numBestSites);
        if (numEliteSites + numBestSites > populationSize) {
            throw new ConfigurationException("numEliteSites + numBestSites (" + (numEliteSites + numBestSites) + ") exceeds populationSize " + populationSize);
        }
        if (eliteBeesCount < 0) throw new ConfigurationException("Invalid eliteBeesCount: " + eliteBeesCount);
        if (bestBeesCount < 0) throw new ConfigurationException("Invalid bestBeesCount: " + bestBeesCount);
        if (!(minPatchSize >= 1.0)) throw new ConfigurationException("Invalid minPatchSize: " + minPatchSize);
        if (!(initialPatchSize >= minPatchSize)) {
            throw new ConfigurationException("initialPatchSize " + initialPatchSize + " is below minPatchSize " + minPatchSize);
        }
        if (!(patchDecayFactor > 0.0 && patchDecayFactor <= 1.0)) {
            throw new ConfigurationException("patchDecayFactor must be in (0, 1]: " + patchDecayFactor);
        }
        if (stagnationLimit < 1) throw new ConfigurationException("Invalid stagnationLimit: " + stagnationLimit);
        if (maxIterations < 0) throw new ConfigurationException("Invalid maxIterations: " + maxIterations);
        if (earlyStopIterations < 0) throw new ConfigurationException("Invalid earlyStopIterations: " + earlyStopIterations);
        if (numThreads < 1) throw new ConfigurationException("Invalid numThreads: " + numThreads);
    }

    public int getPopulationSize() {
        return populationSize;
    }

    public void setPopulationSize(int populationSize) {
        this.populationSize = populationSize;
    }

    public int getNumEliteSites() {
        return numEliteSites;
    }

    public void setNumEliteSites(int numEliteSites) {
        this.numEliteSites = numEliteSites;
    }

    public int getNumBestSites() {
        return numBestSites;
    }

    public void setNumBestSites(int numBestSites) {
        this.numBestSites = numBestSites;
    }

    public int getEliteBeesCount() {
        return eliteBeesCount;
    }

    public void setEliteBeesCount(int eliteBeesCount) {
        this.eliteBeesCount = eliteBeesCount;
    }

    public int getBestBeesCount() {
        return bestBeesCount;
    }

    public void setBestBeesCount(int bestBeesCount) {
        this.bestBeesCount = bestBeesCount;
    }

    public double getInitialPatchSize() {
        return initialPatchSize;
    }

    public void setInitialPatchSize(double initialPatchSize) {
        this.initialPatchSize = initialPatchSize;
    }

    public double getPatchDecayFactor() {
        return patchDecayFactor;
    }

    public void setPatchDecayFactor(double patchDecayFactor) {
        this.patchDecayFactor = patchDecayFactor;
    }

    public double getMinPatchSize() {
        return minPatchSize;
    }

    public void setMinPatchSize(double minPatchSize) {
        this.minPatchSize = minPatchSize;
    }

    public int getStagnationLimit() {
        return stagnationLimit;
    }

    public void setStagnationLimit(int stagnationLimit) {
        this.stagnationLimit = stagnationLimit;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public int getEarlyStopIterations() {
        return earlyStopIterations;
    }

    public void setEarlyStopIterations(int earlyStopIterations) {
        this.earlyStopIterations = earlyStopIterations;
    }

    public int getNumThreads() {
        return numThreads;
    }

    public void setNumThreads(int numThreads) {
        this.numThreads = numThreads;
    }

    @Override
    public String toString() {
        return "BeesParameters {\n"
                + "  populationSize = " + populationSize + ",\n"
                + "  numEliteSites = " + numEliteSites + ",\n"
                + "  numBestSites = " + numBestSites + ",\n"
                + "  eliteBeesCount = " + eliteBeesCount + ",\n"
                + "  bestBeesCount = " + bestBeesCount + ",\n"
                + "  initialPatchSize = " + initialPatchSize + ",\n"
                + "  patchDecayFactor = " + patchDecayFactor + ",\n"
                + "  minPatchSize = " + minPatchSize + ",\n"
                + "  stagnationLimit = " + stagnationLimit + ",\n"
                + "  maxIterations = " + maxIterations + ",\n"
                + "  earlyStopIterations = " + earlyStopIterations + ",\n"
                + "  numThreads = " + numThreads + "\n"
                + "}";
    }
}
