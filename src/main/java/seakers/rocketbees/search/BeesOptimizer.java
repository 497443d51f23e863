package seakers.rocketbees.search;

import seakers.rocketbees.model.ConfigurationException;
import seakers.rocketbees.model.ProblemSettings;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Bees algorithm for the module-to-rocket allocation problem. The same settings, parameters and seed always give the
 * same result, whatever the number of worker threads.
 */
public class BeesOptimizer {

    private final ProblemSettings settings;
    private final BeesParameters params;

    /**
     * @throws ConfigurationException if the settings or parameters are invalid
     */
    public BeesOptimizer(ProblemSettings settings, BeesParameters params) {
        if (settings == null) {
            throw new ConfigurationException("Problem settings are required");
        }
        if (params == null) {
            throw new ConfigurationException("Bees parameters are required");
        }
        settings.validate();
        this.settings = settings;
        this.params = new BeesParameters(params);
        this.params.validate();
    }

    /**
     * Runs the search to completion
     *
     * @param seed seed of the run's random generator
     * @return best solution found, its fuel and the best fuel after every iteration
     */
    public BeesResult run(long seed) {
        ExecutorService pool = null;
        if (this.params.getNumThreads() > 1) {
            pool = Executors.newFixedThreadPool(this.params.getNumThreads());
        }

        try {
            BeesColony colony = newColony(seed, pool);
            colony.scout();
            while (!colony.isFinished()) {
                colony.iterate();
            }
            return colony.toResult();
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }
    }

    /**
     * Creates the state of a new run, for callers that step through iterations themselves
     *
     * @param pool worker pool for site searches, or null to search on the calling thread
     */
    public BeesColony newColony(long seed, ExecutorService pool) {
        return new BeesColony(this.settings, this.params, seed, pool);
    }

    public ProblemSettings getSettings() {
        return this.settings;
    }

    public BeesParameters getParameters() {
        return new BeesParameters(this.params);
    }
}
