package seakers.rocketbees.search;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import seakers.rocketbees.model.ProblemSettings;
import seakers.rocketbees.model.Solution;

import java.util.concurrent.Callable;

/**
 * Local search around one site: spawns a number of neighbours of the site's solution and returns the cheapest.
 * Each site search owns its random generator, seeded by the colony, so sites can run on any thread without changing
 * the outcome of a run.
 */
public class SiteSearch implements Callable<Solution> {

    private final ProblemSettings settings;
    private final Solution site;
    private final int beesCount;
    private final int patchSize;
    private final long seed;

    public SiteSearch(ProblemSettings settings, Solution site, int beesCount, int patchSize, long seed) {
        this.settings = settings;
        this.site = site;
        this.beesCount = beesCount;
        this.patchSize = patchSize;
        this.seed = seed;
    }

    /**
     * @return the cheapest neighbour, first one on ties, or null when no bees are sent to this site
     */
    @Override
    public Solution call() {
        RandomGenerator rng = new MersenneTwister(this.seed);
        Solution bestNeighbor = null;
        for (int i = 0; i < this.beesCount; i++) {
            Solution neighbor = this.site.neighbor(this.settings, this.patchSize, rng);
            if (bestNeighbor == null || neighbor.getFuel() < bestNeighbor.getFuel()) {
                bestNeighbor = neighbor;
            }
        }
        return bestNeighbor;
    }

    public Solution getSite() {
        return this.site;
    }

    public int getBeesCount() {
        return this.beesCount;
    }
}
